package com.github.automaton;

import java.util.Optional;
import java.util.Set;

/**
 * This class encapsulates the configuration parameters of an automaton. Use the
 * {@code AutomatonConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. Empty string transitions are kept apart from symbol transitions, so the marker is only a
 * spelling used in the raw input. With no marker configured, the string {@link #DEFAULT_EMPTY_STRING}
 * (backslash-e) is the spelling; it can only occur on automata whose symbols are strings.<br>
 * 2. With the epsilon shorthand enabled (the default), a transition on the literal symbol
 * {@code e} is read as an empty string transition whenever {@code e} is not itself part of the
 * alphabet. If the alphabet contains {@code e}, the shorthand silently turns itself off.<br>
 * 3. A marker that is also an alphabet symbol is refused when the automaton is built.<br>
 */
public final class AutomatonConfiguration<Y> {
  public static final String DEFAULT_EMPTY_STRING = "\\e";

  private final Optional<Y> emptyString;
  private final boolean epsilonShorthand;

  /**
   * The configured marker, empty when the default spelling is in effect.
   */
  public Optional<Y> getEmptyString() {
    return emptyString;
  }

  public boolean getEpsilonShorthand() {
    return epsilonShorthand;
  }

  /**
   * True iff the raw symbol spells the empty string: the marker itself, or the shorthand
   * {@code e} when the alphabet doesn't claim it.
   */
  boolean isEmptyString(final Object symbol, final Set<Y> alphabet) {
    if (isMarker(symbol)) {
      return true;
    }
    return epsilonShorthand && isShorthand(symbol) && !alphabet.contains(symbol);
  }

  /**
   * True iff the symbol is the marker, or the default spelling when no marker is set.
   */
  boolean isMarker(final Object symbol) {
    return emptyString.isPresent() ? emptyString.get().equals(symbol)
        : DEFAULT_EMPTY_STRING.equals(symbol);
  }

  /**
   * Printable spelling of the empty string.
   */
  String spelling() {
    return emptyString.isPresent() ? String.valueOf(emptyString.get()) : DEFAULT_EMPTY_STRING;
  }

  private static boolean isShorthand(final Object symbol) {
    return "e".equals(symbol) || Character.valueOf('e').equals(symbol);
  }

  /**
   * Configuration with the default spelling and the shorthand enabled.
   */
  public static <Y> AutomatonConfiguration<Y> defaults() {
    return new AutomatonConfiguration<>(Optional.<Y>empty(), true);
  }

  public final static class AutomatonConfigurationBuilder<Y> {
    private Optional<Y> emptyString = Optional.empty();
    private boolean emptyStringSet;
    private boolean epsilonShorthand = true;

    public static <Y> AutomatonConfigurationBuilder<Y> newBuilder() {
      return new AutomatonConfigurationBuilder<>();
    }

    public AutomatonConfigurationBuilder<Y> emptyString(final Y emptyString) {
      this.emptyString = Optional.ofNullable(emptyString);
      this.emptyStringSet = true;
      return this;
    }

    public AutomatonConfigurationBuilder<Y> epsilonShorthand(final boolean epsilonShorthand) {
      this.epsilonShorthand = epsilonShorthand;
      return this;
    }

    public AutomatonConfiguration<Y> build() throws AutomatonException {
      final StringBuilder messages = new StringBuilder();
      if (emptyStringSet && !emptyString.isPresent()) {
        messages.append("Empty string marker cannot be null. ");
      }
      if (messages.length() > 0) {
        throw new AutomatonException(AutomatonException.Code.INVALID_AUTOMATON_CONFIG,
            messages.toString().trim());
      }
      return new AutomatonConfiguration<>(emptyString, epsilonShorthand);
    }

    private AutomatonConfigurationBuilder() {}
  }

  /**
   * The marker must not be confused with a real symbol.
   */
  void validate(final Set<Y> alphabet) throws AutomatonException {
    for (Y symbol : alphabet) {
      if (isMarker(symbol)) {
        throw new AutomatonException(AutomatonException.Code.INVALID_AUTOMATON_CONFIG,
            "Empty string marker " + spelling() + " cannot also be an alphabet symbol");
      }
    }
  }

  @Override
  public String toString() {
    return "AutomatonConfiguration [emptyString=" + spelling() + ", epsilonShorthand="
        + epsilonShorthand + "]";
  }

  private AutomatonConfiguration(final Optional<Y> emptyString, final boolean epsilonShorthand) {
    this.emptyString = emptyString;
    this.epsilonShorthand = epsilonShorthand;
  }

}
