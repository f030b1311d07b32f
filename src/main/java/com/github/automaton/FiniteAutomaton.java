package com.github.automaton;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.github.automaton.AutomatonException.Code;

/**
 * A finite automaton over states of type {@code S} and symbols of type {@code Y}, possibly with
 * empty string transitions. States and symbols are opaque: only equals() and hashCode() are ever
 * used on them. Neither may be null; null members are refused when building.
 * 
 * Notes for users:<br>
 * 1. an automaton is fully validated when built; an invalid definition fails with an
 * {@link AutomatonException} and no instance is ever handed out<br>
 * 
 * 2. once built, an automaton is immutable and every query allocates its own working sets, so a
 * single instance can be queried from any number of threads without locking<br>
 * 
 * 3. it is not a singleton in any sense; there is no process wide state, build as many as
 * needed<br>
 * 
 * 4. use {@link AutomatonBuilder#buildDeterministic()} to additionally insist on a DFA<br>
 */
public interface FiniteAutomaton<S, Y> {

  ///// Query API /////
  /**
   * Decide whether the sequence of symbols is in the language of this automaton. A symbol
   * outside the alphabet is not an error, it just has no transitions and so rejects.
   */
  boolean accepts(final Iterable<? extends Y> symbols);

  /**
   * All states reachable from the given states using zero or more empty string transitions,
   * including the given states themselves.
   */
  Set<S> epsilonClosure(final Set<S> states);

  /**
   * The union of the destinations of every given state on the symbol. Empty string transitions
   * are not followed.
   */
  Set<S> transition(final Set<S> states, final Y symbol);

  /**
   * True iff there are no empty string transitions, every transition has exactly one destination
   * and every (state, symbol) pair over the alphabet has a transition.
   */
  boolean isDeterministic();


  ///// Definition /////
  String getId();

  Set<S> getStates();

  Set<Y> getAlphabet();

  TransitionTable<S, Y> getTransitions();

  S getStart();

  Set<S> getAccept();

  /**
   * The configured empty string marker, empty when the default spelling is in effect.
   */
  Optional<Y> getEmptyString();

  AutomatonConfiguration<Y> getConfiguration();

  /**
   * Human readable 5-tuple plus the empty string marker. Meant for debugging, not persistence.
   */
  String render();

  /**
   * Split a string into its characters, for automata whose symbols are {@link Character}s.
   */
  static List<Character> characters(final CharSequence string) {
    final List<Character> symbols = new ArrayList<>(string.length());
    for (int i = 0; i < string.length(); i++) {
      symbols.add(string.charAt(i));
    }
    return symbols;
  }

  /**
   * A simple builder to let users use fluent APIs to build automata.
   */
  public final static class AutomatonBuilder<S, Y> {
    private final Set<S> states = new LinkedHashSet<>();
    private final Set<Y> alphabet = new LinkedHashSet<>();
    private final Set<S> accept = new LinkedHashSet<>();
    private TransitionSpec<S, Y> transitions = TransitionSpec.none();
    private S start;
    private AutomatonConfiguration<Y> config;
    private Y emptyString;
    private final StringBuilder problems = new StringBuilder();

    public static <S, Y> AutomatonBuilder<S, Y> newBuilder() {
      return new AutomatonBuilder<>();
    }

    public AutomatonBuilder<S, Y> states(final Iterable<? extends S> states) {
      addAll(this.states, states, "states");
      return this;
    }

    @SafeVarargs
    public final AutomatonBuilder<S, Y> states(final S... states) {
      return states(Arrays.asList(states));
    }

    public AutomatonBuilder<S, Y> alphabet(final Iterable<? extends Y> alphabet) {
      addAll(this.alphabet, alphabet, "alphabet");
      return this;
    }

    @SafeVarargs
    public final AutomatonBuilder<S, Y> alphabet(final Y... alphabet) {
      return alphabet(Arrays.asList(alphabet));
    }

    public AutomatonBuilder<S, Y> transitions(final TransitionSpec<S, Y> transitions) {
      this.transitions = transitions;
      return this;
    }

    public AutomatonBuilder<S, Y> start(final S start) {
      this.start = start;
      return this;
    }

    public AutomatonBuilder<S, Y> accept(final Iterable<? extends S> accept) {
      addAll(this.accept, accept, "accept");
      return this;
    }

    @SafeVarargs
    public final AutomatonBuilder<S, Y> accept(final S... accept) {
      return accept(Arrays.asList(accept));
    }

    public AutomatonBuilder<S, Y> config(final AutomatonConfiguration<Y> config) {
      this.config = config;
      return this;
    }

    /**
     * Override the empty string marker of whatever configuration is in effect.
     */
    public AutomatonBuilder<S, Y> emptyString(final Y emptyString) {
      this.emptyString = emptyString;
      return this;
    }

    public NondeterministicAutomaton<S, Y> build() throws AutomatonException {
      return new NondeterministicAutomaton<>(states, alphabet, transitions, start, accept,
          resolveConfig());
    }

    public DeterministicAutomaton<S, Y> buildDeterministic() throws AutomatonException {
      return new DeterministicAutomaton<>(states, alphabet, transitions, start, accept,
          resolveConfig());
    }

    private AutomatonConfiguration<Y> resolveConfig() throws AutomatonException {
      if (problems.length() > 0) {
        throw new AutomatonException(Code.INVALID_AUTOMATON_CONFIG, problems.toString().trim());
      }
      final AutomatonConfiguration<Y> base =
          config == null ? AutomatonConfiguration.defaults() : config;
      if (emptyString == null) {
        return base;
      }
      return AutomatonConfiguration.AutomatonConfigurationBuilder.<Y>newBuilder()
          .emptyString(emptyString).epsilonShorthand(base.getEpsilonShorthand()).build();
    }

    private <T> void addAll(final Set<T> target, final Iterable<? extends T> source,
        final String what) {
      if (source == null) {
        return;
      }
      for (T element : source) {
        if (element == null) {
          problems.append("Null is not a valid member of ").append(what).append(". ");
        } else {
          target.add(element);
        }
      }
    }

    private AutomatonBuilder() {}
  }

}
