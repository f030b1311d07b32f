package com.github.automaton;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.github.automaton.AutomatonException.Code;

/**
 * Canonical, immutable transition function. Symbol transitions map (state, symbol) to a set of
 * destination states and only ever carry real symbols; empty string transitions map a state to
 * its destinations and are kept apart. Absent keys mean "no transition".
 */
public final class TransitionTable<S, Y> {
  private final Map<TransitionKey<S, Y>, Set<S>> table;
  private final Map<S, Set<S>> epsilon;

  private TransitionTable(final Map<TransitionKey<S, Y>, Set<S>> table,
      final Map<S, Set<S>> epsilon) {
    this.table = Collections.unmodifiableMap(table);
    this.epsilon = Collections.unmodifiableMap(epsilon);
  }

  /**
   * Normalize a raw spec into a fresh table. Every entry must destructure into a non-null state
   * and symbol with a non-null destination collection, otherwise this fails with
   * {@link Code#INVALID_TRANSITION_FORMAT}. Destinations collapse into a set; a symbol spelling
   * the empty string per the configuration becomes an empty string transition; a later entry
   * for the same key replaces an earlier one. No cross-referencing against states or alphabet
   * happens here.
   */
  public static <S, Y> TransitionTable<S, Y> normalize(final TransitionSpec<S, Y> spec,
      final Set<Y> alphabet, final AutomatonConfiguration<Y> config)
      throws AutomatonException {
    final AutomatonConfiguration<Y> configuration =
        config == null ? AutomatonConfiguration.defaults() : config;
    final Map<TransitionKey<S, Y>, Set<S>> table = new LinkedHashMap<>();
    final Map<S, Set<S>> epsilon = new LinkedHashMap<>();
    if (spec == null) {
      return new TransitionTable<>(table, epsilon);
    }
    spec.forEach((key, destinations) -> {
      if (key == null || key.getState() == null || key.getSymbol() == null) {
        throw new AutomatonException(Code.INVALID_TRANSITION_FORMAT,
            "Transition must be keyed by a (state, symbol) pair, found: " + key);
      }
      if (destinations == null || containsNull(destinations)) {
        throw new AutomatonException(Code.INVALID_TRANSITION_FORMAT,
            "Transition " + key + " must lead to non-null destinations, found: " + destinations);
      }
      final Set<S> copy = Collections.unmodifiableSet(new LinkedHashSet<S>(destinations));
      if (configuration.isEmptyString(key.getSymbol(), alphabet)) {
        epsilon.put(key.getState(), copy);
      } else {
        table.put(key, copy);
      }
    });
    return new TransitionTable<>(table, epsilon);
  }

  public static <S, Y> TransitionTable<S, Y> empty() {
    return new TransitionTable<>(new LinkedHashMap<>(), new LinkedHashMap<>());
  }

  private static boolean containsNull(final Collection<?> destinations) {
    for (Object destination : destinations) {
      if (destination == null) {
        return true;
      }
    }
    return false;
  }

  /**
   * Destinations for the key, or an empty set when there is no such transition.
   */
  public Set<S> destinations(final S state, final Y symbol) {
    final Set<S> destinations = table.get(TransitionKey.of(state, symbol));
    return destinations == null ? Collections.emptySet() : destinations;
  }

  /**
   * Empty string destinations of the state, or an empty set when it has none.
   */
  public Set<S> epsilonDestinations(final S state) {
    final Set<S> destinations = epsilon.get(state);
    return destinations == null ? Collections.emptySet() : destinations;
  }

  public boolean contains(final S state, final Y symbol) {
    return table.containsKey(TransitionKey.of(state, symbol));
  }

  public boolean containsEpsilon(final S state) {
    return epsilon.containsKey(state);
  }

  /**
   * Symbol transitions only.
   */
  public Map<TransitionKey<S, Y>, Set<S>> asMap() {
    return table;
  }

  public Map<S, Set<S>> epsilonMap() {
    return epsilon;
  }

  public int size() {
    return table.size() + epsilon.size();
  }

  public boolean isEmpty() {
    return table.isEmpty() && epsilon.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransitionTable)) {
      return false;
    }
    final TransitionTable<?, ?> other = (TransitionTable<?, ?>) o;
    return table.equals(other.table) && epsilon.equals(other.epsilon);
  }

  @Override
  public int hashCode() {
    return Objects.hash(table, epsilon);
  }

  @Override
  public String toString() {
    return "TransitionTable [symbols=" + table + ", epsilon=" + epsilon + "]";
  }
}
