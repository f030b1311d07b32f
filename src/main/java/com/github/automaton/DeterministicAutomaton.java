package com.github.automaton;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.github.automaton.AutomatonException.Code;

/**
 * A deterministic finite automaton. This is not a different model, it's a
 * {@link NondeterministicAutomaton} that was additionally found to be deterministic when built:
 * no empty string transitions, exactly one destination per transition and a transition for every
 * (state, symbol) pair over the alphabet. If that check fails the constructor throws
 * {@link Code#NOT_DETERMINISTIC} and the instance is never handed out.
 */
public final class DeterministicAutomaton<S, Y> extends NondeterministicAutomaton<S, Y> {

  DeterministicAutomaton(final Set<S> states, final Set<Y> alphabet,
      final TransitionSpec<S, Y> transitionSpec, final S start, final Set<S> accept,
      final AutomatonConfiguration<Y> config) throws AutomatonException {
    super(states, alphabet, transitionSpec, start, accept, config);
    if (!isDeterministic()) {
      final String message = "Automaton is not deterministic: " + getTransitions();
      logError(getId(), message);
      throw new AutomatonException(Code.NOT_DETERMINISTIC, message);
    }
  }

  /**
   * The unique destination of the state on the symbol. Empty only for a symbol outside the
   * alphabet or a state outside the state set.
   */
  public Optional<S> next(final S state, final Y symbol) {
    final Iterator<S> destinations = getTransitions().destinations(state, symbol).iterator();
    return destinations.hasNext() ? Optional.of(destinations.next()) : Optional.empty();
  }

  /**
   * Walks a single current state instead of a state set. Gives the same answer as the
   * nondeterministic simulation since there is nothing to close over and nothing to branch on.
   */
  @Override
  public boolean accepts(final Iterable<? extends Y> symbols) {
    Objects.requireNonNull(symbols, "symbols");
    S current = getStart();
    for (Y symbol : symbols) {
      final Optional<S> next = next(current, symbol);
      if (!next.isPresent()) {
        return false;
      }
      current = next.get();
    }
    return getAccept().contains(current);
  }
}
