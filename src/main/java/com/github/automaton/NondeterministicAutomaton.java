package com.github.automaton;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonException.Code;

/**
 * A nondeterministic finite automaton with empty string transitions, simulated by tracking the
 * set of states it could be in.
 * 
 * Notes for users:<br>
 * 1. this instance is thread-safe; nothing is mutated after the constructor returns<br>
 * 
 * 2. the constructor either produces a fully validated automaton or throws; validation stops at
 * the first violation found, checking in this order: empty string marker, transition format,
 * start state, accept states, then transition states, transition symbols and transition
 * destinations, each across all transitions<br>
 * 
 * 3. all sets keep first-insertion order so that {@link #render()} is stable<br>
 */
public class NondeterministicAutomaton<S, Y> implements FiniteAutomaton<S, Y> {
  private static final Logger logger =
      LogManager.getLogger(NondeterministicAutomaton.class.getSimpleName());

  private final String automatonId = UUID.randomUUID().toString();

  private final Set<S> states;
  private final Set<Y> alphabet;
  private final TransitionTable<S, Y> transitions;
  private final S start;
  private final Set<S> accept;
  private final AutomatonConfiguration<Y> config;

  NondeterministicAutomaton(final Set<S> states, final Set<Y> alphabet,
      final TransitionSpec<S, Y> transitionSpec, final S start, final Set<S> accept,
      final AutomatonConfiguration<Y> config) throws AutomatonException {
    this.states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
    this.alphabet = Collections.unmodifiableSet(new LinkedHashSet<>(alphabet));
    this.config = config;
    try {
      config.validate(this.alphabet);
      this.transitions = TransitionTable.normalize(transitionSpec, this.alphabet, config);
    } catch (AutomatonException problem) {
      logError(automatonId, "Rejected definition", problem);
      throw problem;
    }
    this.start = start;
    this.accept = Collections.unmodifiableSet(new LinkedHashSet<>(accept));
    validate();
    logInfo(automatonId, String.format("Built automaton with %d states, %d symbols, %d transitions",
        this.states.size(), this.alphabet.size(), transitions.size()));
  }

  private void validate() throws AutomatonException {
    if (start == null || !states.contains(start)) {
      fail(Code.START_STATE_NOT_IN_STATES, "Start state " + start + " is not in " + states);
    }
    if (!states.containsAll(accept)) {
      final Set<S> strays = new LinkedHashSet<>(accept);
      strays.removeAll(states);
      fail(Code.ACCEPT_STATES_NOT_SUBSET, "Accept states " + strays + " are not in " + states);
    }
    // each kind of violation is looked for across every transition before the next kind
    for (TransitionKey<S, Y> key : transitions.asMap().keySet()) {
      if (!states.contains(key.getState())) {
        fail(Code.TRANSITION_STATE_INVALID,
            "Transition " + key + " is keyed by a state not in " + states);
      }
    }
    for (S state : transitions.epsilonMap().keySet()) {
      if (!states.contains(state)) {
        fail(Code.TRANSITION_STATE_INVALID, "Empty string transition of " + state
            + " is keyed by a state not in " + states);
      }
    }
    for (TransitionKey<S, Y> key : transitions.asMap().keySet()) {
      if (!alphabet.contains(key.getSymbol())) {
        fail(Code.TRANSITION_SYMBOL_INVALID, "Transition " + key
            + " is keyed by a symbol not in " + alphabet + " nor the empty string "
            + config.spelling());
      }
    }
    for (Map.Entry<TransitionKey<S, Y>, Set<S>> entry : transitions.asMap().entrySet()) {
      if (!states.containsAll(entry.getValue())) {
        fail(Code.TRANSITION_DESTINATION_INVALID, "Transition " + entry.getKey() + " leads to "
            + entry.getValue() + ", not all of which are in " + states);
      }
    }
    for (Map.Entry<S, Set<S>> entry : transitions.epsilonMap().entrySet()) {
      if (!states.containsAll(entry.getValue())) {
        fail(Code.TRANSITION_DESTINATION_INVALID, "Empty string transition of " + entry.getKey()
            + " leads to " + entry.getValue() + ", not all of which are in " + states);
      }
    }
  }

  private void fail(final Code code, final String message) throws AutomatonException {
    logError(automatonId, message);
    throw new AutomatonException(code, message);
  }

  @Override
  public boolean accepts(final Iterable<? extends Y> symbols) {
    Objects.requireNonNull(symbols, "symbols");
    Set<S> current = epsilonClosure(Collections.singleton(start));
    for (Y symbol : symbols) {
      current = transition(current, symbol);
      if (current.isEmpty()) {
        if (logger.isDebugEnabled()) {
          logDebug(automatonId, "Rejected " + symbols + ", no transition on " + symbol);
        }
        return false;
      }
      current = epsilonClosure(current);
    }
    final boolean accepted = !Collections.disjoint(current, accept);
    if (logger.isDebugEnabled()) {
      logDebug(automatonId,
          (accepted ? "Accepted " : "Rejected ") + symbols + " ending in " + current);
    }
    return accepted;
  }

  @Override
  public Set<S> epsilonClosure(final Set<S> states) {
    // accumulator of every state seen so far
    final Set<S> closure = new LinkedHashSet<>(states);
    // states not yet checked for empty string transitions
    Set<S> frontier = new LinkedHashSet<>(states);
    while (!frontier.isEmpty()) {
      final Set<S> discovered = new LinkedHashSet<>();
      for (S state : frontier) {
        discovered.addAll(transitions.epsilonDestinations(state));
      }
      discovered.removeAll(closure);
      closure.addAll(discovered);
      frontier = discovered;
    }
    return closure;
  }

  @Override
  public Set<S> transition(final Set<S> states, final Y symbol) {
    final Set<S> destinations = new LinkedHashSet<>();
    for (S state : states) {
      destinations.addAll(transitions.destinations(state, symbol));
    }
    return destinations;
  }

  @Override
  public final boolean isDeterministic() {
    if (!transitions.epsilonMap().isEmpty()) {
      return false;
    }
    for (Set<S> destinations : transitions.asMap().values()) {
      if (destinations.size() != 1) {
        return false;
      }
    }
    for (S state : states) {
      for (Y symbol : alphabet) {
        if (!transitions.contains(state, symbol)) {
          return false;
        }
      }
    }
    return true;
  }

  @Override
  public String getId() {
    return automatonId;
  }

  @Override
  public Set<S> getStates() {
    return states;
  }

  @Override
  public Set<Y> getAlphabet() {
    return alphabet;
  }

  @Override
  public TransitionTable<S, Y> getTransitions() {
    return transitions;
  }

  @Override
  public S getStart() {
    return start;
  }

  @Override
  public Set<S> getAccept() {
    return accept;
  }

  @Override
  public Optional<Y> getEmptyString() {
    return config.getEmptyString();
  }

  @Override
  public AutomatonConfiguration<Y> getConfiguration() {
    return config;
  }

  @Override
  public String render() {
    return AutomatonRenderer.render(this);
  }

  @Override
  public String toString() {
    return render();
  }

  static void logError(final String automatonId, final String message) {
    logger.error(new StringBuilder().append("[a:").append(automatonId).append("] ")
        .append(message).toString());
  }

  static void logError(final String automatonId, final String message, final Throwable error) {
    logger.error(new StringBuilder().append("[a:").append(automatonId).append("] ")
        .append(message).toString(), error);
  }

  static void logInfo(final String automatonId, final String message) {
    logger.info(new StringBuilder().append("[a:").append(automatonId).append("] ")
        .append(message).toString());
  }

  static void logDebug(final String automatonId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[a:").append(automatonId).append("] ")
          .append(message).toString());
    }
  }
}
