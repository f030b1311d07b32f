package com.github.automaton;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.github.automaton.AutomatonException.Code;

/**
 * One row of the record form of a transition function: a state, a symbol and zero or more
 * destination states. A record with no destinations is legal and yields an empty destination set.
 */
public final class TransitionRecord<S, Y> {
  private final S state;
  private final Y symbol;
  private final List<S> destinations;

  private TransitionRecord(final S state, final Y symbol, final List<S> destinations) {
    this.state = state;
    this.symbol = symbol;
    this.destinations = Collections.unmodifiableList(destinations);
  }

  public S getState() {
    return state;
  }

  public Y getSymbol() {
    return symbol;
  }

  public List<S> getDestinations() {
    return destinations;
  }

  @SafeVarargs
  public static <S, Y> TransitionRecord<S, Y> of(final S state, final Y symbol,
      final S... destinations) {
    return new TransitionRecord<>(state, symbol,
        destinations == null ? new ArrayList<>() : new ArrayList<>(Arrays.asList(destinations)));
  }

  /**
   * Destructure an untyped tuple of the shape (state, symbol, destination...), which is what a
   * file loader hands over. Each position is checked against the automaton's state and symbol
   * types.
   */
  public static <S, Y> TransitionRecord<S, Y> fromTuple(final List<?> tuple,
      final Class<S> stateType, final Class<Y> symbolType) throws AutomatonException {
    if (tuple == null || tuple.size() < 2) {
      throw new AutomatonException(Code.INVALID_TRANSITION_FORMAT,
          "Transition record must provide a state and symbol, found: " + tuple);
    }
    final List<S> destinations = new ArrayList<>(tuple.size() - 2);
    for (int i = 2; i < tuple.size(); i++) {
      destinations.add(cast(tuple, i, stateType));
    }
    return new TransitionRecord<>(cast(tuple, 0, stateType), cast(tuple, 1, symbolType),
        destinations);
  }

  private static <T> T cast(final List<?> tuple, final int position, final Class<T> type)
      throws AutomatonException {
    final Object value = tuple.get(position);
    if (value != null && !type.isInstance(value)) {
      throw new AutomatonException(Code.INVALID_TRANSITION_FORMAT, "Transition record " + tuple
          + " has " + value + " at position " + position + ", expected a " + type.getSimpleName());
    }
    return type.cast(value);
  }

  @Override
  public String toString() {
    return "TransitionRecord [state=" + state + ", symbol=" + symbol + ", destinations="
        + destinations + "]";
  }
}
