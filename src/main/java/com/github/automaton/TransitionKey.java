package com.github.automaton;

import java.util.Objects;

/**
 * Immutable (state, symbol) pair that keys a {@link TransitionTable}. In raw input the symbol may
 * still spell the empty string; in a normalized table it is always a real symbol.
 */
public final class TransitionKey<S, Y> {
  private final S state;
  private final Y symbol;

  private TransitionKey(S state, Y symbol) {
    this.state = state;
    this.symbol = symbol;
  }

  public S getState() {
    return state;
  }

  public Y getSymbol() {
    return symbol;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransitionKey)) {
      return false;
    }
    TransitionKey<?, ?> key = (TransitionKey<?, ?>) o;
    return Objects.equals(state, key.state) && Objects.equals(symbol, key.symbol);
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, symbol);
  }

  @Override
  public String toString() {
    return "(" + state + ", " + symbol + ")";
  }

  /**
   * Nulls are tolerated here so that raw input can be carried as far as normalization, which
   * reports them as malformed.
   */
  public static <S, Y> TransitionKey<S, Y> of(S state, Y symbol) {
    return new TransitionKey<>(state, symbol);
  }
}
