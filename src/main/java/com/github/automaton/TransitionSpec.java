package com.github.automaton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The raw, not yet normalized, description of a transition function. It comes in two shapes:
 * <br>
 * 1. a mapping keyed by (state, symbol) pairs whose values are destination collections or single
 * destinations, see {@link #ofMapping(Map)}, {@link #ofSingleMapping(Map)} and
 * {@link #mapping()}<br>
 * 2. an ordered collection of (state, symbol, destination...) records, see
 * {@link #ofRecords(Iterable)} and {@link #ofTuples(Iterable, Class, Class)}<br>
 * 
 * A spec performs no validation itself. It only replays its entries, in order, to
 * {@link TransitionTable#normalize}, which is where malformed entries are reported.
 */
public abstract class TransitionSpec<S, Y> {

  /**
   * Receives one raw entry. Any argument may be null when the raw input was malformed.
   */
  @FunctionalInterface
  interface EntryVisitor<S, Y> {
    void visit(TransitionKey<S, Y> key, Collection<? extends S> destinations)
        throws AutomatonException;
  }

  abstract void forEach(final EntryVisitor<S, Y> visitor) throws AutomatonException;

  /**
   * Number of raw entries, before duplicate keys collapse.
   */
  public abstract int size();

  public static <S, Y> TransitionSpec<S, Y> none() {
    return new MappingSpec<>(new LinkedHashMap<>());
  }

  public static <S, Y> TransitionSpec<S, Y> ofMapping(
      final Map<TransitionKey<S, Y>, ? extends Collection<? extends S>> mapping) {
    if (mapping == null) {
      return none();
    }
    return new MappingSpec<>(
        new LinkedHashMap<TransitionKey<S, Y>, Collection<? extends S>>(mapping));
  }

  public static <S, Y> TransitionSpec<S, Y> ofSingleMapping(
      final Map<TransitionKey<S, Y>, ? extends S> mapping) {
    if (mapping == null) {
      return none();
    }
    final Map<TransitionKey<S, Y>, Collection<? extends S>> wrapped = new LinkedHashMap<>();
    for (Map.Entry<TransitionKey<S, Y>, ? extends S> entry : mapping.entrySet()) {
      wrapped.put(entry.getKey(), Collections.singletonList(entry.getValue()));
    }
    return new MappingSpec<>(wrapped);
  }

  public static <S, Y> TransitionSpec<S, Y> ofRecords(
      final Iterable<TransitionRecord<S, Y>> records) {
    final List<TransitionRecord<S, Y>> copy = new ArrayList<>();
    if (records != null) {
      for (TransitionRecord<S, Y> record : records) {
        copy.add(record);
      }
    }
    return new RecordSpec<>(copy);
  }

  /**
   * Untyped tuples are destructured lazily, so a malformed tuple surfaces as an
   * {@link AutomatonException} when the automaton is built.
   */
  public static <S, Y> TransitionSpec<S, Y> ofTuples(final Iterable<? extends List<?>> tuples,
      final Class<S> stateType, final Class<Y> symbolType) {
    final List<List<?>> copy = new ArrayList<>();
    if (tuples != null) {
      for (List<?> tuple : tuples) {
        copy.add(tuple);
      }
    }
    return new TupleSpec<>(copy, stateType, symbolType);
  }

  public static <S, Y> MappingBuilder<S, Y> mapping() {
    return new MappingBuilder<>();
  }

  /**
   * Fluent builder for the mapping form. Putting the same (state, symbol) twice replaces the
   * earlier destinations.
   */
  public final static class MappingBuilder<S, Y> {
    private final Map<TransitionKey<S, Y>, Collection<? extends S>> mapping =
        new LinkedHashMap<>();

    public MappingBuilder<S, Y> put(final S state, final Y symbol, final S destination) {
      mapping.put(TransitionKey.of(state, symbol), Collections.singletonList(destination));
      return this;
    }

    public MappingBuilder<S, Y> putAll(final S state, final Y symbol,
        final Collection<? extends S> destinations) {
      mapping.put(TransitionKey.of(state, symbol), destinations);
      return this;
    }

    public TransitionSpec<S, Y> build() {
      return new MappingSpec<>(new LinkedHashMap<>(mapping));
    }

    private MappingBuilder() {}
  }

  private static final class MappingSpec<S, Y> extends TransitionSpec<S, Y> {
    private final Map<TransitionKey<S, Y>, Collection<? extends S>> mapping;

    private MappingSpec(final Map<TransitionKey<S, Y>, Collection<? extends S>> mapping) {
      this.mapping = mapping;
    }

    @Override
    void forEach(final EntryVisitor<S, Y> visitor) throws AutomatonException {
      for (Map.Entry<TransitionKey<S, Y>, Collection<? extends S>> entry : mapping.entrySet()) {
        visitor.visit(entry.getKey(), entry.getValue());
      }
    }

    @Override
    public int size() {
      return mapping.size();
    }
  }

  private static final class RecordSpec<S, Y> extends TransitionSpec<S, Y> {
    private final List<TransitionRecord<S, Y>> records;

    private RecordSpec(final List<TransitionRecord<S, Y>> records) {
      this.records = records;
    }

    @Override
    void forEach(final EntryVisitor<S, Y> visitor) throws AutomatonException {
      for (TransitionRecord<S, Y> record : records) {
        if (record == null) {
          visitor.visit(null, null);
        } else {
          visitor.visit(TransitionKey.of(record.getState(), record.getSymbol()),
              record.getDestinations());
        }
      }
    }

    @Override
    public int size() {
      return records.size();
    }
  }

  private static final class TupleSpec<S, Y> extends TransitionSpec<S, Y> {
    private final List<List<?>> tuples;
    private final Class<S> stateType;
    private final Class<Y> symbolType;

    private TupleSpec(final List<List<?>> tuples, final Class<S> stateType,
        final Class<Y> symbolType) {
      this.tuples = tuples;
      this.stateType = stateType;
      this.symbolType = symbolType;
    }

    @Override
    void forEach(final EntryVisitor<S, Y> visitor) throws AutomatonException {
      for (List<?> tuple : tuples) {
        final TransitionRecord<S, Y> record =
            TransitionRecord.fromTuple(tuple, stateType, symbolType);
        visitor.visit(TransitionKey.of(record.getState(), record.getSymbol()),
            record.getDestinations());
      }
    }

    @Override
    public int size() {
      return tuples.size();
    }
  }

  @Override
  public String toString() {
    final List<String> entries = new ArrayList<>();
    try {
      forEach((key, destinations) -> entries.add(key + "->" + destinations));
    } catch (AutomatonException malformed) {
      entries.add("<malformed: " + malformed.getMessage() + ">");
    }
    return getClass().getSimpleName() + " " + entries;
  }

  TransitionSpec() {}
}
