package com.github.automaton;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Renders the 5-tuple of an automaton, plus its empty string marker, as indented text. Only used
 * for printing and debugging; there is no parser for this format.
 */
final class AutomatonRenderer {
  private static final String INDENT = "    ";

  static <S, Y> String render(final FiniteAutomaton<S, Y> automaton) {
    final StringBuilder builder = new StringBuilder();
    builder.append(automaton.getClass().getSimpleName()).append(" [id=")
        .append(automaton.getId()).append("]\n");
    builder.append(INDENT).append("states: ");
    appendSet(builder, automaton.getStates());
    builder.append('\n').append(INDENT).append("alphabet: ");
    appendSet(builder, automaton.getAlphabet());
    builder.append('\n').append(INDENT).append("transition function:");
    final TransitionTable<S, Y> table = automaton.getTransitions();
    final String spelling = automaton.getConfiguration().spelling();
    if (table.isEmpty()) {
      builder.append(" {}");
    }
    for (Map.Entry<TransitionKey<S, Y>, Set<S>> entry : table.asMap().entrySet()) {
      builder.append('\n').append(INDENT).append(INDENT).append(entry.getKey()).append(" -> ");
      appendSet(builder, entry.getValue());
    }
    for (Map.Entry<S, Set<S>> entry : table.epsilonMap().entrySet()) {
      builder.append('\n').append(INDENT).append(INDENT).append('(').append(entry.getKey())
          .append(", ").append(spelling).append(") -> ");
      appendSet(builder, entry.getValue());
    }
    builder.append('\n').append(INDENT).append("start: ").append(automaton.getStart());
    builder.append('\n').append(INDENT).append("accept: ");
    appendSet(builder, automaton.getAccept());
    builder.append('\n').append(INDENT).append("empty string: ")
        .append(spelling);
    return builder.toString();
  }

  private static void appendSet(final StringBuilder builder, final Set<?> set) {
    builder.append('{');
    final Iterator<?> iterator = set.iterator();
    while (iterator.hasNext()) {
      builder.append(iterator.next());
      if (iterator.hasNext()) {
        builder.append(", ");
      }
    }
    builder.append('}');
  }

  private AutomatonRenderer() {}
}
