package com.github.automaton;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import com.github.automaton.AutomatonException.Code;
import com.github.automaton.FiniteAutomaton.AutomatonBuilder;

/**
 * Every way an automaton definition can be rejected at build time.
 */
public class AutomatonValidationTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testStartStateNotInStates() {
    expectFailure(Code.START_STATE_NOT_IN_STATES,
        builder().states(1, 2).start(3).accept(2));
    expectFailure(Code.START_STATE_NOT_IN_STATES, builder().states(1, 2).accept(2));
  }

  @Test
  public void testAcceptStatesNotSubset() {
    expectFailure(Code.ACCEPT_STATES_NOT_SUBSET,
        builder().states(1, 2).alphabet("a")
            .transitions(TransitionSpec.<Integer, String>mapping().put(1, "a", 2).build())
            .start(1).accept(3));
    expectFailure(Code.ACCEPT_STATES_NOT_SUBSET, builder().states(1, 2).start(1).accept(2, 3));
  }

  @Test
  public void testTransitionStateInvalid() {
    expectFailure(Code.TRANSITION_STATE_INVALID,
        builder().states(1, 2).alphabet("a")
            .transitions(TransitionSpec.<Integer, String>mapping().put(4, "a", 1).build())
            .start(1).accept(2));
  }

  @Test
  public void testTransitionSymbolInvalid() {
    // "a" is neither in the (empty) alphabet nor the empty string
    expectFailure(Code.TRANSITION_SYMBOL_INVALID,
        builder().states(1, 2)
            .transitions(TransitionSpec.<Integer, String>mapping().put(1, "a", 1).build())
            .start(2).accept(2));
    // with the shorthand off, a literal e is just another undeclared symbol
    expectFailure(Code.TRANSITION_SYMBOL_INVALID,
        builder().states(1, 2).alphabet("a")
            .transitions(TransitionSpec.<Integer, String>mapping().put(1, "e", 2).build())
            .start(1).accept(2).config(literalSymbols()));
  }

  @Test
  public void testTransitionDestinationInvalid() {
    expectFailure(Code.TRANSITION_DESTINATION_INVALID,
        builder().states(1, 2).alphabet("a")
            .transitions(TransitionSpec.<Integer, String>mapping().put(1, "a", 3).build())
            .start(1).accept(2));
    expectFailure(Code.TRANSITION_DESTINATION_INVALID,
        builder().states(1, 2).alphabet("a")
            .transitions(TransitionSpec.<Integer, String>mapping()
                .putAll(1, "a", Arrays.asList(1, 2, 5)).build())
            .start(1).accept(2));
  }

  @Test
  public void testInvalidTransitionFormat() {
    expectFailure(Code.INVALID_TRANSITION_FORMAT,
        builder().states(1, 2).alphabet("a")
            .transitions(TransitionSpec.ofTuples(
                Collections.singletonList(Collections.singletonList(1)), Integer.class,
                String.class))
            .start(1).accept(2));
  }

  @Test
  public void testShorthandEpsilonIsValid() throws AutomatonException {
    final NondeterministicAutomaton<Integer, String> nfa = builder().states(1, 2).alphabet("a")
        .transitions(TransitionSpec.<Integer, String>mapping().put(1, "e", 2).build()).start(1)
        .accept(2).build();
    assertTrue(nfa.accepts(Collections.<String>emptyList()));
  }

  @Test
  public void testFirstViolationWins() {
    // malformed transitions are found while normalizing, before anything else
    expectFailure(Code.INVALID_TRANSITION_FORMAT,
        builder().states(1).transitions(TransitionSpec.<Integer, String>mapping()
            .put(null, "a", 1).build()).start(9).accept(9));
    // start before accept
    expectFailure(Code.START_STATE_NOT_IN_STATES, builder().states(1).start(9).accept(9));
    // accept before transitions
    expectFailure(Code.ACCEPT_STATES_NOT_SUBSET,
        builder().states(1).transitions(TransitionSpec.<Integer, String>mapping()
            .put(9, "z", 9).build()).start(1).accept(9));
    // state, then symbol, then destinations, for one transition
    expectFailure(Code.TRANSITION_STATE_INVALID,
        builder().states(1).transitions(TransitionSpec.<Integer, String>mapping()
            .put(9, "z", 9).build()).start(1));
    expectFailure(Code.TRANSITION_SYMBOL_INVALID,
        builder().states(1).transitions(TransitionSpec.<Integer, String>mapping()
            .put(1, "z", 9).build()).start(1));
    // each kind is looked for across all transitions, so a bad destination on an earlier
    // transition does not hide an undeclared state on a later one
    expectFailure(Code.TRANSITION_STATE_INVALID,
        builder().states(1, 2).alphabet("a").transitions(TransitionSpec
            .<Integer, String>mapping().put(1, "a", 9).put(7, "a", 1).build()).start(1));
    expectFailure(Code.TRANSITION_SYMBOL_INVALID,
        builder().states(1, 2).alphabet("a").transitions(TransitionSpec
            .<Integer, String>mapping().put(1, "a", 9).put(2, "z", 1).build()).start(1));
    expectFailure(Code.TRANSITION_STATE_INVALID,
        builder().states(1, 2).alphabet("a").transitions(TransitionSpec
            .<Integer, String>mapping().put(1, "e", 9).put(7, "a", 1).build()).start(1));
    // the marker is checked before any transition
    expectFailure(Code.INVALID_AUTOMATON_CONFIG,
        builder().states(1).alphabet("a").transitions(TransitionSpec
            .<Integer, String>mapping().put(9, "z", 9).build()).start(9).emptyString("a"));
  }

  @Test
  public void testEmptyStringMarkerInAlphabet() {
    // every a edge would double as an empty string edge
    expectFailure(Code.INVALID_AUTOMATON_CONFIG,
        builder().states(1, 2).alphabet("a", "b")
            .transitions(TransitionSpec.<Integer, String>mapping().put(1, "a", 2).build())
            .start(1).accept(2).emptyString("a"));
    expectFailure(Code.INVALID_AUTOMATON_CONFIG,
        builder().states(1, 2).alphabet("a", AutomatonConfiguration.DEFAULT_EMPTY_STRING)
            .start(1).accept(2));
    final AutomatonBuilder<Integer, Character> characters = AutomatonBuilder
        .<Integer, Character>newBuilder().states(1, 2).alphabet('a', 'b')
        .transitions(TransitionSpec.<Integer, Character>mapping().put(1, 'a', 2).build())
        .start(1).accept(2).emptyString('a');
    try {
      characters.build();
      fail("Expected a marker inside the alphabet to be rejected");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_AUTOMATON_CONFIG, expected.getCode());
    }
  }

  @Test
  public void testNullMembersAreRejected() {
    expectFailure(Code.INVALID_AUTOMATON_CONFIG,
        builder().states(Arrays.asList(1, null)).start(1));
    expectFailure(Code.INVALID_AUTOMATON_CONFIG,
        builder().states(1).alphabet(Arrays.asList("a", null)).start(1));
    expectFailure(Code.INVALID_AUTOMATON_CONFIG,
        builder().states(1).start(1).accept(Arrays.asList((Integer) null)));
  }

  private static AutomatonConfiguration<String> literalSymbols() {
    try {
      return AutomatonConfiguration.AutomatonConfigurationBuilder.<String>newBuilder()
          .epsilonShorthand(false).build();
    } catch (AutomatonException problem) {
      throw new AssertionError(problem);
    }
  }

  private static AutomatonBuilder<Integer, String> builder() {
    return AutomatonBuilder.<Integer, String>newBuilder();
  }

  private static void expectFailure(final Code code,
      final AutomatonBuilder<Integer, String> builder) {
    try {
      builder.build();
      fail("Expected build to fail with " + code);
    } catch (AutomatonException expected) {
      assertEquals(expected.getMessage(), code, expected.getCode());
    }
    try {
      builder.buildDeterministic();
      fail("Expected deterministic build to fail with " + code);
    } catch (AutomatonException expected) {
      assertEquals(expected.getMessage(), code, expected.getCode());
    }
  }
}
