package FSA;

import FSA.Compare.Isomorphism;
import FSA.Model.AutomatonKind;
import FSA.Model.EpsilonNFA;
import FSA.Model.PartialDFA;
import FSA.Model.UnsupportedAutomatonKindException;
import net.automatalib.alphabet.impl.Alphabets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ValmariMinimizerTest {
  private static final List<String> AB = List.of("a", "b");

  @Test
  void testEightStateExample() {
    PartialDFA<String> dfa = MinimizationExamples.eightStateExample();
    PartialDFA<String> min = ValmariMinimizer.minimize(dfa);

    Assertions.assertEquals(4, min.size());
    Assertions.assertTrue(Isomorphism.isomorphic(min, MinimizationExamples.eightStateExampleMinimized()));
    Assertions.assertTrue(AutomataLibOracle.sameLanguage(dfa, min));

    // breadth-first numbering from the initial state
    Assertions.assertEquals(0, min.getInitialState());
    Assertions.assertEquals(1, min.getSuccessor(0, "a"));
    Assertions.assertEquals(2, min.getSuccessor(1, "a"));
    Assertions.assertEquals(3, min.getSuccessor(1, "b"));
    Assertions.assertNull(min.getSuccessor(2, "a"));
    Assertions.assertNull(min.getSuccessor(3, "a"));
    Assertions.assertEquals(AB, new ArrayList<>(min.getInputAlphabet()));
  }

  @Test
  void testTailOfBs() {
    PartialDFA<String> dfa = PartialDFA.of(7, AB, 0, Set.of(4, 5, 6), Map.of(
        0, Map.of("a", 4, "b", 1),
        1, Map.of("a", 5, "b", 2),
        2, Map.of("a", 6, "b", 3),
        3, Map.of("a", 3, "b", 3),
        4, Map.of("a", 4, "b", 4),
        5, Map.of("a", 5, "b", 5),
        6, Map.of("a", 6, "b", 6)));
    PartialDFA<String> expected = PartialDFA.of(4, AB, 0, Set.of(3), Map.of(
        0, Map.of("a", 3, "b", 1),
        1, Map.of("a", 3, "b", 2),
        2, Map.of("a", 3),
        3, Map.of("a", 3, "b", 3)));
    assertMinimizesTo(dfa, expected);
  }

  @Test
  void testMergedBranches() {
    PartialDFA<String> dfa = PartialDFA.of(6, AB, 0, Set.of(5), Map.of(
        0, Map.of("a", 1, "b", 3),
        1, Map.of("a", 1, "b", 2),
        2, Map.of("a", 2, "b", 5),
        3, Map.of("a", 3, "b", 4),
        4, Map.of("a", 4, "b", 5),
        5, Map.of("a", 5, "b", 5)));
    PartialDFA<String> expected = PartialDFA.of(4, AB, 0, Set.of(3), Map.of(
        0, Map.of("a", 1, "b", 1),
        1, Map.of("a", 1, "b", 2),
        2, Map.of("a", 2, "b", 3),
        3, Map.of("a", 3, "b", 3)));
    assertMinimizesTo(dfa, expected);
  }

  @Test
  void testAcceptingInitialState() {
    PartialDFA<String> dfa = PartialDFA.of(6, AB, 0, Set.of(0, 2, 4), Map.of(
        0, Map.of("a", 1, "b", 3),
        1, Map.of("a", 2, "b", 3),
        2, Map.of("a", 5, "b", 2),
        3, Map.of("a", 4, "b", 1),
        4, Map.of("a", 5, "b", 4),
        5, Map.of("a", 5, "b", 5)));
    PartialDFA<String> expected = PartialDFA.of(3, AB, 0, Set.of(0, 2), Map.of(
        0, Map.of("a", 1, "b", 1),
        1, Map.of("a", 2, "b", 1),
        2, Map.of("b", 2)));
    assertMinimizesTo(dfa, expected);
  }

  @Test
  void testUniversalTail() {
    PartialDFA<String> dfa = PartialDFA.of(7, AB, 0, Set.of(1, 3, 5, 6), Map.of(
        0, Map.of("a", 1, "b", 3),
        1, Map.of("a", 2, "b", 4),
        2, Map.of("a", 5, "b", 5),
        3, Map.of("a", 4, "b", 2),
        4, Map.of("a", 5, "b", 5),
        5, Map.of("a", 6, "b", 5),
        6, Map.of("a", 6, "b", 6)));
    PartialDFA<String> expected = PartialDFA.of(4, AB, 0, Set.of(1, 3), Map.of(
        0, Map.of("a", 1, "b", 1),
        1, Map.of("a", 2, "b", 2),
        2, Map.of("a", 3, "b", 3),
        3, Map.of("a", 3, "b", 3)));
    assertMinimizesTo(dfa, expected);
  }

  @Test
  void testEmptyLanguage() {
    // accepting state is unreachable
    PartialDFA<String> dfa = PartialDFA.of(3, AB, 0, Set.of(2), Map.of(
        0, Map.of("a", 1),
        1, Map.of("b", 0)));
    PartialDFA<String> min = ValmariMinimizer.minimize(dfa);
    Assertions.assertEquals(1, min.size());
    Assertions.assertEquals(0, min.numFinalStates());
    Assertions.assertEquals(0, min.numTransitions());
    Assertions.assertEquals(AB, new ArrayList<>(min.getInputAlphabet()));
  }

  @Test
  void testOnlyEmptyWord() {
    PartialDFA<Integer> dfa = PartialDFA.builder(Alphabets.integers(0, 1))
        .withStates(2).initial(0).accepting(0)
        .transition(0, 0, 1).transition(1, 1, 1)
        .build();
    PartialDFA<Integer> min = ValmariMinimizer.minimize(dfa);
    Assertions.assertEquals(1, min.size());
    Assertions.assertTrue(min.isAccepting(0));
    Assertions.assertEquals(0, min.numTransitions());
  }

  @Test
  void testAlreadyMinimal() {
    PartialDFA<String> min = MinimizationExamples.eightStateExampleMinimized();
    Assertions.assertTrue(Isomorphism.isomorphic(min, ValmariMinimizer.minimize(min)));
  }

  @Test
  void testIdempotent() {
    PartialDFA<String> once = ValmariMinimizer.minimize(MinimizationExamples.eightStateExample());
    PartialDFA<String> twice = ValmariMinimizer.minimize(once);
    Assertions.assertTrue(Isomorphism.isomorphic(once, twice));
  }

  @Test
  void testInputUntouched() {
    PartialDFA<String> dfa = MinimizationExamples.eightStateExample();
    String before = dfa.toString();
    ValmariMinimizer.minimize(dfa);
    Assertions.assertEquals(before, dfa.toString());
  }

  @Test
  void testRejectsNFA() {
    EpsilonNFA<String> nfa = EpsilonNFA.<String>builder(AB).withStates(1).initial(0).build();
    UnsupportedAutomatonKindException ex = Assertions.assertThrows(UnsupportedAutomatonKindException.class,
        () -> ValmariMinimizer.minimize(nfa));
    Assertions.assertEquals(AutomatonKind.NONDETERMINISTIC, ex.getKind());
  }

  private static void assertMinimizesTo(PartialDFA<String> dfa, PartialDFA<String> expected) {
    PartialDFA<String> min = ValmariMinimizer.minimize(dfa);
    Assertions.assertEquals(expected.size(), min.size());
    Assertions.assertTrue(Isomorphism.isomorphic(expected, min), min::toString);
    Assertions.assertTrue(AutomataLibOracle.sameLanguage(dfa, min));
  }
}
