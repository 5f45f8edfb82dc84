package FSA.Compare;

import FSA.AutomataLibOracle;
import FSA.MinimizationExamples;
import FSA.Model.EpsilonNFA;
import FSA.Model.FiniteAutomaton;
import FSA.Model.PartialDFA;
import FSA.PowersetDeterminizer;
import FSA.Products;
import FSA.TabakovVardiRandomAutomata;
import FSA.Trim;
import FSA.ValmariMinimizer;
import net.automatalib.word.Word;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

public class EquivalenceTest {
  @Test
  void testMixedKinds() {
    FiniteAutomaton<String> dfa = MinimizationExamples.eightStateExample();
    EpsilonNFA<String> nfa = EpsilonNFA.<String>builder(dfa.getInputAlphabet())
        .withStates(4).initial(0).accepting(1, 2, 3)
        .transition(0, "a", 1).transition(0, "b", 1)
        .transition(1, "a", 2).epsilon(1, 3)
        .transition(3, "a", 3)
        .build();
    // (a|b)a* here, but the DFA accepts "ab"
    Assertions.assertFalse(Equivalence.equivalent(dfa, nfa));
    Word<String> word = Equivalence.findSeparatingWord(dfa, nfa);
    Assertions.assertNotNull(word);
    Assertions.assertNotEquals(dfa.accepts(word), nfa.accepts(word));
  }

  @Test
  @Tag("IntegTest")
  void testRandomDFAsAgainstAutomataLib() {
    for (int size = 2; size < 15; size++) {
      for (int randomSeed = 0; randomSeed < 100; randomSeed++) {
        PartialDFA<Integer> a = TabakovVardiRandomAutomata.getRandomDFA(randomSeed, size);
        PartialDFA<Integer> b = TabakovVardiRandomAutomata.getRandomDFA(randomSeed + 1000, size);
        String debug = randomSeed + "; " + size;

        boolean expected = AutomataLibOracle.sameLanguage(a, b);
        Assertions.assertEquals(expected, Equivalence.equivalent(a, b), debug);
        Assertions.assertEquals(expected, BisimulationUpToCongruence.equivalent(a, b), debug);
        assertSeparates(Equivalence.findSeparatingWord(a, b), a, b, debug);

        Assertions.assertTrue(Equivalence.equivalent(a, ValmariMinimizer.minimize(a)), debug);
        Assertions.assertTrue(Equivalence.equivalent(a, Products.complete(a)), debug);
        Assertions.assertTrue(Equivalence.equivalent(Trim.trim(a), a), debug);
      }
    }
  }

  @Test
  @Tag("IntegTest")
  void testRandomNFAsAgainstAutomataLib() {
    for (int size = 2; size < 10; size++) {
      for (int randomSeed = 0; randomSeed < 100; randomSeed++) {
        EpsilonNFA<Integer> a = TabakovVardiRandomAutomata.getRandomNFA(randomSeed, size);
        EpsilonNFA<Integer> b = TabakovVardiRandomAutomata.getRandomNFA(randomSeed + 1000, size);
        String debug = randomSeed + "; " + size;

        Assertions.assertEquals(AutomataLibOracle.sameLanguage(a, b), Equivalence.equivalent(a, b), debug);
        assertSeparates(Equivalence.findSeparatingWord(a, b), a, b, debug);
        Assertions.assertTrue(Equivalence.equivalent(a, PowersetDeterminizer.determinize(a)), debug);
        Assertions.assertTrue(Equivalence.equivalent(PowersetDeterminizer.determinize(a, true), a), debug);
      }
    }
  }

  private static <I> void assertSeparates(Word<I> word, FiniteAutomaton<I> a, FiniteAutomaton<I> b, String debug) {
    if (word != null) {
      Assertions.assertNotEquals(a.accepts(word), b.accepts(word), debug);
    }
  }
}
