package FSA;

import FSA.Compare.Isomorphism;
import FSA.Model.PartialDFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("IntegTest")
public class ValmariMinimizerIntegTest {
  @Test
  void testRandomDFAs() {
    for (int size = 2; size < 25; size++) {
      for (int randomSeed = 0; randomSeed < 100; randomSeed++) {
        PartialDFA<Integer> dfa = TabakovVardiRandomAutomata.getRandomDFA(randomSeed, size);
        PartialDFA<Integer> min = ValmariMinimizer.minimize(dfa);
        String debug = randomSeed + "; " + size;

        Assertions.assertTrue(AutomataLibOracle.sameLanguage(dfa, min), debug);
        Assertions.assertEquals(AutomataLibOracle.minimalStateCount(dfa), min.size(), debug);
        Assertions.assertTrue(min.size() == 1 || Trim.isTrim(min), debug);
        Assertions.assertTrue(Isomorphism.isomorphic(min, ValmariMinimizer.minimize(min)), debug);
      }
    }
  }

  @Test
  void testDeterminizedNFAs() {
    for (int size = 2; size < 12; size++) {
      for (int randomSeed = 0; randomSeed < 50; randomSeed++) {
        PartialDFA<Integer> dfa = PowersetDeterminizer.determinize(TabakovVardiRandomAutomata.getRandomNFA(randomSeed, size));
        PartialDFA<Integer> min = ValmariMinimizer.minimize(dfa);
        String debug = randomSeed + "; " + size;
        Assertions.assertTrue(AutomataLibOracle.sameLanguage(dfa, min), debug);
        Assertions.assertEquals(AutomataLibOracle.minimalStateCount(dfa), min.size(), debug);
      }
    }
  }
}
