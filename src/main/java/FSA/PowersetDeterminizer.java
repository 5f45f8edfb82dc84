package FSA;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

import FSA.Model.FiniteAutomaton;
import FSA.Model.PartialDFA;

/**
 * Subset construction. Only subsets reachable from the epsilon closure of the initial state are built, and the empty
 * subset is never materialized: a symbol without successors stays an undefined transition.
 */
public class PowersetDeterminizer {

    private PowersetDeterminizer() {}

    public static <I> PartialDFA<I> determinize(FiniteAutomaton<I> automaton) {
        return determinize(automaton, false);
    }

    public static <I> PartialDFA<I> determinize(FiniteAutomaton<I> automaton, boolean minimize) {
        final PartialDFA<I> out = doDeterminize(automaton);
        if (minimize) {
            return ValmariMinimizer.minimize(out);
        }
        return out;
    }

    private static <I> PartialDFA<I> doDeterminize(FiniteAutomaton<I> automaton) {
        final PartialDFA.Builder<I> out = PartialDFA.builder(automaton.getInputAlphabet());
        final Map<BitSet, Integer> outStateMap = new HashMap<>();
        final Deque<DeterminizeRecord> stack = new ArrayDeque<>();

        final BitSet init = automaton.epsilonClosure(BitSetUtils.of(automaton.getInitialState()));
        final int initOut = out.addState(automaton.isAccepting(init));
        out.initial(initOut);

        outStateMap.put(init, initOut);
        stack.push(new DeterminizeRecord(init, initOut));

        final int numInputs = automaton.numInputs();
        while (!stack.isEmpty()) {
            final DeterminizeRecord curr = stack.pop();
            final BitSet inState = curr.inputState();

            for (int a = 0; a < numInputs; a++) {
                final BitSet post = new BitSet();
                for (int q = inState.nextSetBit(0); q >= 0; q = inState.nextSetBit(q + 1)) {
                    automaton.addSuccessors(q, a, post, 0);
                }
                if (post.isEmpty()) {
                    continue;
                }
                final BitSet succ = automaton.epsilonClosure(post);
                Integer outSucc = outStateMap.get(succ);
                if (outSucc == null) {
                    // add new state to DFA and to stack
                    outSucc = out.addState(automaton.isAccepting(succ));
                    outStateMap.put(succ, outSucc);
                    stack.push(new DeterminizeRecord(succ, outSucc));
                }
                out.transition(curr.outputState(), automaton.getSymbol(a), outSucc);
            }
        }

        return out.build();
    }

    private record DeterminizeRecord(BitSet inputState, int outputState) { }
}
