package FSA.Model;

/**
 * Callback for enumerating the transitions of an automaton as (tail, label, head) triples. Labels are symbol indices;
 * epsilon moves use {@link FiniteAutomaton#EPSILON}.
 */
@FunctionalInterface
public interface TransitionVisitor {
    void visit(int tail, int label, int head);
}
