package FSA;

/**
 * Decides acceptance of a product state from the acceptance of its components. A component that has no state (an
 * undefined transition was taken) counts as rejecting.
 */
@FunctionalInterface
public interface AcceptanceCombiner {
    AcceptanceCombiner INTERSECTION = (left, right) -> left && right;
    AcceptanceCombiner UNION = (left, right) -> left || right;
    AcceptanceCombiner DIFFERENCE = (left, right) -> left && !right;
    AcceptanceCombiner SYMMETRIC_DIFFERENCE = (left, right) -> left != right;

    boolean combine(boolean left, boolean right);
}
