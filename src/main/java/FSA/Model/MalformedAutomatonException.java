package FSA.Model;

/**
 * Thrown when an automaton under construction violates a structural invariant, e.g., a transition refers to a state
 * or symbol that was never declared.
 */
public class MalformedAutomatonException extends IllegalArgumentException {

    public MalformedAutomatonException(String message) {
        super(message);
    }
}
