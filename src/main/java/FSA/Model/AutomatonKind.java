package FSA.Model;

/**
 * Tag distinguishing the two automaton variants. Operations that are only defined for one variant dispatch on it.
 */
public enum AutomatonKind {
    DETERMINISTIC,
    NONDETERMINISTIC
}
