package FSA.Model;

/**
 * Thrown when an operation is invoked on an automaton kind it is not defined for, e.g., Valmari minimization of an
 * NFA.
 */
public class UnsupportedAutomatonKindException extends UnsupportedOperationException {

    private final AutomatonKind kind;

    public UnsupportedAutomatonKindException(String operation, AutomatonKind kind) {
        super(operation + " is not supported for " + kind.name().toLowerCase() + " automata");
        this.kind = kind;
    }

    public AutomatonKind getKind() {
        return kind;
    }
}
