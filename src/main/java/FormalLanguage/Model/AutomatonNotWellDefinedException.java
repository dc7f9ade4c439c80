package FormalLanguage.Model;

/**
 * Thrown when a candidate 5-tuple breaks one of the well-formedness invariants of a
 * deterministic finite automaton. {@link #getReason()} names the invariant.
 */
public class AutomatonNotWellDefinedException extends RuntimeException {
    public static final String NULL_ARGUMENT = "null argument";
    public static final String INITIAL_NOT_IN_STATES = "initial not in states";
    public static final String ACCEPT_NOT_IN_STATES = "accept states not in states";
    public static final String NOT_TOTAL = "transition function not total";
    public static final String TARGET_NOT_IN_STATES = "transition target not in states";
    public static final String STRAY_TRANSITION = "stray transition";

    private final String reason;

    public AutomatonNotWellDefinedException(String reason) {
        this(reason, null);
    }

    public AutomatonNotWellDefinedException(String reason, Object detail) {
        super(detail == null ? reason : reason + ": " + detail);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
