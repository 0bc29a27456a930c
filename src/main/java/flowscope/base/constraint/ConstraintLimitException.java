package flowscope.base.constraint;

/**
 * A guard whose DNF would exceed the configured number of disjuncts.
 */
public class ConstraintLimitException extends IllegalStateException {
    public final int limit;

    public ConstraintLimitException(String condition, long required, int limit) {
        super(String.format("Condition %s expands to %d disjuncts, limit is %d", condition, required, limit));
        this.limit = limit;
    }
}
