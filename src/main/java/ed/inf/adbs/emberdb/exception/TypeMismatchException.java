package ed.inf.adbs.emberdb.exception;

/**
 * Raised by the plan builder when an expression is ill-typed, e.g. a non-boolean
 * filter predicate or a comparison between incompatible operand types.
 */
public class TypeMismatchException extends PlanningException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
