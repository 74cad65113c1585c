package tripod.rv.core;

/**
 * Numerical failure inside an optimizer evaluation (non-finite model or
 * residual). Thrown from within the least-squares model function and
 * translated into a non-converged {@link FitResult} by the estimator;
 * it never escapes {@link Estimator#estimate}.
 */
public class SolverFailureException extends RuntimeException {
    private static final long serialVersionUID = 0x7f2c0b6e94d1a358l;

    public SolverFailureException (String message) {
        super (message);
    }

    public SolverFailureException (String message, Throwable cause) {
        super (message, cause);
    }
}
