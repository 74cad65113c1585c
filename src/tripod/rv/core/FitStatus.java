package tripod.rv.core;

/**
 * How a fit ended.
 */
public enum FitStatus {
    CONVERGED,
    MAX_ITERATIONS_REACHED, // clipping did not stabilize within the cap
    FAILED // numerical failure of the solver or the model
}
