package tripod.rv.core;

public interface Estimator {
    /**
     * states of the fit loop; the last three are terminal
     */
    enum State {
        INITIAL,
        FITTING,
        EVALUATING,
        CLIPPING,
        CONVERGED,
        MAX_ITERATIONS_REACHED,
        FAILED;

        public boolean isTerminal () {
            return this == CONVERGED || this == MAX_ITERATIONS_REACHED
                || this == FAILED;
        }

        public FitStatus toStatus () {
            switch (this) {
            case CONVERGED: return FitStatus.CONVERGED;
            case MAX_ITERATIONS_REACHED: 
                return FitStatus.MAX_ITERATIONS_REACHED;
            case FAILED: return FitStatus.FAILED;
            default:
                throw new IllegalStateException (this+" is not terminal");
            }
        }
    }

    /**
     * Fit the problem. The problem's parameter set is updated in place
     * to the accepted values. Never throws for numerical failures; these
     * are reported through the result's status.
     */
    FitResult estimate (FitProblem problem);
}
