package tripod.rv.core;

/**
 * Instrumental profile kernels on a fixed, symmetric velocity grid.
 */
public class InstrumentalProfile {
    private InstrumentalProfile () {}

    /**
     * velocity offsets [km/s] of a kernel with the given half size 
     * (in grid samples) and sampling step [km/s]
     */
    public static double[] velocityGrid (int halfSize, double stepKms) {
        if (halfSize < 0) {
            throw new IllegalArgumentException 
                ("Negative IP half size: "+halfSize);
        }
        double[] vk = new double[2 * halfSize + 1];
        for (int i = 0; i < vk.length; ++i)
            vk[i] = (i - halfSize) * stepKms;
        return vk;
    }

    /**
     * Kernel of the given shape sampled on vk, normalized to unit sum.
     *
     * @throws InvalidWidthException if a width parameter is not positive
     * @throws SolverFailureException if the kernel cannot be normalized
     */
    public static double[] buildKernel (ProfileShape shape, double[] vk, 
                                        double... params) {
        int n = shape.getParameterCount(vk.length);
        if (params.length != n) {
            throw new IllegalArgumentException
                (shape+" needs "+n+" parameter(s); got "+params.length);
        }
        for (int i = 0; i < params.length; ++i) {
            if (shape.isWidth(i) && !(params[i] > 0.)) {
                throw new InvalidWidthException (shape, i, params[i]);
            }
        }

        double[] k = shape.shape(vk, params);
        double sum = 0.;
        for (double x : k) 
            sum += x;
        if (!(sum > 0.) || Double.isInfinite(sum)) {
            throw new SolverFailureException
                (shape+" kernel cannot be normalized (sum="+sum+")");
        }
        for (int i = 0; i < k.length; ++i)
            k[i] /= sum;
        return k;
    }
}
