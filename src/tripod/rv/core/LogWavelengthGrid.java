package tripod.rv.core;

import java.util.Arrays;

/**
 * Uniform grid in natural-log wavelength. The step is given as a velocity
 * in m/s, i.e. step = ln(1 + dv/c) with c in m/s.
 */
public class LogWavelengthGrid {
    private final double[] lnwave;
    private final double step; // ln units
    private final double stepMs;

    LogWavelengthGrid (double lnStart, int size, double stepMs) {
        if (size < 2) {
            throw new IllegalArgumentException ("Grid too small: "+size);
        }
        this.stepMs = stepMs;
        this.step = Units.lnDopplerMs(stepMs);
        lnwave = new double[size];
        for (int i = 0; i < size; ++i)
            lnwave[i] = lnStart + i * step;
    }

    /**
     * Grid covering [lambdaMin, lambdaMax] (Angstrom) plus padSamples extra
     * samples on each side.
     */
    public static LogWavelengthGrid create (double lambdaMin, double lambdaMax,
                                            double stepMs, int padSamples) {
        if (!(lambdaMin > 0.) || !(lambdaMax > lambdaMin)) {
            throw new IllegalArgumentException
                ("Invalid wavelength range: "+lambdaMin+" - "+lambdaMax);
        }
        if (!(stepMs > 0.)) {
            throw new IllegalArgumentException ("Invalid grid step: "+stepMs);
        }
        double step = Units.lnDopplerMs(stepMs);
        double u0 = Math.log(lambdaMin) - padSamples * step;
        double u1 = Math.log(lambdaMax) + padSamples * step;
        int size = (int)Math.ceil((u1 - u0) / step) + 1;
        return new LogWavelengthGrid (u0, size, stepMs);
    }

    public int size () { return lnwave.length; }
    public double getStep () { return step; }
    public double getStepMs () { return stepMs; }

    /**
     * grid step as a velocity in km/s, the unit of the IP velocity grid
     */
    public double getStepKms () { return Units.msToKms(stepMs); }

    public double get (int i) { return lnwave[i]; }
    public double[] values () { return lnwave.clone(); }

    /**
     * the grid with halfSize samples trimmed from each end: the support 
     * of a "valid" convolution with a (2 halfSize + 1) kernel
     */
    public double[] trimmed (int halfSize) {
        return Arrays.copyOfRange(lnwave, halfSize, lnwave.length - halfSize);
    }

    /**
     * Piecewise linear interpolation of (xp, fp) at x with xp ascending;
     * values outside the range are clamped to the end points.
     */
    public static double interp (double x, double[] xp, double[] fp) {
        int n = xp.length;
        if (x <= xp[0]) return fp[0];
        if (x >= xp[n-1]) return fp[n-1];
        if (x != x) return Double.NaN;

        int lo = 0, hi = n - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (xp[mid] <= x) lo = mid;
            else hi = mid;
        }
        double t = (x - xp[lo]) / (xp[hi] - xp[lo]);
        return fp[lo] + t * (fp[hi] - fp[lo]);
    }

    public static double[] interp (double[] x, double[] xp, double[] fp) {
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; ++i)
            y[i] = interp (x[i], xp, fp);
        return y;
    }

    /**
     * Interpolation on a uniform abscissa x0 + i*dx, same clamping rules
     * as {@link #interp(double,double[],double[])}.
     */
    public static double interpUniform (double x, double x0, double dx, 
                                        double[] fp) {
        return interpIndex ((x - x0) / dx, fp);
    }

    /**
     * linear interpolation of fp at the fractional sample index pos,
     * clamped to the end values; an integral pos returns that sample
     */
    public static double interpIndex (double pos, double[] fp) {
        int n = fp.length;
        if (pos != pos) return Double.NaN;
        if (pos <= 0.) return fp[0];
        if (pos >= n - 1) return fp[n-1];
        int i = (int)pos;
        double t = pos - i;
        return t == 0. ? fp[i] : fp[i] + t * (fp[i+1] - fp[i]);
    }
}
