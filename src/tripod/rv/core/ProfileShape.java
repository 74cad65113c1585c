package tripod.rv.core;

/**
 * Instrumental profile kernel shapes, selected by tag. Each constant
 * generates an unnormalized kernel over a velocity grid (km/s);
 * normalization and width validation are done by
 * {@link InstrumentalProfile#buildKernel}.
 */
public enum ProfileShape {
    /** Gaussian: sigma */
    GAUSSIAN ("g", new double[]{1.5}, new int[]{0}) {
        double[] shape (double[] vk, double[] p) {
            double s = p[0];
            double[] k = new double[vk.length];
            for (int i = 0; i < vk.length; ++i) {
                double u = vk[i] / s;
                k[i] = Math.exp(-.5 * u * u);
            }
            return k;
        }
    },

    /** super-Gaussian: sigma, exponent */
    SUPER_GAUSSIAN ("sg", new double[]{1.5, 2.}, new int[]{0, 1}) {
        double[] shape (double[] vk, double[] p) {
            double s = p[0], e = p[1];
            double[] k = new double[vk.length];
            for (int i = 0; i < vk.length; ++i)
                k[i] = Math.exp(-Math.pow(Math.abs(vk[i] / s), e));
            return k;
        }
    },

    /**
     * asymmetric (split) Gaussian: left sigma, right sigma. The left
     * side is scaled by its own width and the centre carries an explicit
     * zero offset.
     */
    ASYMMETRIC_GAUSSIAN ("ag", new double[]{1.5, 1.5}, new int[]{0, 1}) {
        double[] shape (double[] vk, double[] p) {
            double sl = p[0], sr = p[1];
            double[] k = new double[vk.length];
            for (int i = 0; i < vk.length; ++i) {
                double u = vk[i] + CENTER_OFFSET;
                u /= u < 0 ? sl : sr;
                k[i] = Math.exp(-.5 * u * u);
            }
            return k;
        }
    },

    /**
     * double Gaussian: core sigma, wing sigma, wing amplitude relative 
     * to the core
     */
    BI_GAUSSIAN ("bg", new double[]{1.5, 6., .1}, new int[]{0, 1}) {
        double[] shape (double[] vk, double[] p) {
            double s1 = p[0], s2 = p[1], a = p[2];
            double[] k = new double[vk.length];
            for (int i = 0; i < vk.length; ++i) {
                double u1 = vk[i] / s1, u2 = vk[i] / s2;
                double v = Math.exp(-.5 * u1 * u1) 
                    + a * Math.exp(-.5 * u2 * u2);
                k[i] = Math.max(0., v);
            }
            return k;
        }
    },

    /** Lorentzian: half width */
    LORENTZIAN ("lor", new double[]{1.5}, new int[]{0}) {
        double[] shape (double[] vk, double[] p) {
            double s = p[0];
            double[] k = new double[vk.length];
            for (int i = 0; i < vk.length; ++i)
                k[i] = s / (s * s + vk[i] * vk[i]);
            return k;
        }
    },

    /**
     * non-parametric band kernel: one free amplitude per grid point.
     * Not available from configuration.
     */
    BAND ("band", null, new int[0]) {
        double[] shape (double[] vk, double[] p) {
            if (p.length != vk.length) {
                throw new IllegalArgumentException
                    ("Band kernel needs "+vk.length+" amplitudes; got "
                     +p.length);
            }
            double[] k = new double[vk.length];
            for (int i = 0; i < vk.length; ++i)
                k[i] = Math.max(0., p[i]);
            return k;
        }

        public int getParameterCount (int gridSize) { return gridSize; }
        public boolean isConfigurable () { return false; }
    };

    // centre offset of the split Gaussian
    static final double CENTER_OFFSET = 0.;
    // smallest width accepted as a fit bound [km/s]
    public static final double MIN_WIDTH = 1e-3;

    final String tag;
    final double[] initial;
    final int[] widths;

    ProfileShape (String tag, double[] initial, int[] widths) {
        this.tag = tag;
        this.initial = initial;
        this.widths = widths;
    }

    abstract double[] shape (double[] vk, double[] p);

    public String getTag () { return tag; }

    public int getParameterCount (int gridSize) { return initial.length; }

    public boolean isConfigurable () { return true; }

    public double[] getInitialValues () { 
        return initial != null ? initial.clone() : new double[0]; 
    }

    public boolean isWidth (int param) {
        for (int w : widths)
            if (w == param)
                return true;
        return false;
    }

    /**
     * lower fit bound of a shape parameter; widths must stay positive 
     * and amplitudes non-negative
     */
    public double getLowerBound (int param) {
        return isWidth (param) ? MIN_WIDTH : 0.;
    }

    /**
     * shape for any tag, including non-configurable ones
     */
    public static ProfileShape forTag (String tag) {
        if (tag != null) {
            for (ProfileShape s : values()) {
                if (s.tag.equalsIgnoreCase(tag.trim()))
                    return s;
            }
        }
        throw new UnknownShapeException (tag);
    }

    /**
     * shape for a tag coming from configuration
     */
    public static ProfileShape forConfig (String tag) {
        ProfileShape s = forTag (tag);
        if (!s.isConfigurable()) {
            throw new UnknownShapeException (tag);
        }
        return s;
    }
}
