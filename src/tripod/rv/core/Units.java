package tripod.rv.core;

/**
 * Speed of light and the velocity conversions used across the model.
 * RV-scale quantities (guess, result, bounds, tellshift) are in km/s;
 * the resampling grid and atmosphere adapter work in m/s. Crossing
 * between the two always goes through {@link #kmsToMs} or
 * {@link #msToKms}.
 */
public final class Units {
    public static final double C_KMS = 299792.458; // [km/s]
    public static final double C_MS = 299792458.;  // [m/s]

    private Units () {}

    public static double kmsToMs (double v) { return v * 1000.; }
    public static double msToKms (double v) { return v / 1000.; }

    /**
     * ln(1 + v/c) for a velocity in km/s
     */
    public static double lnDoppler (double vKms) {
        return Math.log1p(vKms / C_KMS);
    }

    /**
     * ln(1 + v/c) for a velocity in m/s
     */
    public static double lnDopplerMs (double vMs) {
        return Math.log1p(vMs / C_MS);
    }
}
