package tripod.rv.core;

/**
 * A wavelength (Angstrom, vacuum) / value series: a stellar template or
 * the transmission of one atmospheric molecule. Stored in ascending
 * wavelength order.
 */
public class Series {
    private final String name;
    private final double[] wave;
    private final double[] flux;

    public Series (String name, double[] wave, double[] flux) {
        if (wave.length != flux.length) {
            throw new IllegalArgumentException
                (name+": "+wave.length+" wavelength(s) but "
                 +flux.length+" value(s)");
        }
        if (wave.length < 2) {
            throw new IllegalArgumentException
                (name+": series needs at least two samples");
        }
        this.name = name;
        boolean descending = wave[0] > wave[wave.length-1];
        this.wave = new double[wave.length];
        this.flux = new double[flux.length];
        for (int i = 0, n = wave.length; i < n; ++i) {
            int j = descending ? n - 1 - i : i;
            this.wave[i] = wave[j];
            this.flux[i] = flux[j];
        }
        for (int i = 1; i < this.wave.length; ++i) {
            if (!(this.wave[i] > this.wave[i-1])) {
                throw new IllegalArgumentException
                    (name+": wavelengths not strictly monotonic at "+i);
            }
        }
    }

    public String getName () { return name; }
    public int size () { return wave.length; }
    public double getWaveMin () { return wave[0]; }
    public double getWaveMax () { return wave[wave.length-1]; }
    public double[] getWave () { return wave.clone(); }
    public double[] getFlux () { return flux.clone(); }

    /**
     * natural log of the wavelengths shifted by -ln(1 + v/c), v in km/s
     */
    public double[] lnWave (double vKms) {
        double shift = Units.lnDoppler(vKms);
        double[] u = new double[wave.length];
        for (int i = 0; i < u.length; ++i)
            u[i] = Math.log(wave[i]) - shift;
        return u;
    }

    double[] flux () { return flux; }

    public String toString () {
        return "Series{name="+name+",size="+wave.length
            +",range="+getWaveMin()+"-"+getWaveMax()+"}";
    }
}
