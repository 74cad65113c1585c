package tripod.rv.core;

/**
 * One spectral order as delivered by an instrument reader: pixel, vacuum
 * wavelength (Angstrom), flux, flux error, quality flag, an optional blaze
 * and the observation metadata.
 */
public class OrderContext {
    private final int order;
    private final double[] pixel;
    private final double[] wave;
    private final double[] flux;
    private final double[] error;
    private final int[] flag;
    private double[] blaze;
    private String dateObs;
    private Double berv; // [km/s], null if unknown

    public OrderContext (int order, double[] pixel, double[] wave, 
                         double[] flux, double[] error, int[] flag) {
        int n = pixel.length;
        if (wave.length != n || flux.length != n 
            || error.length != n || flag.length != n) {
            throw new IllegalArgumentException
                ("Order "+order+": array lengths differ");
        }
        if (n < 2) {
            throw new IllegalArgumentException
                ("Order "+order+" has too few pixels ("+n+")");
        }
        this.order = order;
        this.pixel = pixel.clone();
        this.wave = wave.clone();
        this.flux = flux.clone();
        this.error = error.clone();
        this.flag = flag.clone();
    }

    public int getOrder () { return order; }
    public int size () { return pixel.length; }

    public double[] getPixel () { return pixel.clone(); }
    public double[] getWave () { return wave.clone(); }
    public double[] getFlux () { return flux.clone(); }
    public double[] getError () { return error.clone(); }
    public int[] getFlag () { return flag.clone(); }

    public double getPixel (int i) { return pixel[i]; }
    public double getWave (int i) { return wave[i]; }
    public double getFlux (int i) { return flux[i]; }
    public double getError (int i) { return error[i]; }
    public int getFlag (int i) { return flag[i]; }

    public OrderContext setBlaze (double[] blaze) {
        if (blaze != null && blaze.length != pixel.length) {
            throw new IllegalArgumentException
                ("Order "+order+": blaze length "+blaze.length
                 +" != "+pixel.length);
        }
        this.blaze = blaze != null ? blaze.clone() : null;
        return this;
    }
    public boolean hasBlaze () { return blaze != null; }
    public double getBlaze (int i) { return blaze != null ? blaze[i] : 1.; }
    public double[] getBlaze () { return blaze != null ? blaze.clone() : null; }

    public OrderContext setDateObs (String dateObs) {
        this.dateObs = dateObs;
        return this;
    }
    public String getDateObs () { return dateObs; }

    public OrderContext setBerv (Double berv) {
        this.berv = berv;
        return this;
    }
    public Double getBerv () { return berv; }

    public double getWaveMin () {
        double min = Double.POSITIVE_INFINITY;
        for (double w : wave)
            if (w < min) min = w;
        return min;
    }

    public double getWaveMax () {
        double max = Double.NEGATIVE_INFINITY;
        for (double w : wave)
            if (w > max) max = w;
        return max;
    }

    public String toString () {
        return "OrderContext{order="+order+",pixels="+pixel.length
            +",range="+getWaveMin()+"-"+getWaveMax()
            +",dateobs="+dateObs+",berv="+berv+"}";
    }
}
