package tripod.rv.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Per-order record of a setup or fit: the arrays aligned with the good
 * pixels, the full arrays for displaying rejected points and the IP.
 */
public class OrderResult {
    private static final Logger logger =
        Logger.getLogger(OrderResult.class.getName());

    final int order;
    final String dateObs;
    final double berv;
    final double xcen;
    final int[] good;

    final double[] pixelOk;
    final double[] waveOk;
    final double[] fluxOk;
    final double[] model; // NaN if the model cannot be evaluated
    final double[] residuals;
    final Double prms;

    final double[] pixel;
    final double[] wave;
    final double[] flux;
    final int[] flag;

    final double[] ipVelocity;
    final double[] ipKernel; // null if the kernel cannot be built

    double[] lnwave; // setup only
    double[] transmission; // setup only
    List<Integer> history = Collections.emptyList();

    OrderResult (ModelSetup setup, ParameterSet par, int[] flag) {
        OrderContext ctx = setup.getContext();
        ForwardModel fm = setup.getModel();
        this.order = ctx.getOrder();
        this.dateObs = ctx.getDateObs();
        this.berv = setup.getBerv();
        this.xcen = fm.getXcen();
        this.good = ModelSetup.goodIndices(flag);

        int n = good.length;
        pixelOk = new double[n];
        waveOk = new double[n];
        fluxOk = new double[n];
        for (int k = 0; k < n; ++k) {
            pixelOk[k] = ctx.getPixel(good[k]);
            waveOk[k] = ctx.getWave(good[k]);
            fluxOk[k] = ctx.getFlux(good[k]);
        }

        double[] m = null;
        try {
            m = fm.evaluate(par, good);
        }
        catch (SolverFailureException ex) {
            logger.warning("Order "+order+": "+ex.getMessage());
        }
        catch (InvalidWidthException ex) {
            logger.warning("Order "+order+": "+ex.getMessage());
        }

        model = new double[n];
        residuals = new double[n];
        if (m != null) {
            for (int k = 0; k < n; ++k) {
                model[k] = m[k];
                residuals[k] = fluxOk[k] - m[k];
            }
            prms = percentRms (residuals, fluxOk);
        }
        else {
            Arrays.fill(model, Double.NaN);
            Arrays.fill(residuals, Double.NaN);
            prms = null;
        }

        pixel = ctx.getPixel();
        wave = ctx.getWave();
        flux = ctx.getFlux();
        this.flag = flag.clone();

        ipVelocity = fm.getVelocityGrid();
        double[] k = null;
        try {
            k = fm.kernel(par);
        }
        catch (InvalidWidthException ex) {
            logger.warning("Order "+order+": "+ex.getMessage());
        }
        catch (SolverFailureException ex) {
            logger.warning("Order "+order+": "+ex.getMessage());
        }
        ipKernel = k;
    }

    /**
     * setup record: adds the log-wavelength grid and the transmission
     */
    static OrderResult setup (ModelSetup setup, ParameterSet par) {
        OrderResult r = new OrderResult (setup, par, setup.flag());
        ForwardModel fm = setup.getModel();
        r.lnwave = fm.getGrid().values();
        r.transmission = fm.transmission(par);
        return r;
    }

    /**
     * 100 * rms(residuals) / mean(observed)
     */
    static Double percentRms (double[] residuals, double[] obs) {
        if (residuals.length == 0)
            return null;
        double ss = 0., mean = 0.;
        for (int k = 0; k < residuals.length; ++k) {
            ss += residuals[k] * residuals[k];
            mean += obs[k];
        }
        mean /= obs.length;
        return 100. * Math.sqrt(ss / residuals.length) / mean;
    }

    public int getOrder () { return order; }
    public String getDateObs () { return dateObs; }
    public double getBerv () { return berv; }
    public double getXcen () { return xcen; }
    public int getGoodCount () { return good.length; }
    public int[] getGoodIndices () { return good.clone(); }

    public double[] getPixelOk () { return pixelOk.clone(); }
    public double[] getWaveOk () { return waveOk.clone(); }
    public double[] getFluxOk () { return fluxOk.clone(); }
    public double[] getModel () { return model.clone(); }
    public double[] getResiduals () { return residuals.clone(); }
    public Double getPrms () { return prms; }

    public double[] getPixel () { return pixel.clone(); }
    public double[] getWave () { return wave.clone(); }
    public double[] getFlux () { return flux.clone(); }
    public int[] getFlag () { return flag.clone(); }

    public double[] getIpVelocity () { return ipVelocity.clone(); }
    public double[] getIpKernel () {
        return ipKernel != null ? ipKernel.clone() : null;
    }

    public double[] getLnwave () {
        return lnwave != null ? lnwave.clone() : null;
    }
    public double[] getTransmission () {
        return transmission != null ? transmission.clone() : null;
    }

    /**
     * good-pixel count before each fit pass
     */
    public List<Integer> getHistory () { return history; }

    void setHistory (List<Integer> history) {
        this.history = Collections.unmodifiableList
            (new ArrayList<Integer>(history));
    }

    public String toString () {
        return "OrderResult{order="+order+",good="+good.length+"/"
            +pixel.length+",prms="+prms+"}";
    }
}
