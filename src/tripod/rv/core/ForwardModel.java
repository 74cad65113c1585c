package tripod.rv.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;

/**
 * Forward model of one order. Holds the immutable auxiliary data
 * (log-wavelength grid, resampled molecules, the barycentric-corrected
 * template, pixel normalization and blaze) and predicts the observed
 * flux from a {@link ParameterSet}:
 *
 * <pre>
 *   S(pixel) = blaze * norm(x) * [IP * (star(u - rv) * (gas(u) + bkg))](ln wave(x))
 *   x = (pixel - xcen) / xscale
 *   gas(u) = cell(u) * prod_m T_m(u - tellshift)^atm_m
 * </pre>
 *
 * Evaluation keeps no state between calls.
 */
public class ForwardModel {
    private final int order;
    private final ParameterNames names;
    private final LogWavelengthGrid grid;
    private final double[] lnwaveEff; // grid support of the valid convolution
    private final double[] cell;
    private final List<String> molecules;
    private final double[][] molecFlux; // on the grid
    private final boolean tellShift;
    private final double[] templateLn; // null = no template
    private final double[] templateFlux;
    private final ProfileShape shape;
    private final int ipHalfSize;
    private final double[] vk;
    private final int degNorm;
    private final int degWave;
    private final double[] pixel;
    private final double[] blaze; // null = none
    private final double xcen;
    private final double xscale;

    ForwardModel (int order, LogWavelengthGrid grid, double[] cell,
                  List<String> molecules, double[][] molecFlux,
                  boolean tellShift, Series template, double berv,
                  ProfileShape shape, int ipHalfSize, int degNorm,
                  int degWave, double[] pixel, double[] blaze,
                  double xcen, double xscale) {
        if (grid.size() <= 2 * ipHalfSize + 1) {
            throw new IllegalArgumentException
                ("Grid of "+grid.size()+" samples too small for IP half size "
                 +ipHalfSize);
        }
        if (cell.length != grid.size()) {
            throw new ShapeMismatchException (grid.size(), cell.length);
        }
        if (molecules.size() != molecFlux.length) {
            throw new ShapeMismatchException
                (molecules.size(), molecFlux.length);
        }
        if (!(xscale > 0.)) {
            throw new IllegalArgumentException
                ("Invalid pixel scale: "+xscale);
        }
        this.order = order;
        this.names = new ParameterNames (ParameterNames.groupOf(order));
        this.grid = grid;
        this.lnwaveEff = grid.trimmed(ipHalfSize);
        this.cell = cell;
        this.molecules = Collections.unmodifiableList(molecules);
        this.molecFlux = molecFlux;
        this.tellShift = tellShift;
        if (template != null) {
            templateLn = template.lnWave(berv);
            templateFlux = template.flux();
        }
        else {
            templateLn = null;
            templateFlux = null;
        }
        this.shape = shape;
        this.ipHalfSize = ipHalfSize;
        this.vk = InstrumentalProfile.velocityGrid
            (ipHalfSize, grid.getStepKms());
        this.degNorm = degNorm;
        this.degWave = degWave;
        this.pixel = pixel;
        this.blaze = blaze;
        this.xcen = xcen;
        this.xscale = xscale;
    }

    private ForwardModel (ForwardModel m, ProfileShape shape) {
        this.order = m.order;
        this.names = m.names;
        this.grid = m.grid;
        this.lnwaveEff = m.lnwaveEff;
        this.cell = m.cell;
        this.molecules = m.molecules;
        this.molecFlux = m.molecFlux;
        this.tellShift = m.tellShift;
        this.templateLn = m.templateLn;
        this.templateFlux = m.templateFlux;
        this.shape = shape;
        this.ipHalfSize = m.ipHalfSize;
        this.vk = m.vk;
        this.degNorm = m.degNorm;
        this.degWave = m.degWave;
        this.pixel = m.pixel;
        this.blaze = m.blaze;
        this.xcen = m.xcen;
        this.xscale = m.xscale;
    }

    /**
     * the same model with another IP shape; the shape reads the leading
     * ip parameters of the set
     */
    public ForwardModel withShape (ProfileShape shape) {
        return shape == this.shape ? this : new ForwardModel (this, shape);
    }

    public int getOrder () { return order; }
    public ParameterNames getNames () { return names; }
    public LogWavelengthGrid getGrid () { return grid; }
    public List<String> getMolecules () { return molecules; }
    public boolean hasTemplate () { return templateLn != null; }
    public boolean getTellShift () { return tellShift; }
    public ProfileShape getShape () { return shape; }
    public int getIpHalfSize () { return ipHalfSize; }
    public double[] getVelocityGrid () { return vk.clone(); }
    public int getDegNorm () { return degNorm; }
    public int getDegWave () { return degWave; }
    public double getXcen () { return xcen; }
    public double getXscale () { return xscale; }
    public int size () { return pixel.length; }

    public double normalizedPixel (double p) {
        return (p - xcen) / xscale;
    }

    public int getIpParameterCount () {
        return shape.getParameterCount(vk.length);
    }

    /**
     * IP kernel at the current shape parameters
     */
    public double[] kernel (ParameterSet par) {
        double[] p = new double[getIpParameterCount ()];
        for (int i = 0; i < p.length; ++i)
            p[i] = par.value(names.ip(i));
        return InstrumentalProfile.buildKernel(shape, vk, p);
    }

    /**
     * telluric transmission on the grid: flat cell times the molecules
     * raised to their coefficients, optionally shifted, plus background
     */
    public double[] transmission (ParameterSet par) {
        double[] gas = cell.clone();
        if (!molecules.isEmpty()) {
            double[] atm = new double[gas.length];
            Arrays.fill(atm, 1.);
            for (int m = 0; m < molecules.size(); ++m) {
                double coef = par.value(names.atm(molecules.get(m)));
                if (coef == 0.)
                    continue;
                double[] t = molecFlux[m];
                for (int j = 0; j < atm.length; ++j)
                    atm[j] *= Math.pow(t[j], coef);
            }
            if (tellShift) {
                double v = par.value(names.tellShift());
                atm = Atmosphere.shift(grid, atm, Units.kmsToMs(v));
            }
            for (int j = 0; j < gas.length; ++j)
                gas[j] *= atm[j];
        }

        double bkg = par.value(names.bkg());
        if (bkg != 0.) {
            for (int j = 0; j < gas.length; ++j)
                gas[j] += bkg;
        }
        return gas;
    }

    /**
     * stellar template on the grid, Doppler shifted by the rv parameter;
     * identically 1 without a template
     */
    public double[] stellar (ParameterSet par) {
        double[] s = new double[grid.size()];
        if (templateLn == null) {
            Arrays.fill(s, 1.);
        }
        else {
            double shift = Units.lnDoppler(par.value(names.rv()));
            for (int j = 0; j < s.length; ++j)
                s[j] = LogWavelengthGrid.interp
                    (grid.get(j) - shift, templateLn, templateFlux);
        }
        return s;
    }

    /**
     * model before the pixel mapping: the stellar times telluric
     * spectrum convolved with the IP, sampled on the trimmed grid
     */
    public double[] convolved (ParameterSet par) {
        double[] star = stellar (par);
        double[] gas = transmission (par);
        double[] f = new double[star.length];
        for (int j = 0; j < f.length; ++j)
            f[j] = star[j] * gas[j];
        return convolveValid (kernel (par), f);
    }

    /**
     * Discrete convolution restricted to the samples where the kernel
     * fully overlaps the signal.
     */
    static double[] convolveValid (double[] k, double[] f) {
        int hs = k.length / 2;
        double[] out = new double[f.length - k.length + 1];
        for (int j = 0; j < out.length; ++j) {
            int c = j + hs;
            double sum = 0.;
            for (int i = 0; i < k.length; ++i)
                sum += k[i] * f[c + hs - i];
            out[j] = sum;
        }
        return out;
    }

    public PolynomialFunction wavePolynomial (ParameterSet par) {
        double[] a = new double[degWave + 1];
        for (int i = 0; i < a.length; ++i)
            a[i] = par.value(names.wave(i));
        return new PolynomialFunction (a);
    }

    public PolynomialFunction normPolynomial (ParameterSet par) {
        double[] a = new double[degNorm + 1];
        for (int i = 0; i < a.length; ++i)
            a[i] = par.value(names.norm(i));
        return new PolynomialFunction (a);
    }

    /**
     * wavelength solution evaluated at the given pixels
     */
    public double[] wavelengths (ParameterSet par, int[] idx) {
        PolynomialFunction wave = wavePolynomial (par);
        double[] w = new double[idx.length];
        for (int k = 0; k < idx.length; ++k)
            w[k] = wave.value(normalizedPixel (pixel[idx[k]]));
        return w;
    }

    /**
     * Predicted flux at the pixels idx (indices into the order arrays).
     *
     * @throws SolverFailureException on a non-finite prediction
     * @throws InvalidWidthException if an IP width is not positive
     */
    public double[] evaluate (ParameterSet par, int[] idx) {
        double[] conv = convolved (par);
        PolynomialFunction wave = wavePolynomial (par);
        PolynomialFunction norm = normPolynomial (par);
        double u0 = lnwaveEff[0], du = grid.getStep();

        double[] out = new double[idx.length];
        for (int k = 0; k < idx.length; ++k) {
            int i = idx[k];
            double x = normalizedPixel (pixel[i]);
            double lambda = wave.value(x);
            if (!(lambda > 0.)) {
                throw new SolverFailureException
                    ("Order "+order+": non-positive wavelength "+lambda
                     +" at pixel "+pixel[i]);
            }
            double s = LogWavelengthGrid.interpUniform
                (Math.log(lambda), u0, du, conv);
            double v = s * norm.value(x) * (blaze != null ? blaze[i] : 1.);
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                throw new SolverFailureException
                    ("Order "+order+": non-finite model at pixel "+pixel[i]);
            }
            out[k] = v;
        }
        return out;
    }

    public String toString () {
        return "ForwardModel{order="+order+",grid="+grid.size()
            +",molecules="+molecules+",template="+hasTemplate()
            +",ip="+shape.getTag()+",ip.hs="+ipHalfSize
            +",deg.norm="+degNorm+",deg.wave="+degWave
            +",xcen="+xcen+",xscale="+xscale+"}";
    }
}
