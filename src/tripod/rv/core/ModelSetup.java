package tripod.rv.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Initial setup of one order: pixel flags, the log-wavelength grid, the
 * resampled molecules, the {@link ForwardModel} and the initial guesses
 * of its parameters.
 */
public class ModelSetup {
    private static final Logger logger =
        Logger.getLogger(ModelSetup.class.getName());

    // molecules varying less than this over the grid are not fitted
    static final double FLAT_MOLECULE = 1e-4;

    private final OrderContext context;
    private final FitConfig config;
    private final ForwardModel model;
    private final ParameterSet params;
    private final int[] flag;
    private final double berv;

    ModelSetup (OrderContext context, FitConfig config, ForwardModel model,
                ParameterSet params, int[] flag, double berv) {
        this.context = context;
        this.config = config;
        this.model = model;
        this.params = params;
        this.flag = flag;
        this.berv = berv;
    }

    public OrderContext getContext () { return context; }
    public FitConfig getConfig () { return config; }
    public ForwardModel getModel () { return model; }
    public ParameterSet getParameters () { return params; }
    public int[] getFlag () { return flag.clone(); }
    public double getBerv () { return berv; }

    int[] flag () { return flag; }

    /**
     * Set up one order.
     *
     * @param template stellar template or null
     * @param atmosphere molecule transmissions or null; ignored when the
     *    telluric mode is off
     */
    public static ModelSetup create (OrderContext ctx, Series template,
                                     Atmosphere atmosphere, FitConfig config) {
        config.validate();
        int order = ctx.getOrder();
        ParameterNames names = new ParameterNames
            (ParameterNames.groupOf(order));

        double berv = resolveBerv (ctx, config);
        int[] flag = initialFlags (ctx, template, berv, config);

        int[] good = goodIndices (flag);
        if (good.length <= Math.max(config.getDegWave(),
                                    config.getDegNorm()) + 1) {
            throw new IllegalArgumentException
                ("Order "+order+" has too few good pixels ("+good.length+")");
        }

        // polynomial abscissa
        double xcen = 0.;
        for (int i : good)
            xcen += ctx.getPixel(i);
        xcen /= good.length;
        double xscale = 0.;
        for (int i = 0; i < ctx.size(); ++i) {
            double x = ctx.getPixel(i);
            if (!Double.isNaN(x) && !Double.isInfinite(x))
                xscale = Math.max(xscale, Math.abs(x - xcen));
        }
        if (!(xscale > 0.))
            xscale = 1.;

        // grid padded for the kernel and for velocity shifts up to vcut
        int pad = config.getIpHalfSize() + (int)Math.ceil
            (Units.kmsToMs(config.getVcut()) / config.getGridStepMs()) + 1;
        LogWavelengthGrid grid = LogWavelengthGrid.create
            (ctx.getWaveMin(), ctx.getWaveMax(), config.getGridStepMs(), pad);
        double[] cell = Atmosphere.flatCell(grid.size());

        List<String> molecules = new ArrayList<String>();
        List<double[]> molecFlux = new ArrayList<double[]>();
        List<String> flat = new ArrayList<String>();
        if (config.getTelluric() == FitConfig.Telluric.ADD
            && atmosphere != null && !atmosphere.isEmpty()) {
            for (String m : atmosphere.select(config.getMolecules())) {
                double[] t = atmosphere.resample(m, grid);
                molecules.add(m);
                molecFlux.add(t);
                if (Atmosphere.stddev(t) <= FLAT_MOLECULE)
                    flat.add(m);
            }
        }
        boolean tellShift = config.getTellShift() && !molecules.isEmpty();

        ForwardModel model = new ForwardModel
            (order, grid, cell, molecules,
             molecFlux.toArray(new double[0][]), tellShift, template, berv,
             config.getIpShape(), config.getIpHalfSize(),
             config.getDegNorm(), config.getDegWave(), ctx.getPixel(),
             ctx.getBlaze(), xcen, xscale);

        ParameterSet params = new ParameterSet ();
        if (template != null)
            params.add(names.rv(), config.getRvGuess());
        else // rv has no influence on the model
            params.addFixed(names.rv(), config.getRvGuess());

        double norm = initialNorm (ctx, model, good, cell);
        String group = names.getGroup();
        for (int i = 0; i <= config.getDegNorm(); ++i)
            params.add(names.norm(i), i == 0 ? norm : 0.,
                       null, null, false, group);

        double[] wave = initialWave (ctx, model, good, config.getDegWave());
        for (int i = 0; i < wave.length; ++i)
            params.add(names.wave(i), wave[i], null, null, false, group);

        ProfileShape shape = config.getIpShape();
        double[] ip = shape.getInitialValues();
        for (int i = 0; i < ip.length; ++i)
            params.add(names.ip(i), ip[i], shape.getLowerBound(i), null,
                       false, group);

        for (String m : molecules) {
            if (flat.contains(m)) {
                logger.info("Order "+order+": molecule "+m
                            +" is flat over the order; not fitted");
                params.add(names.atm(m), 0., 0., null, true, null);
            }
            else {
                params.add(names.atm(m), 1., 0., null, false, null);
            }
        }
        if (tellShift)
            params.add(names.tellShift(), 0., null, null, false, null);
        params.addFixed(names.bkg(), 0., group);

        logger.info("Order "+order+": "+good.length+"/"+ctx.size()
                    +" good pixels, grid "+grid.size()+" samples, "
                    +molecules.size()+" molecule(s), template="
                    +(template != null ? template.getName() : "none"));
        return new ModelSetup (ctx, config, model, params, flag, berv);
    }

    static double resolveBerv (OrderContext ctx, FitConfig config) {
        if (config.getBerv() != null)
            return config.getBerv();
        if (ctx.getBerv() != null)
            return ctx.getBerv();
        logger.warning("Order "+ctx.getOrder()
                       +": no barycentric correction available; using 0.0");
        return 0.;
    }

    /**
     * working copy of the order flags with the setup flags added
     */
    static int[] initialFlags (OrderContext ctx, Series template,
                               double berv, FitConfig config) {
        int n = ctx.size();
        int[] flag = ctx.getFlag();
        boolean weighted = config.getWeighting() == FitConfig.Weighting.ERROR;
        for (int i = 0; i < n; ++i) {
            double f = ctx.getFlux(i), e = ctx.getError(i);
            double x = ctx.getPixel(i), w = ctx.getWave(i);
            if (Double.isNaN(f) || Double.isInfinite(f)
                || Double.isNaN(e) || Double.isInfinite(e)
                || Double.isNaN(x) || Double.isInfinite(x)
                || Double.isNaN(w) || Double.isInfinite(w)
                || (weighted && !(e > 0.)))
                flag[i] |= PixelFlag.NAN;
        }

        if (template != null) {
            double[] u = template.lnWave(berv);
            double cut = Units.lnDoppler(config.getVcut());
            double umin = u[0] + cut, umax = u[u.length-1] - cut;
            for (int i = 0; i < n; ++i) {
                double lw = Math.log(ctx.getWave(i));
                if (lw < umin || lw > umax)
                    flag[i] |= PixelFlag.OUT;
            }
        }

        if (config.getPreclip() > 0.)
            preclip (ctx, flag, config.getPreclip());
        return flag;
    }

    /**
     * flag upper outliers (cosmics) above median + kappa robust sigmas
     */
    static int preclip (OrderContext ctx, int[] flag, double kappa) {
        int[] good = goodIndices (flag);
        if (good.length == 0)
            return 0;
        double[] f = new double[good.length];
        for (int k = 0; k < good.length; ++k)
            f[k] = ctx.getFlux(good[k]);

        Percentile pct = new Percentile ()
            .withEstimationType(Percentile.EstimationType.R_7);
        pct.setData(f);
        double p17 = pct.evaluate(17.), p50 = pct.evaluate(50.),
            p83 = pct.evaluate(83.);
        double cut = p50 + kappa * (p83 - p17) / 2.;

        int clipped = 0;
        for (int i : good) {
            if (ctx.getFlux(i) > cut) {
                flag[i] |= PixelFlag.CLIP;
                ++clipped;
            }
        }
        if (clipped > 0)
            logger.info("Order "+ctx.getOrder()+": "+clipped
                        +" pixel(s) above "+cut+" pre-clipped");
        return clipped;
    }

    static double initialNorm (OrderContext ctx, ForwardModel model,
                               int[] good, double[] cell) {
        double[] obs = new double[good.length];
        double[] blaze = new double[good.length];
        for (int k = 0; k < good.length; ++k) {
            obs[k] = ctx.getFlux(good[k]);
            blaze[k] = ctx.getBlaze(good[k]);
        }
        double star = 1.;
        if (model.hasTemplate()) {
            // template at the observed wavelengths, rv at its guess
            double[] s = new double[good.length];
            LogWavelengthGrid grid = model.getGrid();
            ParameterSet none = new ParameterSet ();
            none.add(ParameterNames.RV, 0.);
            double[] sj = model.stellar(none);
            for (int k = 0; k < good.length; ++k)
                s[k] = LogWavelengthGrid.interpUniform
                    (Math.log(ctx.getWave(good[k])), grid.get(0),
                     grid.getStep(), sj);
            star = finiteMean (s);
        }
        double norm = finiteMean (obs) / star / finiteMean (cell)
            / finiteMean (blaze);
        if (Double.isNaN(norm) || Double.isInfinite(norm)) {
            throw new IllegalArgumentException
                ("Order "+ctx.getOrder()
                 +": cannot estimate the normalization ("+norm+")");
        }
        return norm;
    }

    /**
     * mean of the finite values, NaN if there is none
     */
    static double finiteMean (double[] x) {
        double[] f = new double[x.length];
        int n = 0;
        for (double v : x)
            if (!Double.isNaN(v) && !Double.isInfinite(v))
                f[n++] = v;
        return n > 0 ? StatUtils.mean(f, 0, n) : Double.NaN;
    }

    /**
     * wavelength solution guess: polynomial fit of the good wavelengths
     * against the normalized pixel
     */
    static double[] initialWave (OrderContext ctx, ForwardModel model,
                                 int[] good, int degree) {
        WeightedObservedPoints points = new WeightedObservedPoints ();
        for (int i : good)
            points.add(model.normalizedPixel(ctx.getPixel(i)),
                       ctx.getWave(i));
        double[] a = PolynomialCurveFitter.create(degree)
            .fit(points.toList());
        return Arrays.copyOf(a, degree + 1);
    }

    static int[] goodIndices (int[] flag) {
        int n = 0;
        for (int f : flag)
            if (PixelFlag.isGood(f))
                ++n;
        int[] idx = new int[n];
        for (int i = 0, k = 0; i < flag.length; ++i)
            if (PixelFlag.isGood(flag[i]))
                idx[k++] = i;
        return idx;
    }
}
