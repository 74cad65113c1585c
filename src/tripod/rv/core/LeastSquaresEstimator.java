package tripod.rv.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.util.Pair;

/**
 * Bounded Levenberg-Marquardt fit of a {@link FitProblem} with iterative
 * kappa-sigma clipping:
 *
 * <pre>
 *   INITIAL -> FITTING -> EVALUATING -> (CLIPPING -> FITTING)*
 *           -> CONVERGED | MAX_ITERATIONS_REACHED | FAILED
 * </pre>
 *
 * All orders of the problem are fitted jointly in one residual vector;
 * clipping is done per order.
 */
public class LeastSquaresEstimator implements Estimator {
    private static final Logger logger = Logger.getLogger
        (LeastSquaresEstimator.class.getName());

    static final int DEBUG = Integer.getInteger("rv.debug", 0);

    // relative forward-difference step
    static final double FD_STEP = 1.5e-8;
    static final double COST_TOLERANCE = 1e-10;
    static final double PARAMETER_TOLERANCE = 1e-10;
    // Jacobian columns below this fraction of the largest are inert
    static final double INERT_COLUMN = 1e-6;
    // finite-difference columns are known to about this relative precision;
    // smaller singular values of the unit-column Jacobian count as zero
    static final double RANK_TOLERANCE = 1e-7;
    // residual scale below this fraction of the data scale is rounding
    static final double ROUNDING_SCALE = 1e-12;

    /**
     * Weighted model of the good pixels of all orders, with a
     * forward-difference Jacobian. Evaluates on its own copy of the
     * parameters.
     */
    static class Objective implements MultivariateJacobianFunction {
        final List<ForwardModel> models;
        final int[][] good;
        final double[][] sigma;
        final ParameterSet work;
        final double[] upper;
        final double[] target; // weighted observations
        final int size;
        int evaluations;

        Objective (List<ForwardModel> models, List<ModelSetup> orders,
                   int[][] good, FitConfig config, ParameterSet par) {
            this.models = models;
            this.good = good;
            this.sigma = sigma (orders, good, config);
            this.work = par.copy();
            this.upper = par.upperBounds();
            int n = 0;
            for (int[] g : good)
                n += g.length;
            size = n;

            target = new double[size];
            int off = 0;
            for (int o = 0; o < good.length; ++o) {
                OrderContext ctx = orders.get(o).getContext();
                for (int k = 0; k < good[o].length; ++k)
                    target[off + k] = ctx.getFlux(good[o][k]) / sigma[o][k];
                off += good[o].length;
            }
        }

        double[] evaluate (double[] p) {
            work.fromFreeVector(p);
            double[] out = new double[size];
            int off = 0;
            for (int o = 0; o < models.size(); ++o) {
                double[] m;
                try {
                    m = models.get(o).evaluate(work, good[o]);
                }
                catch (InvalidWidthException ex) {
                    throw new SolverFailureException (ex.getMessage(), ex);
                }
                for (int k = 0; k < m.length; ++k)
                    out[off + k] = m[k] / sigma[o][k];
                off += m.length;
            }
            ++evaluations;
            return out;
        }

        public Pair<RealVector, RealMatrix> value (RealVector point) {
            double[] p = point.toArray();
            double[] f0 = evaluate (p);
            double[][] jac = new double[size][p.length];
            for (int j = 0; j < p.length; ++j) {
                double h = FD_STEP * Math.max(Math.abs(p[j]), 1.);
                if (p[j] + h > upper[j])
                    h = -h; // step back from the upper bound
                double[] q = p.clone();
                q[j] += h;
                double[] f1 = evaluate (q);
                for (int i = 0; i < size; ++i)
                    jac[i][j] = (f1[i] - f0[i]) / h;
            }
            if (DEBUG > 1) {
                logger.info("evaluation "+evaluations+": "+work);
            }
            return new Pair<RealVector, RealMatrix>
                (new ArrayRealVector (f0, false),
                 new Array2DRowRealMatrix (jac, false));
        }
    }

    private Estimator.State state = Estimator.State.INITIAL;
    private int evaluations;

    public LeastSquaresEstimator () {
    }

    /**
     * state reached by the last call to estimate
     */
    public Estimator.State getState () { return state; }

    public FitResult estimate (FitProblem problem) {
        FitConfig config = problem.getConfig();
        ParameterSet par = problem.getParameters();
        List<ModelSetup> orders = problem.getOrders();
        List<ForwardModel> models = new ArrayList<ForwardModel>();
        int[][] flags = new int[orders.size()][];
        for (int o = 0; o < orders.size(); ++o) {
            models.add(orders.get(o).getModel());
            flags[o] = orders.get(o).getFlag();
        }

        state = Estimator.State.INITIAL;
        evaluations = 0;
        par.clearErrors();
        List<Integer> history = new ArrayList<Integer>();
        List<List<Integer>> orderHistory = new ArrayList<List<Integer>>();
        for (int o = 0; o < orders.size(); ++o)
            orderHistory.add(new ArrayList<Integer>());

        String reason = null;
        LeastSquaresOptimizer.Optimum optimum = null;
        Objective objective = null;
        try {
            prefit (problem, models, par, flags);

            int refits = 0;
            for (;;) {
                state = Estimator.State.FITTING;
                int[][] good = goodIndices (flags);
                int total = 0;
                for (int o = 0; o < good.length; ++o) {
                    orderHistory.get(o).add(good[o].length);
                    total += good[o].length;
                }
                history.add(total);

                objective = new Objective (models, orders, good, config, par);
                if (par.getFreeCount() > 0) {
                    optimum = fit (objective, par, config);
                    par.fromFreeVector(optimum.getPoint().toArray());
                    logger.info("Pass "+history.size()+": "+total
                                +" good pixels, cost="+optimum.getCost()
                                +", "+optimum.getIterations()+" iteration(s)");
                }
                else {
                    // nothing to fit; still check the model evaluates
                    objective.evaluate(new double[0]);
                }
                evaluations += objective.evaluations;

                state = Estimator.State.EVALUATING;
                int[][] before = new int[flags.length][];
                for (int o = 0; o < flags.length; ++o)
                    before[o] = flags[o].clone();
                int clipped = clip (orders, par, flags, config);
                if (clipped == 0) {
                    state = Estimator.State.CONVERGED;
                    break;
                }

                state = Estimator.State.CLIPPING;
                logger.info(clipped+" pixel(s) clipped after pass "
                            +history.size());
                if (refits >= config.getMaxClipIterations()) {
                    // keep the mask the last fit was done with
                    flags = before;
                    state = Estimator.State.MAX_ITERATIONS_REACHED;
                    reason = "Clipping did not stabilize within "
                        +config.getMaxClipIterations()+" refit(s)";
                    logger.warning(reason);
                    break;
                }
                ++refits;
            }
        }
        catch (SolverFailureException ex) {
            reason = failed (ex);
        }
        catch (MathIllegalStateException ex) {
            reason = failed (ex);
        }
        catch (MathIllegalArgumentException ex) {
            reason = failed (ex);
        }

        Double rv = null, rvError = null, chi2 = null;
        if (state != Estimator.State.FAILED) {
            par.checkBounds();
            if (optimum != null) {
                double[] stderr = errors
                    (optimum.getJacobian(), optimum.getCost(), config);
                par.setErrors(stderr);
                int dof = objective.size - par.getFreeCount();
                if (dof > 0)
                    chi2 = optimum.getCost() * optimum.getCost() / dof;
            }
            else {
                par.setErrors(new double[0]);
            }
            Parameter p = par.get(ParameterNames.RV);
            rv = p.getValue();
            rvError = p.isFixed() ? 0. : p.getStderr();
            if (rvError != null && rvError.isNaN())
                rvError = null; // undetermined
        }

        List<OrderResult> results = new ArrayList<OrderResult>();
        for (int o = 0; o < orders.size(); ++o) {
            OrderResult r = new OrderResult (orders.get(o), par, flags[o]);
            r.setHistory(orderHistory.get(o));
            results.add(r);
        }

        Double prms = null;
        if (state != Estimator.State.FAILED)
            prms = percentRms (results);

        FitResult result = new FitResult
            (state.toStatus(), reason, rv, rvError, prms, chi2,
             par.snapshot(), results, history, evaluations);
        logger.info("Fit "+state+": rv="+rv+" +/- "+rvError+" km/s, prms="
                    +prms+", passes="+history);
        return result;
    }

    String failed (RuntimeException ex) {
        state = Estimator.State.FAILED;
        logger.warning("Fit failed: "+ex.getMessage());
        return ex.getMessage() != null
            ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    /**
     * Gaussian fit (first IP width only) refining the other parameters
     * before the main fit of a multi-parameter IP shape. A failure is
     * logged and ignored.
     */
    void prefit (FitProblem problem, List<ForwardModel> models,
                 ParameterSet par, int[][] flags) {
        FitConfig config = problem.getConfig();
        ProfileShape shape = config.getIpShape();
        if (!config.getPrefit() || shape == ProfileShape.GAUSSIAN
            || shape.getParameterCount(0) < 2) {
            return;
        }

        List<String> extra = new ArrayList<String>();
        List<ForwardModel> gauss = new ArrayList<ForwardModel>();
        for (ForwardModel m : models) {
            for (int i = 1; i < m.getIpParameterCount(); ++i)
                extra.add(m.getNames().ip(i));
            gauss.add(m.withShape(ProfileShape.GAUSSIAN));
        }
        ParameterSet p1 = par.copyFixing(extra);
        if (p1.getFreeCount() == 0)
            return;

        int[][] good = goodIndices (flags);
        Objective objective = new Objective
            (gauss, problem.getOrders(), good, config, p1);
        try {
            LeastSquaresOptimizer.Optimum o = fit (objective, p1, config);
            p1.fromFreeVector(o.getPoint().toArray());
            par.assign(p1);
            logger.info("Gaussian pre-fit done in "+o.getIterations()
                        +" iteration(s)");
        }
        catch (SolverFailureException ex) {
            logger.warning("Gaussian pre-fit failed: "+ex.getMessage());
        }
        catch (MathIllegalStateException ex) {
            logger.warning("Gaussian pre-fit failed: "+ex.getMessage());
        }
        catch (MathIllegalArgumentException ex) {
            logger.warning("Gaussian pre-fit failed: "+ex.getMessage());
        }
        evaluations += objective.evaluations;
    }

    static LeastSquaresOptimizer.Optimum fit
        (Objective objective, ParameterSet par, FitConfig config) {
        final double[] lower = par.lowerBounds();
        final double[] upper = par.upperBounds();
        ParameterValidator validator = new ParameterValidator () {
                public RealVector validate (RealVector params) {
                    for (int i = 0; i < lower.length; ++i) {
                        double v = params.getEntry(i);
                        if (v < lower[i])
                            params.setEntry(i, lower[i]);
                        else if (v > upper[i])
                            params.setEntry(i, upper[i]);
                    }
                    return params;
                }
            };

        LeastSquaresProblem problem = new LeastSquaresBuilder()
            .start(par.toFreeVector())
            .model(objective)
            .target(objective.target)
            .parameterValidator(validator)
            .lazyEvaluation(false)
            .maxEvaluations(config.getMaxEvaluations())
            .maxIterations(config.getMaxIterations())
            .build();

        LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer()
            .withCostRelativeTolerance(COST_TOLERANCE)
            .withParameterRelativeTolerance(PARAMETER_TOLERANCE);
        return optimizer.optimize(problem);
    }

    /**
     * Standard errors from the covariance at the optimum, scaled by the
     * reduced chi-square unless the errors are absolute. Parameters
     * without influence on the model get NaN. If the remaining columns
     * of the Jacobian are linearly dependent the covariance does not
     * exist and every error is NaN.
     *
     * @param jac weighted Jacobian at the optimum
     * @param cost norm of the weighted residuals
     */
    static double[] errors (RealMatrix jac, double cost, FitConfig config) {
        int size = jac.getRowDimension(), np = jac.getColumnDimension();
        double[] stderr = new double[np];
        Arrays.fill(stderr, Double.NaN);

        double[] norm = new double[np];
        double max = 0.;
        for (int j = 0; j < np; ++j) {
            norm[j] = jac.getColumnVector(j).getNorm();
            max = Math.max(max, norm[j]);
        }
        List<Integer> active = new ArrayList<Integer>();
        for (int j = 0; j < np; ++j)
            if (norm[j] > INERT_COLUMN * max)
                active.add(j);
        if (active.isEmpty())
            return stderr;

        // unit columns, so the rank test sees only the geometry
        int na = active.size();
        RealMatrix unit = new Array2DRowRealMatrix (size, na);
        for (int k = 0; k < na; ++k) {
            int j = active.get(k);
            unit.setColumnVector
                (k, jac.getColumnVector(j).mapDivide(norm[j]));
        }
        SingularValueDecomposition svd = new SingularValueDecomposition (unit);
        double[] sv = svd.getSingularValues();
        if (sv.length < na || !(sv[na-1] > RANK_TOLERANCE * sv[0])) {
            logger.warning("Singular covariance matrix (condition "
                           +svd.getConditionNumber()
                           +"); parameter errors not available");
            return stderr;
        }
        RealMatrix cov = svd.getCovariance(0.);

        double scale = 1.;
        int dof = size - np;
        if (!config.getAbsoluteSigma())
            scale = dof > 0 ? cost * cost / dof : Double.NaN;

        for (int k = 0; k < na; ++k) {
            int j = active.get(k);
            double v = cov.getEntry(k, k) * scale;
            stderr[j] = v >= 0. ? Math.sqrt(v) / norm[j] : Double.NaN;
        }
        return stderr;
    }

    /**
     * Flag the good pixels whose weighted residual falls below
     * -low*scale or above high*scale; a zero threshold disables its
     * side. Each order uses its own scale.
     *
     * @return number of pixels newly flagged
     */
    static int clip (List<ModelSetup> orders, ParameterSet par,
                     int[][] flags, FitConfig config) {
        double low = config.getKapsigLow(), high = config.getKapsigHigh();
        if (low <= 0. && high <= 0.)
            return 0;

        int clipped = 0;
        for (int o = 0; o < orders.size(); ++o) {
            ModelSetup setup = orders.get(o);
            OrderContext ctx = setup.getContext();
            int[] good = ModelSetup.goodIndices(flags[o]);
            if (good.length == 0)
                continue;

            double[] m = setup.getModel().evaluate(par, good);
            double[] r = new double[good.length];
            double norm = 0.;
            for (int k = 0; k < good.length; ++k) {
                double s = weight (ctx, good[k], config);
                r[k] = (ctx.getFlux(good[k]) - m[k]) / s;
                norm += Math.abs(ctx.getFlux(good[k]) / s);
            }
            norm /= good.length;
            double scale = new StandardDeviation (false).evaluate(r);
            if (!(scale > ROUNDING_SCALE * norm))
                continue;

            for (int k = 0; k < good.length; ++k) {
                if ((low > 0. && r[k] < -low * scale)
                    || (high > 0. && r[k] > high * scale)) {
                    flags[o][good[k]] |= PixelFlag.CLIP;
                    ++clipped;
                }
            }
        }
        return clipped;
    }

    static double weight (OrderContext ctx, int i, FitConfig config) {
        return config.getWeighting() == FitConfig.Weighting.ERROR
            ? ctx.getError(i) : 1.;
    }

    static double[][] sigma (List<ModelSetup> orders, int[][] good,
                             FitConfig config) {
        double[][] sigma = new double[good.length][];
        for (int o = 0; o < good.length; ++o) {
            OrderContext ctx = orders.get(o).getContext();
            sigma[o] = new double[good[o].length];
            for (int k = 0; k < good[o].length; ++k)
                sigma[o][k] = weight (ctx, good[o][k], config);
        }
        return sigma;
    }

    static int[][] goodIndices (int[][] flags) {
        int[][] good = new int[flags.length][];
        for (int o = 0; o < flags.length; ++o)
            good[o] = ModelSetup.goodIndices(flags[o]);
        return good;
    }

    static Double percentRms (List<OrderResult> results) {
        int n = 0;
        for (OrderResult r : results)
            n += r.residuals.length;
        double[] res = new double[n], obs = new double[n];
        int off = 0;
        for (OrderResult r : results) {
            System.arraycopy(r.residuals, 0, res, off, r.residuals.length);
            System.arraycopy(r.fluxOk, 0, obs, off, r.fluxOk.length);
            off += r.residuals.length;
        }
        return OrderResult.percentRms(res, obs);
    }
}
