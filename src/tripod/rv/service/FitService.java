package tripod.rv.service;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import tripod.rv.core.Estimator;
import tripod.rv.core.FitConfig;
import tripod.rv.core.FitProblem;
import tripod.rv.core.FitResult;
import tripod.rv.core.LeastSquaresEstimator;
import tripod.rv.core.OrderContext;
import tripod.rv.core.OrderResult;
import tripod.rv.core.SetupResult;
import tripod.rv.io.CsvOrderReader;
import tripod.rv.io.CsvSeriesReader;
import tripod.rv.io.ResultWriter;
import tripod.rv.validation.FitChart;

/**
 * Setup and fit operations on a caller-owned {@link FitSession}.
 */
public class FitService {
    private static final Logger logger = 
        Logger.getLogger(FitService.class.getName());

    private final Estimator estimator;

    public FitService () {
        this (new LeastSquaresEstimator ());
    }

    public FitService (Estimator estimator) {
        this.estimator = estimator;
    }

    /**
     * Build the forward model(s) of the selected orders and evaluate the
     * initial guess. More than one selected order gives a joint problem.
     *
     * @throws IllegalArgumentException for invalid configuration or
     *    input, before any fitting is done
     */
    public SetupResult setup (FitSession session) {
        FitConfig config = session.getConfig().validate();
        List<OrderContext> selected = select (session.getOrders(), 
                                              config.getOrders());
        FitProblem problem = selected.size() == 1
            ? FitProblem.single(selected.get(0), session.getTemplate(),
                                session.getAtmosphere(), config)
            : FitProblem.joint(selected, session.getTemplate(),
                               session.getAtmosphere(), config);
        SetupResult setup = SetupResult.of(problem);
        session.setup(problem, setup);
        return setup;
    }

    /**
     * Fit a set-up session. The session's initial parameters are left
     * untouched so the fit can be repeated.
     */
    public FitResult fit (FitSession session) {
        if (!session.isSetup())
            setup (session);
        FitResult result = estimator.estimate(session.getProblem().copy());
        session.setResult(result);
        return result;
    }

    static List<OrderContext> select (List<OrderContext> orders,
                                      List<Integer> wanted) {
        if (orders.isEmpty()) {
            throw new IllegalArgumentException ("No orders in session");
        }
        if (wanted == null)
            return orders;

        List<OrderContext> selected = new ArrayList<OrderContext>();
        for (Integer o : wanted) {
            OrderContext found = null;
            for (OrderContext ctx : orders)
                if (ctx.getOrder() == o)
                    found = ctx;
            if (found == null) {
                throw new IllegalArgumentException ("No such order: "+o);
            }
            selected.add(found);
        }
        return selected;
    }

    static void usage () {
        System.err.println
            ("Usage: FitService [-config FILE] [-template FILE] "
             +"[-atmos FILE] [-out FILE.json] [-plot FILE.png] OBS.csv");
        System.exit(1);
    }

    public static void main (String[] argv) throws Exception {
        String config = null, template = null, atmos = null, 
            out = null, plot = null, obs = null;
        for (int i = 0; i < argv.length; ++i) {
            if (argv[i].startsWith("-") && i + 1 >= argv.length)
                usage ();
            if ("-config".equals(argv[i])) config = argv[++i];
            else if ("-template".equals(argv[i])) template = argv[++i];
            else if ("-atmos".equals(argv[i])) atmos = argv[++i];
            else if ("-out".equals(argv[i])) out = argv[++i];
            else if ("-plot".equals(argv[i])) plot = argv[++i];
            else if (argv[i].startsWith("-")) usage ();
            else obs = argv[i];
        }
        if (obs == null)
            usage ();

        try {
            FitConfig conf = new FitConfig ();
            if (config != null) {
                InputStream is = new FileInputStream (config);
                try {
                    conf = FitConfig.load(is);
                }
                finally {
                    is.close();
                }
            }
            logger.info(conf.toString());

            FitSession session = new FitSession (conf);
            InputStream is = new FileInputStream (obs);
            try {
                session.addOrders(new CsvOrderReader (is).readAll());
            }
            finally {
                is.close();
            }
            if (template != null) {
                is = new FileInputStream (template);
                try {
                    session.setTemplate(CsvSeriesReader.readTemplate(is));
                }
                finally {
                    is.close();
                }
            }
            if (atmos != null) {
                is = new FileInputStream (atmos);
                try {
                    session.setAtmosphere
                        (CsvSeriesReader.readAtmosphere(is));
                }
                finally {
                    is.close();
                }
            }

            FitService service = new FitService ();
            service.setup(session);
            FitResult result = service.fit(session);
            System.out.println(result);

            if (out != null) {
                OutputStream os = new FileOutputStream (out);
                try {
                    new ResultWriter ().write(result, os);
                }
                finally {
                    os.close();
                }
                logger.info("Result written to \""+out+"\"");
            }
            if (plot != null) {
                for (OrderResult r : result.getOrders()) {
                    File f = result.getOrders().size() == 1 
                        ? new File (plot)
                        : new File (plot.replaceFirst
                                    ("(\\.png)?$", "_"+r.getOrder()+".png"));
                    FitChart.save(FitChart.createSpectrumChart(r),
                                  f, 1200, 700);
                    if (r.getIpKernel() != null) {
                        File ip = new File (f.getPath().replaceFirst
                                            ("(\\.png)?$", "_ip.png"));
                        FitChart.save(FitChart.createKernelChart(r),
                                      ip, 600, 400);
                    }
                }
            }
            if (!result.isConverged())
                System.exit(2);
        }
        catch (IOException ex) {
            logger.log(Level.SEVERE, "I/O error", ex);
            System.exit(1);
        }
        catch (IllegalArgumentException ex) {
            logger.log(Level.SEVERE, "Invalid input", ex);
            System.exit(1);
        }
    }
}
