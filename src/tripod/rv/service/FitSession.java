package tripod.rv.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import tripod.rv.core.Atmosphere;
import tripod.rv.core.FitConfig;
import tripod.rv.core.FitProblem;
import tripod.rv.core.FitResult;
import tripod.rv.core.OrderContext;
import tripod.rv.core.Series;
import tripod.rv.core.SetupResult;

/**
 * State of one setup/fit sequence, owned by the caller. A session is
 * not shared between threads.
 */
public class FitSession {
    private final FitConfig config;
    private final List<OrderContext> orders = new ArrayList<OrderContext>();
    private Series template;
    private Atmosphere atmosphere;

    private FitProblem problem;
    private SetupResult setup;
    private FitResult result;

    public FitSession (FitConfig config) {
        this.config = config;
    }

    public FitConfig getConfig () { return config; }

    public FitSession addOrder (OrderContext ctx) {
        orders.add(ctx);
        reset ();
        return this;
    }
    public FitSession addOrders (List<OrderContext> ctxs) {
        orders.addAll(ctxs);
        reset ();
        return this;
    }
    public List<OrderContext> getOrders () { 
        return Collections.unmodifiableList(orders); 
    }

    public FitSession setTemplate (Series template) {
        this.template = template;
        reset ();
        return this;
    }
    public Series getTemplate () { return template; }

    public FitSession setAtmosphere (Atmosphere atmosphere) {
        this.atmosphere = atmosphere;
        reset ();
        return this;
    }
    public Atmosphere getAtmosphere () { return atmosphere; }

    public boolean isSetup () { return problem != null; }
    public FitProblem getProblem () { return problem; }
    public SetupResult getSetup () { return setup; }
    public FitResult getResult () { return result; }

    void setup (FitProblem problem, SetupResult setup) {
        this.problem = problem;
        this.setup = setup;
        this.result = null;
    }

    void setResult (FitResult result) {
        this.result = result;
    }

    /**
     * drop the setup and fit state; inputs are kept
     */
    public void reset () {
        problem = null;
        setup = null;
        result = null;
    }
}
