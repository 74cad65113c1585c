package tripod.rv.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One or more set-up orders sharing a single parameter set. Per-order
 * parameters carry the order's group; rv, the molecule coefficients and
 * the telluric shift are declared once and read by every order's model.
 */
public class FitProblem {
    private final List<ModelSetup> orders;
    private final ParameterSet params;
    private final FitConfig config;

    FitProblem (List<ModelSetup> orders, ParameterSet params,
                FitConfig config) {
        if (orders.isEmpty()) {
            throw new IllegalArgumentException ("No orders to fit");
        }
        this.orders = Collections.unmodifiableList(orders);
        this.params = params;
        this.config = config;
    }

    public static FitProblem single (OrderContext ctx, Series template,
                                     Atmosphere atmosphere, FitConfig config) {
        ModelSetup setup = ModelSetup.create(ctx, template, atmosphere, config);
        List<ModelSetup> orders = new ArrayList<ModelSetup>();
        orders.add(setup);
        return new FitProblem (orders, setup.getParameters(), config);
    }

    /**
     * Joint problem over several orders. Shared parameters take their
     * initial values from the first order declaring them; a molecule
     * fitted in any order is fitted jointly.
     */
    public static FitProblem joint (List<OrderContext> contexts,
                                    Series template, Atmosphere atmosphere,
                                    FitConfig config) {
        List<ModelSetup> orders = new ArrayList<ModelSetup>();
        ParameterSet params = new ParameterSet ();
        for (OrderContext ctx : contexts) {
            if (ctx == null)
                continue;
            for (ModelSetup s : orders) {
                if (s.getContext().getOrder() == ctx.getOrder()) {
                    throw new IllegalArgumentException
                        ("Order "+ctx.getOrder()+" given twice");
                }
            }
            ModelSetup setup = ModelSetup.create
                (ctx, template, atmosphere, config);
            orders.add(setup);
            params.merge(unfixShared (params, setup.getParameters()));
        }
        return new FitProblem (orders, params, config);
    }

    /*
     * A shared coefficient that is flat (hence fixed) in the first order
     * must stay free when another order constrains it.
     */
    static ParameterSet unfixShared (ParameterSet merged, ParameterSet next) {
        List<String> replace = new ArrayList<String>();
        for (Parameter p : next.parameters()) {
            if (p.getGroup() == null && !p.isFixed()
                && merged.contains(p.getName())
                && merged.get(p.getName()).isFixed()
                && p.getName().startsWith(ParameterNames.ATM_PREFIX))
                replace.add(p.getName());
        }
        for (String name : replace)
            merged.replace(next.get(name).copy());
        return next;
    }

    /**
     * the same orders with an independent copy of the parameters
     */
    public FitProblem copy () {
        return new FitProblem (orders, params.copy(), config);
    }

    public int size () { return orders.size(); }
    public boolean isJoint () { return orders.size() > 1; }
    public List<ModelSetup> getOrders () { return orders; }
    public ModelSetup getOrder (int i) { return orders.get(i); }
    public ParameterSet getParameters () { return params; }
    public FitConfig getConfig () { return config; }
}
