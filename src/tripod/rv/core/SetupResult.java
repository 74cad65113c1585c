package tripod.rv.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Initial model of a {@link FitProblem}, evaluated before any fitting.
 */
public class SetupResult {
    final Map<String, ParameterSet.Estimate> params;
    final List<OrderResult> orders;

    SetupResult (Map<String, ParameterSet.Estimate> params, 
                 List<OrderResult> orders) {
        this.params = Collections.unmodifiableMap(params);
        this.orders = Collections.unmodifiableList(orders);
    }

    public static SetupResult of (FitProblem problem) {
        List<OrderResult> orders = new ArrayList<OrderResult>();
        for (ModelSetup s : problem.getOrders())
            orders.add(OrderResult.setup(s, problem.getParameters()));
        return new SetupResult 
            (problem.getParameters().snapshot(), orders);
    }

    public Map<String, ParameterSet.Estimate> getParameters () {
        return params;
    }
    public List<OrderResult> getOrders () { return orders; }

    public String toString () {
        return "SetupResult{params="+params.size()+",orders="+orders+"}";
    }
}
