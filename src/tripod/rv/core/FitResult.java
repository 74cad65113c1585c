package tripod.rv.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a fit over one or more orders. RV and its error are in
 * km/s; both are null when the fit failed.
 */
public class FitResult {
    final FitStatus status;
    final String reason;
    final Double rv;
    final Double rvError;
    final Double prms;
    final Double reducedChi2;
    final Map<String, ParameterSet.Estimate> params;
    final List<OrderResult> orders;
    final List<Integer> history;
    final int evaluations;

    FitResult (FitStatus status, String reason, Double rv, Double rvError,
               Double prms, Double reducedChi2,
               Map<String, ParameterSet.Estimate> params,
               List<OrderResult> orders, List<Integer> history,
               int evaluations) {
        this.status = status;
        this.reason = reason;
        this.rv = rv;
        this.rvError = rvError;
        this.prms = prms;
        this.reducedChi2 = reducedChi2;
        this.params = Collections.unmodifiableMap(params);
        this.orders = Collections.unmodifiableList
            (new ArrayList<OrderResult>(orders));
        this.history = Collections.unmodifiableList
            (new ArrayList<Integer>(history));
        this.evaluations = evaluations;
    }

    public boolean isConverged () { return status == FitStatus.CONVERGED; }
    public FitStatus getStatus () { return status; }
    public String getReason () { return reason; }
    public Double getRv () { return rv; }
    public Double getRvError () { return rvError; }

    /**
     * percent RMS over the good pixels of all orders
     */
    public Double getPrms () { return prms; }
    public Double getReducedChi2 () { return reducedChi2; }
    public Map<String, ParameterSet.Estimate> getParameters () { 
        return params; 
    }
    public ParameterSet.Estimate getParameter (String name) {
        ParameterSet.Estimate e = params.get(name);
        if (e == null) {
            throw new ParameterNotFoundException (name);
        }
        return e;
    }
    public List<OrderResult> getOrders () { return orders; }
    public OrderResult getOrder (int order) {
        for (OrderResult r : orders)
            if (r.getOrder() == order)
                return r;
        return null;
    }

    /**
     * total good-pixel count before each fit pass
     */
    public List<Integer> getHistory () { return history; }

    /**
     * number of fit passes run
     */
    public int getIterations () { return history.size(); }
    public int getEvaluations () { return evaluations; }

    public String toString () {
        StringBuilder sb = new StringBuilder ("FitResult{\n");
        sb.append(" status: "+status+(reason != null ? " ("+reason+")" : "")
                  +"\n");
        sb.append(" rv: "+rv+" +/- "+rvError+" km/s\n");
        sb.append(" prms: "+prms+"\n");
        sb.append(" passes: "+history+"\n");
        for (OrderResult r : orders)
            sb.append(" "+r+"\n");
        sb.append("}");
        return sb.toString();
    }
}
