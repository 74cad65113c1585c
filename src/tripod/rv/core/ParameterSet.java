package tripod.rv.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered collection of parameters addressed by name. Insertion order
 * defines the order of the flat free-parameter vector handed to the
 * optimizer; fixed parameters never appear in that vector.
 */
public class ParameterSet {
    /**
     * value and standard error of a parameter at snapshot time
     */
    public static class Estimate {
        final double value;
        final Double stderr;

        Estimate (double value, Double stderr) {
            this.value = value;
            this.stderr = stderr;
        }

        public double getValue () { return value; }
        public Double getStderr () { return stderr; }

        public String toString () {
            return value+(stderr != null ? " +/- "+stderr : "");
        }
    }

    private final Map<String, Parameter> params = 
        new LinkedHashMap<String, Parameter>();

    public ParameterSet () {
    }

    public Parameter add (Parameter p) {
        if (params.containsKey(p.getName())) {
            throw new IllegalArgumentException
                ("Duplicate parameter: "+p.getName());
        }
        params.put(p.getName(), p);
        return p;
    }

    /**
     * swap in p for the same-named parameter, keeping its position
     */
    void replace (Parameter p) {
        if (!params.containsKey(p.getName())) {
            throw new ParameterNotFoundException (p.getName());
        }
        params.put(p.getName(), p);
    }

    public Parameter add (String name, double value) {
        return add (new Parameter (name, value));
    }

    public Parameter add (String name, double value, 
                          Double lower, Double upper) {
        return add (new Parameter (name, value, lower, upper, false, null));
    }

    public Parameter add (String name, double value, Double lower, 
                          Double upper, boolean fixed, String group) {
        return add (new Parameter (name, value, lower, upper, fixed, group));
    }

    public Parameter addFixed (String name, double value) {
        return addFixed (name, value, null);
    }

    public Parameter addFixed (String name, double value, String group) {
        return add (new Parameter (name, value, null, null, true, group));
    }

    public boolean contains (String name) { return params.containsKey(name); }
    public int size () { return params.size(); }

    public Parameter get (String name) {
        Parameter p = params.get(name);
        if (p == null) {
            throw new ParameterNotFoundException (name);
        }
        return p;
    }

    public Parameter get (String group, String name) {
        return get (ParameterNames.qualify(group, name));
    }

    public double value (String name) { return get(name).getValue(); }

    /**
     * all parameters carrying the given group tag (null for the shared,
     * ungrouped ones), in canonical order
     */
    public List<Parameter> group (String group) {
        List<Parameter> members = new ArrayList<Parameter>();
        for (Parameter p : params.values()) {
            if (group == null ? p.getGroup() == null 
                : group.equals(p.getGroup()))
                members.add(p);
        }
        return members;
    }

    public Collection<Parameter> parameters () {
        return Collections.unmodifiableCollection(params.values());
    }

    public int getFreeCount () {
        int n = 0;
        for (Parameter p : params.values())
            if (!p.isFixed())
                ++n;
        return n;
    }

    public List<String> freeNames () {
        List<String> names = new ArrayList<String>();
        for (Parameter p : params.values())
            if (!p.isFixed())
                names.add(p.getName());
        return names;
    }

    public double[] toFreeVector () {
        double[] v = new double[getFreeCount ()];
        int i = 0;
        for (Parameter p : params.values())
            if (!p.isFixed())
                v[i++] = p.getValue();
        return v;
    }

    /**
     * write back the free parameters in the order used by 
     * {@link #toFreeVector}; this is the only mutating operation
     */
    public void fromFreeVector (double[] v) {
        int n = getFreeCount ();
        if (v.length != n) {
            throw new ShapeMismatchException (n, v.length);
        }
        int i = 0;
        for (Parameter p : params.values())
            if (!p.isFixed())
                p.setValue(v[i++]);
    }

    public double[] lowerBounds () {
        double[] b = new double[getFreeCount ()];
        int i = 0;
        for (Parameter p : params.values())
            if (!p.isFixed())
                b[i++] = p.getLowerBound();
        return b;
    }

    public double[] upperBounds () {
        double[] b = new double[getFreeCount ()];
        int i = 0;
        for (Parameter p : params.values())
            if (!p.isFixed())
                b[i++] = p.getUpperBound();
        return b;
    }

    /**
     * assign standard errors to the free parameters (same order as the
     * free vector); fixed parameters get zero
     */
    public void setErrors (double[] stderr) {
        int n = getFreeCount ();
        if (stderr.length != n) {
            throw new ShapeMismatchException (n, stderr.length);
        }
        int i = 0;
        for (Parameter p : params.values()) {
            if (p.isFixed())
                p.setStderr(0.);
            else
                p.setStderr(stderr[i++]);
        }
    }

    public void clearErrors () {
        for (Parameter p : params.values())
            p.setStderr(null);
    }

    /**
     * copy values of the same-named parameters from other
     */
    public void assign (ParameterSet other) {
        for (Parameter p : other.params.values()) {
            Parameter q = params.get(p.getName());
            if (q != null && !q.isFixed() && q.inBounds(p.getValue()))
                q.setValue(p.getValue());
        }
    }

    /**
     * fail if any parameter sits outside its declared bounds
     */
    public void checkBounds () {
        for (Parameter p : params.values()) {
            if (!p.inBounds(p.getValue())) {
                throw new IllegalStateException
                    (p.getName()+"="+p.getValue()+" outside bounds");
            }
        }
    }

    public Map<String, Estimate> snapshot () {
        Map<String, Estimate> snap = new LinkedHashMap<String, Estimate>();
        for (Parameter p : params.values())
            snap.put(p.getName(), new Estimate (p.getValue(), p.getStderr()));
        return snap;
    }

    public ParameterSet copy () {
        ParameterSet ps = new ParameterSet ();
        for (Parameter p : params.values())
            ps.add(p.copy());
        return ps;
    }

    /**
     * copy of this set with the named parameters held fixed
     */
    public ParameterSet copyFixing (Collection<String> names) {
        ParameterSet ps = new ParameterSet ();
        for (Parameter p : params.values())
            ps.add(names.contains(p.getName()) ? p.fixedCopy() : p.copy());
        return ps;
    }

    /**
     * Merge the parameters of other into this set. Parameters of other
     * with a null group are shared: they are added once and an already
     * present one is kept as is. All others are added under their own
     * (already qualified) names.
     */
    public void merge (ParameterSet other) {
        for (Parameter p : other.params.values()) {
            if (p.getGroup() == null && params.containsKey(p.getName()))
                continue;
            add (p.copy());
        }
    }

    public String toString () {
        StringBuilder sb = new StringBuilder ("ParameterSet{");
        for (Parameter p : params.values()) {
            sb.append("\n "+p);
        }
        sb.append("\n}");
        return sb.toString();
    }
}
