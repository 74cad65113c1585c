package tripod.rv.core;

/**
 * A named, boundable, fixable scalar model parameter.
 */
public class Parameter {
    private final String name;
    private double value;
    private final Double lower; // null = unbounded
    private final Double upper; // null = unbounded
    private final boolean fixed;
    private final String group; // display/namespacing only
    private Double stderr;

    public Parameter (String name, double value) {
        this (name, value, null, null, false, null);
    }

    public Parameter (String name, double value, Double lower, Double upper,
                      boolean fixed, String group) {
        if (name == null || name.length() == 0) {
            throw new IllegalArgumentException ("Parameter name is empty");
        }
        if (lower != null && upper != null && lower > upper) {
            throw new IllegalArgumentException
                (name+": lower bound "+lower+" > upper bound "+upper);
        }
        this.name = name;
        this.lower = lower;
        this.upper = upper;
        this.fixed = fixed;
        this.group = group;
        setValue (value);
    }

    public String getName () { return name; }
    public double getValue () { return value; }
    public Double getLower () { return lower; }
    public Double getUpper () { return upper; }
    public boolean isFixed () { return fixed; }
    public String getGroup () { return group; }

    public Double getStderr () { return stderr; }
    public Parameter setStderr (Double stderr) {
        this.stderr = stderr;
        return this;
    }

    public double getLowerBound () {
        return lower != null ? lower : Double.NEGATIVE_INFINITY;
    }
    public double getUpperBound () {
        return upper != null ? upper : Double.POSITIVE_INFINITY;
    }

    public boolean inBounds (double v) {
        return !(lower != null && v < lower) && !(upper != null && v > upper);
    }

    /**
     * Values outside the declared bounds are rejected, never clamped.
     */
    public void setValue (double value) {
        if (!inBounds (value)) {
            throw new IllegalArgumentException
                (name+": value "+value+" outside bounds ["
                 +getLowerBound()+", "+getUpperBound()+"]");
        }
        this.value = value;
    }

    Parameter copy () {
        Parameter p = new Parameter (name, value, lower, upper, fixed, group);
        p.stderr = stderr;
        return p;
    }

    Parameter fixedCopy () {
        Parameter p = new Parameter (name, value, lower, upper, true, group);
        p.stderr = stderr;
        return p;
    }

    public String toString () {
        return "Parameter{name="+name+",value="+value
            +(stderr != null ? ",stderr="+stderr : "")
            +(fixed ? ",fixed" : "")
            +(lower != null ? ",lower="+lower : "")
            +(upper != null ? ",upper="+upper : "")
            +(group != null ? ",group="+group : "")+"}";
    }
}
