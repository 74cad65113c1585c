package tripod.rv.core;

/**
 * Canonical parameter names of the forward model. Per-order parameters
 * (normalization, wavelength solution, IP, background) are qualified by
 * the order's group tag; RV, molecule coefficients and the telluric shift
 * are shared across orders and carry no group.
 */
public class ParameterNames {
    public static final String RV = "rv";
    public static final String TELLSHIFT = "tellshift";
    public static final String ATM_PREFIX = "atm_";
    static final char SEPARATOR = ':';

    private final String group;

    public ParameterNames () {
        this (null);
    }

    public ParameterNames (String group) {
        this.group = group;
    }

    public static String groupOf (int order) { return "o"+order; }

    public static String qualify (String group, String name) {
        return group == null ? name : group+SEPARATOR+name;
    }

    public String getGroup () { return group; }

    public String rv () { return RV; }
    public String tellShift () { return TELLSHIFT; }
    public String atm (String molecule) { return ATM_PREFIX+molecule; }

    public String norm (int i) { return qualify (group, "norm"+i); }
    public String wave (int i) { return qualify (group, "wave"+i); }
    public String ip (int i) { return qualify (group, "ip"+i); }
    public String bkg () { return qualify (group, "bkg"); }
}
