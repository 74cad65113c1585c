package tripod.rv.core;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Setup and fit options. Velocities are in km/s except the grid step,
 * which is in m/s like the rest of the resampling code.
 */
public class FitConfig {
    private static final Logger logger = 
        Logger.getLogger(FitConfig.class.getName());

    public enum Telluric {
        OFF, ADD
    }

    public enum Weighting {
        NONE, // unweighted residuals
        ERROR // residuals divided by the flux error
    }

    private List<Integer> orders; // null = every order available
    private Telluric telluric = Telluric.ADD;
    private List<String> molecules; // null = all
    private boolean tellShift;
    private int degNorm = 3;
    private int degWave = 3;
    private ProfileShape ipShape = ProfileShape.GAUSSIAN;
    private int ipHalfSize = 50;
    private double rvGuess = 1.;
    private Double berv; // override
    private double kapsigLow = 0.;
    private double kapsigHigh = 3.;
    private Weighting weighting = Weighting.NONE;
    private int maxClipIterations = 5;
    private double preclip = 6.;
    private double vcut = 100.;
    private double gridStepMs = 200.;
    private boolean prefit = true;
    private boolean absoluteSigma;
    private int maxIterations = 1000;
    private int maxEvaluations = 10000;

    public FitConfig () {
    }

    public FitConfig copy () {
        FitConfig c = new FitConfig ();
        c.orders = orders != null ? new ArrayList<Integer>(orders) : null;
        c.telluric = telluric;
        c.molecules = molecules != null 
            ? new ArrayList<String>(molecules) : null;
        c.tellShift = tellShift;
        c.degNorm = degNorm;
        c.degWave = degWave;
        c.ipShape = ipShape;
        c.ipHalfSize = ipHalfSize;
        c.rvGuess = rvGuess;
        c.berv = berv;
        c.kapsigLow = kapsigLow;
        c.kapsigHigh = kapsigHigh;
        c.weighting = weighting;
        c.maxClipIterations = maxClipIterations;
        c.preclip = preclip;
        c.vcut = vcut;
        c.gridStepMs = gridStepMs;
        c.prefit = prefit;
        c.absoluteSigma = absoluteSigma;
        c.maxIterations = maxIterations;
        c.maxEvaluations = maxEvaluations;
        return c;
    }

    public FitConfig setOrders (List<Integer> orders) {
        this.orders = orders;
        return this;
    }
    public List<Integer> getOrders () { 
        return orders != null ? Collections.unmodifiableList(orders) : null;
    }

    public FitConfig setTelluric (Telluric telluric) {
        this.telluric = telluric;
        return this;
    }
    public Telluric getTelluric () { return telluric; }

    public FitConfig setMolecules (List<String> molecules) {
        this.molecules = molecules;
        return this;
    }
    public List<String> getMolecules () { return molecules; }

    public FitConfig setTellShift (boolean tellShift) {
        this.tellShift = tellShift;
        return this;
    }
    public boolean getTellShift () { return tellShift; }

    public FitConfig setDegNorm (int degNorm) {
        this.degNorm = degNorm;
        return this;
    }
    public int getDegNorm () { return degNorm; }

    public FitConfig setDegWave (int degWave) {
        this.degWave = degWave;
        return this;
    }
    public int getDegWave () { return degWave; }

    public FitConfig setIpShape (ProfileShape ipShape) {
        if (!ipShape.isConfigurable()) {
            throw new UnknownShapeException (ipShape.getTag());
        }
        this.ipShape = ipShape;
        return this;
    }
    public FitConfig setIpShape (String tag) {
        this.ipShape = ProfileShape.forConfig(tag);
        return this;
    }
    public ProfileShape getIpShape () { return ipShape; }

    public FitConfig setIpHalfSize (int ipHalfSize) {
        this.ipHalfSize = ipHalfSize;
        return this;
    }
    public int getIpHalfSize () { return ipHalfSize; }

    public FitConfig setRvGuess (double rvGuess) {
        this.rvGuess = rvGuess;
        return this;
    }
    public double getRvGuess () { return rvGuess; }

    public FitConfig setBerv (Double berv) {
        this.berv = berv;
        return this;
    }
    public Double getBerv () { return berv; }

    public FitConfig setKapsig (double low, double high) {
        this.kapsigLow = low;
        this.kapsigHigh = high;
        return this;
    }
    public double getKapsigLow () { return kapsigLow; }
    public double getKapsigHigh () { return kapsigHigh; }

    public FitConfig setWeighting (Weighting weighting) {
        this.weighting = weighting;
        return this;
    }
    public Weighting getWeighting () { return weighting; }

    public FitConfig setMaxClipIterations (int maxClipIterations) {
        this.maxClipIterations = maxClipIterations;
        return this;
    }
    public int getMaxClipIterations () { return maxClipIterations; }

    public FitConfig setPreclip (double preclip) {
        this.preclip = preclip;
        return this;
    }
    public double getPreclip () { return preclip; }

    public FitConfig setVcut (double vcut) {
        this.vcut = vcut;
        return this;
    }
    public double getVcut () { return vcut; }

    public FitConfig setGridStepMs (double gridStepMs) {
        this.gridStepMs = gridStepMs;
        return this;
    }
    public double getGridStepMs () { return gridStepMs; }

    public FitConfig setPrefit (boolean prefit) {
        this.prefit = prefit;
        return this;
    }
    public boolean getPrefit () { return prefit; }

    public FitConfig setAbsoluteSigma (boolean absoluteSigma) {
        this.absoluteSigma = absoluteSigma;
        return this;
    }
    public boolean getAbsoluteSigma () { return absoluteSigma; }

    public FitConfig setMaxIterations (int maxIterations) {
        this.maxIterations = maxIterations;
        return this;
    }
    public int getMaxIterations () { return maxIterations; }

    public FitConfig setMaxEvaluations (int maxEvaluations) {
        this.maxEvaluations = maxEvaluations;
        return this;
    }
    public int getMaxEvaluations () { return maxEvaluations; }

    /**
     * reject option combinations that cannot produce a fit
     */
    public FitConfig validate () {
        if (degNorm < 0 || degWave < 0) {
            throw new IllegalArgumentException
                ("Polynomial degrees must be non-negative; got norm="
                 +degNorm+", wave="+degWave);
        }
        if (ipHalfSize < 1) {
            throw new IllegalArgumentException
                ("IP half size must be positive; got "+ipHalfSize);
        }
        if (!(gridStepMs > 0.)) {
            throw new IllegalArgumentException
                ("Grid step must be positive; got "+gridStepMs);
        }
        if (!(kapsigLow >= 0.) || !(kapsigHigh >= 0.)) {
            throw new IllegalArgumentException
                ("Clip thresholds must be non-negative; got ("
                 +kapsigLow+", "+kapsigHigh+")");
        }
        if (maxClipIterations < 0) {
            throw new IllegalArgumentException
                ("Clip iteration cap must be non-negative; got "
                 +maxClipIterations);
        }
        if (!(preclip >= 0.) || !(vcut >= 0.)) {
            throw new IllegalArgumentException
                ("preclip and vcut must be non-negative");
        }
        if (!ipShape.isConfigurable()) {
            throw new UnknownShapeException (ipShape.getTag());
        }
        if (Double.isNaN(rvGuess) || Double.isInfinite(rvGuess)) {
            throw new IllegalArgumentException ("Invalid RV guess: "+rvGuess);
        }
        return this;
    }

    public static FitConfig load (InputStream is) throws IOException {
        Properties props = new Properties ();
        props.load(is);
        return fromProperties (props);
    }

    public static FitConfig fromProperties (Properties props) {
        FitConfig c = new FitConfig ();
        for (String key : props.stringPropertyNames()) {
            String value = props.getProperty(key).trim();
            if ("orders".equals(key) || "order".equals(key)) {
                List<Integer> orders = new ArrayList<Integer>();
                for (String tok : value.split(","))
                    if (tok.trim().length() > 0)
                        orders.add(Integer.parseInt(tok.trim()));
                c.setOrders(orders.isEmpty() ? null : orders);
            }
            else if ("telluric".equals(key))
                c.setTelluric(Telluric.valueOf(value.toUpperCase()));
            else if ("molecules".equals(key)) {
                List<String> mols = new ArrayList<String>();
                for (String tok : value.split(","))
                    if (tok.trim().length() > 0)
                        mols.add(tok.trim());
                c.setMolecules(mols.isEmpty() ? null : mols);
            }
            else if ("tellshift".equals(key))
                c.setTellShift(Boolean.parseBoolean(value));
            else if ("deg.norm".equals(key))
                c.setDegNorm(Integer.parseInt(value));
            else if ("deg.wave".equals(key))
                c.setDegWave(Integer.parseInt(value));
            else if ("ip".equals(key))
                c.setIpShape(value);
            else if ("ip.hs".equals(key))
                c.setIpHalfSize(Integer.parseInt(value));
            else if ("rv.guess".equals(key))
                c.setRvGuess(Double.parseDouble(value));
            else if ("berv".equals(key))
                c.setBerv(value.length() > 0 
                          ? Double.valueOf(value) : null);
            else if ("kapsig.low".equals(key))
                c.kapsigLow = Double.parseDouble(value);
            else if ("kapsig.high".equals(key))
                c.kapsigHigh = Double.parseDouble(value);
            else if ("wgt".equals(key))
                c.setWeighting(value.length() == 0 
                               ? Weighting.NONE
                               : Weighting.valueOf(value.toUpperCase()));
            else if ("clip.maxiter".equals(key))
                c.setMaxClipIterations(Integer.parseInt(value));
            else if ("preclip".equals(key))
                c.setPreclip(Double.parseDouble(value));
            else if ("vcut".equals(key))
                c.setVcut(Double.parseDouble(value));
            else if ("grid.dv".equals(key))
                c.setGridStepMs(Double.parseDouble(value));
            else if ("prefit".equals(key))
                c.setPrefit(Boolean.parseBoolean(value));
            else if ("sigma.absolute".equals(key))
                c.setAbsoluteSigma(Boolean.parseBoolean(value));
            else if ("lm.maxiter".equals(key))
                c.setMaxIterations(Integer.parseInt(value));
            else if ("lm.maxeval".equals(key))
                c.setMaxEvaluations(Integer.parseInt(value));
            else 
                logger.warning("Unknown configuration key \""+key+"\"");
        }
        return c.validate();
    }

    public String toString () {
        return "FitConfig{orders="+orders+",telluric="+telluric
            +",molecules="+molecules+",tellshift="+tellShift
            +",deg.norm="+degNorm+",deg.wave="+degWave
            +",ip="+ipShape.getTag()+",ip.hs="+ipHalfSize
            +",rv.guess="+rvGuess+",berv="+berv
            +",kapsig=("+kapsigLow+","+kapsigHigh+"),wgt="+weighting
            +",clip.maxiter="+maxClipIterations+",preclip="+preclip
            +",vcut="+vcut+",grid.dv="+gridStepMs+",prefit="+prefit+"}";
    }
}
