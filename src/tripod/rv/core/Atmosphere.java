package tripod.rv.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Caller-supplied telluric transmission, one {@link Series} per molecule,
 * and its resampling onto a {@link LogWavelengthGrid}. Velocities handed
 * to this class are in m/s.
 */
public class Atmosphere {
    private static final Logger logger = 
        Logger.getLogger(Atmosphere.class.getName());

    public static final String ALL = "all";

    private final Map<String, Series> molecules = 
        new LinkedHashMap<String, Series>();

    public Atmosphere () {
    }

    public Atmosphere (Collection<Series> series) {
        for (Series s : series)
            add (s);
    }

    public static Atmosphere none () { return new Atmosphere (); }

    public Atmosphere add (Series molecule) {
        molecules.put(molecule.getName(), molecule);
        return this;
    }

    public boolean isEmpty () { return molecules.isEmpty(); }
    public int size () { return molecules.size(); }

    public Collection<String> getMolecules () {
        return Collections.unmodifiableCollection(molecules.keySet());
    }

    public Series getMolecule (String name) {
        Series s = molecules.get(name);
        if (s == null) {
            throw new IllegalArgumentException ("No such molecule: "+name);
        }
        return s;
    }

    /**
     * molecules requested by a selection; null, empty or containing
     * {@link #ALL} selects everything available
     */
    public List<String> select (List<String> requested) {
        List<String> sel = new ArrayList<String>();
        if (requested == null || requested.isEmpty() 
            || requested.contains(ALL)) {
            sel.addAll(molecules.keySet());
        }
        else {
            for (String m : requested) {
                if (molecules.containsKey(m))
                    sel.add(m);
                else
                    logger.warning("Molecule \""+m+"\" not available; "
                                   +"ignored");
            }
        }
        return sel;
    }

    /**
     * unity transmission of the given length, used when no telluric 
     * model is requested
     */
    public static double[] flatCell (int size) {
        double[] cell = new double[size];
        Arrays.fill(cell, 1.);
        return cell;
    }

    /**
     * transmission of a molecule interpolated onto the grid; samples
     * beyond the molecule's coverage take its end values
     */
    public double[] resample (String molecule, LogWavelengthGrid grid) {
        Series s = getMolecule (molecule);
        double[] u = s.lnWave(0.);
        double[] t = s.flux();
        double[] out = new double[grid.size()];
        for (int j = 0; j < out.length; ++j)
            out[j] = LogWavelengthGrid.interp(grid.get(j), u, t);
        return out;
    }

    /**
     * Doppler shift of a series sampled on the grid by velocityMs [m/s];
     * a positive velocity moves features to longer wavelengths.
     */
    public static double[] shift (LogWavelengthGrid grid, double[] series, 
                                  double velocityMs) {
        // shift in samples; zero velocity reproduces the series exactly
        double ds = Units.lnDopplerMs(velocityMs) / grid.getStep();
        double[] out = new double[series.length];
        for (int j = 0; j < out.length; ++j)
            out[j] = LogWavelengthGrid.interpIndex(j - ds, series);
        return out;
    }

    /**
     * population standard deviation of a resampled series; molecules 
     * below a small threshold carry no information over the grid
     */
    static double stddev (double[] x) {
        return new StandardDeviation (false).evaluate(x);
    }
}
