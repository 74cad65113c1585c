package tripod.rv.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import tripod.rv.core.Atmosphere;
import tripod.rv.core.Series;

/**
 * Reads wavelength series in csv format: a stellar template or the 
 * per-molecule transmission of an atmosphere model.
 *
 * <pre>
 * lambda,H2O,CO2,CH4
 * 20000.00,0.998,1.0,0.9995
 * ...
 * </pre>
 *
 * Each column after the first becomes one {@link Series} named by its
 * header.
 */
public class CsvSeriesReader {
    private static final Logger logger =
        Logger.getLogger(CsvSeriesReader.class.getName());

    private final Map<String, Series> series = 
        new LinkedHashMap<String, Series>();

    public CsvSeriesReader (InputStream is) throws IOException {
        BufferedReader reader = new BufferedReader
            (new InputStreamReader (is, StandardCharsets.UTF_8));
        String[] header = null;
        List<double[]> rows = new ArrayList<double[]>();
        int lines = 0;
        for (String line; (line = reader.readLine()) != null; ) {
            ++lines;
            line = line.trim();
            if (line.length() == 0 || line.startsWith("#"))
                continue;

            String[] toks = CsvOrderReader.tokenizer(line, ',');
            if (header == null) {
                if (toks.length < 2) {
                    throw new IllegalArgumentException
                        ("Invalid header: "+line);
                }
                header = toks;
                continue;
            }
            if (toks.length != header.length) {
                logger.warning(lines+": invalid number of tokens "
                               +toks.length+"; expecting "+header.length);
                continue;
            }

            try {
                double[] row = new double[toks.length];
                for (int i = 0; i < toks.length; ++i)
                    row[i] = CsvOrderReader.number(toks[i]);
                if (Double.isNaN(row[0])) {
                    logger.warning(lines+": no wavelength; line skipped");
                }
                else {
                    rows.add(row);
                }
            }
            catch (NumberFormatException ex) {
                logger.warning(lines+": bogus number in line; skipped");
            }
        }

        if (header == null) {
            throw new IllegalArgumentException ("No header found");
        }

        int n = rows.size();
        double[] wave = new double[n];
        for (int k = 0; k < n; ++k)
            wave[k] = rows.get(k)[0];
        for (int i = 1; i < header.length; ++i) {
            double[] flux = new double[n];
            for (int k = 0; k < n; ++k)
                flux[k] = rows.get(k)[i];
            String name = header[i] != null 
                ? header[i].trim() : "col"+i;
            series.put(name, new Series (name, wave, flux));
        }
    }

    public Map<String, Series> getSeries () { return series; }

    /**
     * the first data column, e.g. the flux of a template
     */
    public Series first () {
        return series.values().iterator().next();
    }

    public Atmosphere toAtmosphere () {
        return new Atmosphere (series.values());
    }

    public static Series readTemplate (InputStream is) throws IOException {
        return new CsvSeriesReader (is).first();
    }

    public static Atmosphere readAtmosphere (InputStream is) 
        throws IOException {
        return new CsvSeriesReader (is).toAtmosphere();
    }

    public static void main (String[] argv) throws Exception {
        if (argv.length == 0) {
            System.err.println("Usage: CsvSeriesReader FILE...");
            System.exit(1);
        }
        for (String a : argv) {
            CsvSeriesReader reader = new CsvSeriesReader 
                (new FileInputStream (a));
            for (Series s : reader.getSeries().values())
                System.out.println(a+": "+s);
        }
    }
}
