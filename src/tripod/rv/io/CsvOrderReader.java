package tripod.rv.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import tripod.rv.core.OrderContext;

/**
 * Reads an extracted spectrum in csv format, one row per pixel, with
 * the rows of an order kept together:
 *
 * <pre>
 * # dateobs: 2021-03-04T05:06:07
 * # berv: -12.345
 * order,pixel,wave,flux,err,flag,blaze
 * 7,0,20150.001,1021.5,31.9,0,1.0
 * ...
 * </pre>
 *
 * The blaze column is optional. Empty, NaN or N/A values read as NaN.
 * Metadata lines (<code># key: value</code>) apply to every order.
 */
public class CsvOrderReader implements SpectrumReader {
    private static final Logger logger =
        Logger.getLogger(CsvOrderReader.class.getName());

    static final String[] COLUMNS = {
        "order", "pixel", "wave", "flux", "err", "flag"
    };
    static final String BLAZE = "blaze";

    static final int DEBUG = Integer.getInteger("reader.debug", 0);

    private int lines;
    private BufferedReader reader;
    private int[] columns = new int[COLUMNS.length];
    private int blaze = -1;
    private int width;
    private String dateObs;
    private Double berv;
    private String[] pending; // first row of the next order

    public CsvOrderReader (InputStream is) throws IOException {
        reader = new BufferedReader
            (new InputStreamReader (is, StandardCharsets.UTF_8));

        String line;
        while ((line = reader.readLine()) != null) {
            ++lines;
            line = line.trim();
            if (line.length() == 0)
                continue;
            if (line.startsWith("#")) {
                metadata (line);
                continue;
            }
            header (line);
            break;
        }
        if (line == null) {
            throw new IllegalArgumentException ("No header found");
        }
    }

    void header (String line) {
        String[] header = tokenizer (line, ',');
        Map<String, Integer> index = new HashMap<String, Integer>();
        for (int i = 0; i < header.length; ++i)
            if (header[i] != null)
                index.put(header[i].trim().toLowerCase(), i);

        for (int i = 0; i < COLUMNS.length; ++i) {
            Integer c = index.get(COLUMNS[i]);
            if (c == null) {
                throw new IllegalArgumentException
                    ("Invalid header: "+line+"; missing column \""
                     +COLUMNS[i]+"\"");
            }
            columns[i] = c;
        }
        Integer b = index.get(BLAZE);
        blaze = b != null ? b : -1;
        width = header.length;
    }

    void metadata (String line) {
        String s = line.substring(1).trim();
        int pos = s.indexOf(':');
        if (pos < 0)
            return; // plain comment

        String key = s.substring(0, pos).trim().toLowerCase();
        String value = s.substring(pos+1).trim();
        if ("dateobs".equals(key) || "date-obs".equals(key)) {
            dateObs = value;
        }
        else if ("berv".equals(key)) {
            try {
                berv = Double.valueOf(value);
            }
            catch (NumberFormatException ex) {
                logger.warning(lines+": bogus berv \""+value+"\"; ignored");
            }
        }
        else if (DEBUG > 0) {
            logger.info(lines+": unknown metadata \""+key+"\"");
        }
    }

    public String getDateObs () { return dateObs; }
    public Double getBerv () { return berv; }

    public OrderContext read () throws IOException {
        List<double[]> rows = new ArrayList<double[]>();
        Integer order = null;

        String[] toks = pending;
        pending = null;
        for (;;) {
            if (toks == null) {
                String line = reader.readLine();
                if (line == null)
                    break;
                ++lines;
                line = line.trim();
                if (line.length() == 0)
                    continue;
                if (line.startsWith("#")) {
                    metadata (line);
                    continue;
                }
                toks = tokenizer (line, ',');
                if (toks.length != width) {
                    logger.warning(lines+": invalid number of tokens "
                                   +toks.length+"; expecting "+width);
                    toks = null;
                    continue;
                }
            }

            if (toks[columns[0]] == null) {
                logger.warning(lines+": missing order; line skipped");
                toks = null;
                continue;
            }

            int o;
            double[] row;
            try {
                o = Integer.parseInt(toks[columns[0]].trim());
                row = new double[6];
                for (int i = 1; i < COLUMNS.length; ++i)
                    row[i-1] = number (toks[columns[i]]);
                row[5] = blaze >= 0 ? number (toks[blaze]) : Double.NaN;
            }
            catch (NumberFormatException ex) {
                logger.warning(lines+": bogus number in line; skipped");
                toks = null;
                continue;
            }

            if (order == null) {
                order = o;
            }
            else if (o != order) {
                pending = toks;
                break;
            }
            rows.add(row);
            toks = null;
        }

        if (order == null)
            return null;
        return toContext (order, rows);
    }

    OrderContext toContext (int order, List<double[]> rows) {
        int n = rows.size();
        double[] pixel = new double[n], wave = new double[n],
            flux = new double[n], err = new double[n], bl = new double[n];
        int[] flag = new int[n];
        for (int i = 0; i < n; ++i) {
            double[] r = rows.get(i);
            pixel[i] = r[0];
            wave[i] = r[1];
            flux[i] = r[2];
            err[i] = r[3];
            flag[i] = Double.isNaN(r[4]) ? 0 : (int)r[4];
            bl[i] = r[5];
        }

        OrderContext ctx = new OrderContext 
            (order, pixel, wave, flux, err, flag);
        if (blaze >= 0)
            ctx.setBlaze(bl);
        ctx.setDateObs(dateObs).setBerv(berv);
        if (DEBUG > 0)
            logger.info(ctx.toString());
        return ctx;
    }

    /**
     * all orders of the input
     */
    public List<OrderContext> readAll () throws IOException {
        List<OrderContext> orders = new ArrayList<OrderContext>();
        for (OrderContext ctx; (ctx = read ()) != null; )
            orders.add(ctx);
        return orders;
    }

    static double number (String tok) {
        if (tok == null)
            return Double.NaN;
        tok = tok.trim();
        if (tok.length() == 0 || "N/A".equalsIgnoreCase(tok)
            || "nan".equalsIgnoreCase(tok))
            return Double.NaN;
        return Double.parseDouble(tok);
    }

    static String[] tokenizer (String line, char delim) {
        List<String> toks = new ArrayList<String>();

        int len = line.length(), parity = 0;
        StringBuilder curtok = new StringBuilder ();
        for (int i = 0; i < len; ++i) {
            char ch = line.charAt(i);
            if (ch == '"') {
                parity ^= 1;
            }
            if (ch == delim) {
                if (parity == 0) {
                    toks.add(curtok.length() > 0 ? curtok.toString() : null);
                    curtok.setLength(0);
                }
                else {
                    curtok.append(ch);
                }
            }
            else if (ch != '"') {
                curtok.append(ch);
            }
        }

        if (curtok.length() > 0) {
            toks.add(curtok.toString());
        }
        // trailing delimiter means a trailing empty token
        else if (len > 0 && line.charAt(len-1) == delim) {
            toks.add(null);
        }
        return toks.toArray(new String[0]);
    }

    public static void main (String[] argv) throws Exception {
        CsvOrderReader reader;
        if (argv.length == 0) {
            logger.info("Reading from stdin...");
            reader = new CsvOrderReader (System.in);
        }
        else {
            logger.info("Reading from \""+argv[0]+"\"...");
            reader = new CsvOrderReader (new FileInputStream (argv[0]));
        }

        for (OrderContext ctx; (ctx = reader.read()) != null; ) {
            System.out.println(ctx);
        }
    }
}
