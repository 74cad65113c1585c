package tripod.rv.validation;

import java.awt.Color;
import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.CombinedDomainXYPlot;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYItemRenderer;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.xy.DefaultXYDataset;
import org.jfree.data.xy.XYDataset;

import tripod.rv.core.OrderResult;
import tripod.rv.core.PixelFlag;

/**
 * Charts for visual validation of a setup or fit: observed spectrum and
 * model over the wavelength with a residual panel, and the IP kernel.
 */
public class FitChart {
    private static final Logger logger =
        Logger.getLogger(FitChart.class.getName());

    static final String OBSERVED = "observed";
    static final String REJECTED = "rejected";
    static final String MODEL = "model";
    static final String RESIDUALS = "residuals";

    private FitChart () {}

    /**
     * good pixels and model, plus the rejected pixels
     */
    public static XYDataset spectrumDataset (OrderResult r) {
        DefaultXYDataset dataset = new DefaultXYDataset ();
        double[] wave = r.getWaveOk();
        dataset.addSeries(OBSERVED, new double[][]{wave, r.getFluxOk()});

        double[] all = r.getWave(), flux = r.getFlux();
        int[] flag = r.getFlag();
        int n = 0;
        for (int f : flag)
            if (!PixelFlag.isGood(f))
                ++n;
        double[][] rejected = new double[2][n];
        for (int i = 0, k = 0; i < flag.length; ++i) {
            if (!PixelFlag.isGood(flag[i])) {
                rejected[0][k] = all[i];
                rejected[1][k] = flux[i];
                ++k;
            }
        }
        dataset.addSeries(REJECTED, rejected);
        dataset.addSeries(MODEL, new double[][]{wave, r.getModel()});
        return dataset;
    }

    public static XYDataset residualDataset (OrderResult r) {
        DefaultXYDataset dataset = new DefaultXYDataset ();
        dataset.addSeries(RESIDUALS, new double[][]{
                r.getWaveOk(), r.getResiduals()
            });
        return dataset;
    }

    public static XYDataset kernelDataset (OrderResult r) {
        DefaultXYDataset dataset = new DefaultXYDataset ();
        double[] k = r.getIpKernel();
        if (k != null) {
            dataset.addSeries("IP", new double[][]{
                    r.getIpVelocity(), k
                });
        }
        return dataset;
    }

    public static JFreeChart createSpectrumChart (OrderResult r) {
        XYPlot spectrum = new XYPlot 
            (spectrumDataset (r), null, new NumberAxis ("Flux"), null);
        XYLineAndShapeRenderer renderer = 
            new XYLineAndShapeRenderer (false, true);
        renderer.setSeriesPaint(0, Color.black);
        renderer.setSeriesPaint(1, Color.lightGray);
        // model is a line
        renderer.setSeriesLinesVisible(2, true);
        renderer.setSeriesShapesVisible(2, false);
        renderer.setSeriesPaint(2, Color.red);
        spectrum.setRenderer(renderer);
        spectrum.setDomainGridlinesVisible(false);
        spectrum.setRangeGridlinesVisible(false);

        XYPlot residuals = new XYPlot
            (residualDataset (r), null, new NumberAxis ("O - C"), null);
        XYItemRenderer res = new XYLineAndShapeRenderer (false, true);
        res.setSeriesPaint(0, Color.black);
        residuals.setRenderer(res);
        residuals.setDomainGridlinesVisible(false);

        NumberAxis wave = new NumberAxis ("Wavelength [A]");
        wave.setAutoRangeIncludesZero(false);
        CombinedDomainXYPlot plot = new CombinedDomainXYPlot (wave);
        plot.setGap(8.);
        plot.add(spectrum, 3);
        plot.add(residuals, 1);
        plot.setOrientation(PlotOrientation.VERTICAL);

        JFreeChart chart = new JFreeChart
            (title (r), JFreeChart.DEFAULT_TITLE_FONT, plot, true);
        chart.setBackgroundPaint(Color.white);
        return chart;
    }

    public static JFreeChart createKernelChart (OrderResult r) {
        NumberAxis v = new NumberAxis ("Velocity [km/s]");
        XYPlot plot = new XYPlot 
            (kernelDataset (r), v, new NumberAxis ("IP"),
             new XYLineAndShapeRenderer (true, false));
        plot.setDomainGridlinesVisible(false);
        plot.setRangeGridlinesVisible(false);
        JFreeChart chart = new JFreeChart
            ("IP, order "+r.getOrder(), JFreeChart.DEFAULT_TITLE_FONT,
             plot, false);
        chart.setBackgroundPaint(Color.white);
        return chart;
    }

    static String title (OrderResult r) {
        StringBuilder sb = new StringBuilder ("Order "+r.getOrder());
        if (r.getPrms() != null)
            sb.append(String.format(", prms=%1$.3f%%", r.getPrms()));
        return sb.toString();
    }

    public static void save (JFreeChart chart, File file, 
                             int width, int height) throws IOException {
        ChartUtils.saveChartAsPNG(file, chart, width, height);
        logger.info("Chart saved to \""+file+"\"");
    }
}
