package tripod.rv.validation;

import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.CombinedDomainXYPlot;
import org.jfree.data.xy.XYDataset;
import org.junit.jupiter.api.Test;

import tripod.rv.core.FitConfig;
import tripod.rv.core.FitProblem;
import tripod.rv.core.FitResult;
import tripod.rv.core.LeastSquaresEstimator;
import tripod.rv.core.OrderContext;
import tripod.rv.core.OrderResult;
import tripod.rv.core.Synthetic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FitChartTest {

    OrderResult fitted () {
        OrderContext ref = Synthetic.flatOrder(3, 5000., 5010., 200, 1.);
        double[] flux = Synthetic.uniform(ref.getFlux(), .01, 9L);
        flux[20] = Double.NaN;
        flux[120] += .3;
        FitConfig conf = new FitConfig ()
            .setTelluric(FitConfig.Telluric.OFF)
            .setPreclip(0.);
        FitResult result = new LeastSquaresEstimator ().estimate
            (FitProblem.single(Synthetic.withFlux(ref, flux), null, null,
                               conf));
        return result.getOrder(3);
    }

    @Test
    void spectrumDataset_shouldSeparateRejectedPixels () {
        OrderResult r = fitted ();
        XYDataset ds = FitChart.spectrumDataset(r);
        assertEquals(3, ds.getSeriesCount());
        assertEquals(FitChart.OBSERVED, ds.getSeriesKey(0));
        assertEquals(198, ds.getItemCount(0));
        assertEquals(2, ds.getItemCount(1));
        assertEquals(198, ds.getItemCount(2));
        assertEquals(r.getModel()[0], ds.getYValue(2, 0), 0.);

        XYDataset res = FitChart.residualDataset(r);
        assertEquals(198, res.getItemCount(0));
        XYDataset ip = FitChart.kernelDataset(r);
        assertEquals(101, ip.getItemCount(0));
    }

    @Test
    void charts_shouldCombineSpectrumAndResiduals () {
        OrderResult r = fitted ();
        JFreeChart chart = FitChart.createSpectrumChart(r);
        assertTrue(chart.getPlot() instanceof CombinedDomainXYPlot);
        assertEquals(2, ((CombinedDomainXYPlot)chart.getPlot())
                     .getSubplots().size());
        assertTrue(chart.getTitle().getText().startsWith("Order 3, prms="));
        assertTrue(FitChart.createKernelChart(r).getTitle().getText()
                   .contains("order 3"));
    }
}
