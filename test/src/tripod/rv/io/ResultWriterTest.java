package tripod.rv.io;

import java.io.ByteArrayOutputStream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import tripod.rv.core.FitConfig;
import tripod.rv.core.FitProblem;
import tripod.rv.core.FitResult;
import tripod.rv.core.LeastSquaresEstimator;
import tripod.rv.core.OrderContext;
import tripod.rv.core.Series;
import tripod.rv.core.SetupResult;
import tripod.rv.core.Synthetic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultWriterTest {

    final ResultWriter writer = new ResultWriter ();

    FitConfig config () {
        return new FitConfig ()
            .setTelluric(FitConfig.Telluric.OFF)
            .setPreclip(0.);
    }

    @Test
    void toJson_shouldWriteConvergedFit () throws Exception {
        OrderContext ctx = Synthetic.flatOrder(7, 5000., 5010., 400, 1.)
            .setDateObs("2021-03-04T05:06:07");
        double[] flux = ctx.getFlux();
        flux[3] = Double.NaN;
        ctx = Synthetic.withFlux(ctx, flux);
        FitResult result = new LeastSquaresEstimator ().estimate
            (FitProblem.single(ctx, null, null, config ()));

        ByteArrayOutputStream os = new ByteArrayOutputStream ();
        writer.write(result, os);
        JsonNode json = new ObjectMapper ().readTree(os.toByteArray());

        assertTrue(json.get("converged").asBoolean());
        assertEquals("CONVERGED", json.get("status").asText());
        assertTrue(json.get("error").isNull());
        assertEquals(1., json.get("rv").asDouble(), 0.);
        assertEquals(0., json.get("e_rv").asDouble(), 0.);
        assertTrue(json.get("params").has("o7:norm0"));
        assertTrue(json.get("params").get("rv").has("unc"));
        assertEquals(1, json.get("passes").size());

        JsonNode order = json.get("orders").get(0);
        assertEquals(7, order.get("order").asInt());
        assertEquals("2021-03-04T05:06:07", order.get("dateobs").asText());
        assertEquals(399, order.get("pixel_ok").size());
        assertEquals(399, order.get("model_flux").size());
        assertEquals(400, order.get("spec").size());
        // NaN flux of the rejected pixel
        assertTrue(order.get("spec").get(3).isNull());
        assertEquals(1, order.get("flag").get(3).asInt());
        assertEquals(101, order.get("ip_vk").size());
        assertEquals(101, order.get("ip_shape").size());
        assertFalse(order.has("lnwave_j"));
    }

    @Test
    void toJson_shouldWriteNullsForFailedFit () throws Exception {
        Series lines = Synthetic.lines("star", 4980., 5030., .005,
                                       new double[]{5003.}, .5, .1);
        double[] w = lines.getWave(), f = lines.getFlux();
        for (int i = 0; i < w.length; ++i)
            if (w[i] > 5004. && w[i] < 5006.)
                f[i] = Double.NaN;
        OrderContext ctx = Synthetic.flatOrder(7, 5000., 5010., 400, 1.);
        FitResult result = new LeastSquaresEstimator ().estimate
            (FitProblem.single(ctx, new Series ("star", w, f), null,
                               config ()));

        ObjectNode json = writer.toJson(result);
        assertFalse(json.get("converged").asBoolean());
        assertEquals("FAILED", json.get("status").asText());
        assertFalse(json.get("error").isNull());
        assertTrue(json.get("rv").isNull());
        assertTrue(json.get("e_rv").isNull());
        assertTrue(json.get("prms").isNull());
        assertTrue(json.get("params").get("rv").get("unc").isNull());
        JsonNode order = json.get("orders").get(0);
        assertTrue(order.get("prms").isNull());
        assertTrue(order.get("model_flux").get(0).isNull());
    }

    @Test
    void toJson_shouldWriteSetupArrays () throws Exception {
        OrderContext ctx = Synthetic.flatOrder(7, 5000., 5010., 400, 1.);
        SetupResult setup = SetupResult.of
            (FitProblem.single(ctx, null, null, config ()));
        ObjectNode json = writer.toJson(setup);
        JsonNode order = json.get("orders").get(0);
        assertEquals(order.get("lnwave_j").size(),
                     order.get("spec_gas_j").size());
        assertEquals(400, order.get("model_flux").size());
        assertTrue(writer.toString(setup).contains("\"lnwave_j\""));
    }
}
