package tripod.rv.io;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import tripod.rv.core.FitResult;
import tripod.rv.core.OrderResult;
import tripod.rv.core.ParameterSet;
import tripod.rv.core.SetupResult;

/**
 * JSON export of setup and fit records for a presentation layer. 
 * Non-finite numbers are written as null.
 */
public class ResultWriter {
    private final ObjectMapper mapper = new ObjectMapper ()
        .enable(SerializationFeature.INDENT_OUTPUT);

    public ResultWriter () {
    }

    public ObjectNode toJson (FitResult result) {
        ObjectNode node = mapper.createObjectNode();
        node.put("converged", result.isConverged());
        node.put("status", result.getStatus().name());
        if (result.getReason() != null)
            node.put("error", result.getReason());
        else
            node.putNull("error");
        put (node, "rv", result.getRv());
        put (node, "e_rv", result.getRvError());
        put (node, "prms", result.getPrms());
        put (node, "reduced_chi2", result.getReducedChi2());
        ArrayNode passes = node.putArray("passes");
        for (Integer n : result.getHistory())
            passes.add(n);
        node.put("evaluations", result.getEvaluations());
        params (node.putObject("params"), result.getParameters());
        orders (node.putArray("orders"), result.getOrders());
        return node;
    }

    public ObjectNode toJson (SetupResult setup) {
        ObjectNode node = mapper.createObjectNode();
        params (node.putObject("params"), setup.getParameters());
        orders (node.putArray("orders"), setup.getOrders());
        return node;
    }

    public void write (FitResult result, OutputStream os) throws IOException {
        mapper.writeValue(os, toJson (result));
    }

    public void write (SetupResult setup, OutputStream os) 
        throws IOException {
        mapper.writeValue(os, toJson (setup));
    }

    public String toString (FitResult result) throws IOException {
        return mapper.writeValueAsString(toJson (result));
    }

    public String toString (SetupResult setup) throws IOException {
        return mapper.writeValueAsString(toJson (setup));
    }

    void params (ObjectNode node, Map<String, ParameterSet.Estimate> params) {
        for (Map.Entry<String, ParameterSet.Estimate> me 
                 : params.entrySet()) {
            ObjectNode p = node.putObject(me.getKey());
            put (p, "value", me.getValue().getValue());
            put (p, "unc", me.getValue().getStderr());
        }
    }

    void orders (ArrayNode array, List<OrderResult> orders) {
        for (OrderResult r : orders) {
            ObjectNode node = array.addObject();
            node.put("order", r.getOrder());
            if (r.getDateObs() != null)
                node.put("dateobs", r.getDateObs());
            else
                node.putNull("dateobs");
            put (node, "berv", r.getBerv());
            put (node, "xcen", r.getXcen());
            put (node, "prms", r.getPrms());
            put (node.putArray("pixel_ok"), r.getPixelOk());
            put (node.putArray("wave_ok"), r.getWaveOk());
            put (node.putArray("spec_ok"), r.getFluxOk());
            put (node.putArray("model_flux"), r.getModel());
            put (node.putArray("residuals"), r.getResiduals());
            put (node.putArray("pixel"), r.getPixel());
            put (node.putArray("wave"), r.getWave());
            put (node.putArray("spec"), r.getFlux());
            ArrayNode flag = node.putArray("flag");
            for (int f : r.getFlag())
                flag.add(f);
            put (node.putArray("ip_vk"), r.getIpVelocity());
            if (r.getIpKernel() != null)
                put (node.putArray("ip_shape"), r.getIpKernel());
            else
                node.putNull("ip_shape");
            if (r.getLnwave() != null)
                put (node.putArray("lnwave_j"), r.getLnwave());
            if (r.getTransmission() != null)
                put (node.putArray("spec_gas_j"), r.getTransmission());
            if (!r.getHistory().isEmpty()) {
                ArrayNode h = node.putArray("passes");
                for (Integer n : r.getHistory())
                    h.add(n);
            }
        }
    }

    static void put (ObjectNode node, String field, Double value) {
        if (value == null || value.isNaN() || value.isInfinite())
            node.putNull(field);
        else
            node.put(field, value.doubleValue());
    }

    static void put (ArrayNode array, double[] values) {
        for (double v : values) {
            if (Double.isNaN(v) || Double.isInfinite(v))
                array.addNull();
            else
                array.add(v);
        }
    }
}
