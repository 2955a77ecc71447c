package work.unicycler.core.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.unicycler.core.support.ProtocolTestSupport.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import work.unicycler.core.api.ProtocolCodec;
import work.unicycler.core.error.ExportException;
import work.unicycler.core.error.MissingCapacityException;
import work.unicycler.core.error.UnsupportedStepException;
import work.unicycler.core.model.ConstantCurrent;
import work.unicycler.core.model.Protocol;

class TomatoExporterTest {
    @Test
    void rendersResolvedMethod() {
        Protocol protocol = ProtocolCodec.read(resource("protocols/tagged-cycling.json"));

        JsonNode root = TomatoExporter.toTree(protocol, TomatoOptions.defaults());

        assertEquals("cell-01", root.path("sample").path("name").asText());
        JsonNode method = root.path("method");
        assertEquals(8, method.size());

        JsonNode rest = method.get(0);
        assertEquals("MPG2", rest.path("device").asText());
        assertEquals("open_circuit_voltage", rest.path("technique").asText());
        assertEquals(600.0, rest.path("time").asDouble());
        assertEquals(10.0, rest.path("measure_every_dt").asDouble());
        assertEquals(0.01, rest.path("measure_every_dE").asDouble());

        JsonNode charge = method.get(1);
        assertEquals("0.1C", charge.path("current").asText());
        assertEquals(4.2, charge.path("limit_voltage_max").asDouble());
        assertFalse(charge.has("time"));

        JsonNode hold = method.get(2);
        assertEquals(4.2, hold.path("voltage").asDouble());
        assertEquals("0.05C", hold.path("limit_current_min").asText());

        JsonNode discharge = method.get(3);
        assertEquals("0.1D", discharge.path("current").asText());
        assertEquals(3.0, discharge.path("limit_voltage_min").asDouble());

        JsonNode formationLoop = method.get(4);
        assertEquals("loop", formationLoop.path("technique").asText());
        assertEquals(1, formationLoop.path("goto").asInt());
        assertEquals(2, formationLoop.path("n_gotos").asInt());

        JsonNode cyclingLoop = method.get(7);
        assertEquals(5, cyclingLoop.path("goto").asInt());
        assertEquals(9, cyclingLoop.path("n_gotos").asInt());

        JsonNode output = root.path("tomato").path("output");
        assertEquals(TomatoOptions.DEFAULT_OUTPUT_PATH, output.path("path").asText());
        assertEquals("cell-01", output.path("prefix").asText());
    }

    @Test
    void exportsParseableJsonWithOverrides() throws Exception {
        Protocol protocol = ProtocolCodec.read(resource("protocols/tagged-cycling.json"));

        String json = TomatoExporter.export(protocol, new TomatoOptions("renamed", 5.0, "/data/tomato"));

        JsonNode root = new ObjectMapper().readTree(json);
        assertEquals("renamed", root.path("sample").path("name").asText());
        assertEquals(5.0, root.path("sample").path("capacity_mAh").asDouble());
        assertEquals("/data/tomato", root.path("tomato").path("output").path("path").asText());
        assertTrue(root.path("tomato").path("unlock_when_done").asBoolean());
    }

    @Test
    void currentIsWrittenInAmps() {
        Protocol protocol = Protocol.builder()
            .sample("cell", null)
            .recordEvery(1)
            .step(ConstantCurrent.atCurrent(-250.0, 60.0, null))
            .build();

        JsonNode step = TomatoExporter.toTree(protocol, TomatoOptions.defaults()).path("method").get(0);

        assertEquals(-0.25, step.path("current").asDouble());
        assertEquals(60.0, step.path("time").asDouble());
    }

    @Test
    void placeholderNameNeedsOverride() {
        Protocol protocol = ProtocolCodec.read(resource("protocols/nested-rests.yaml")).withSampleName("$NAME");

        var ex = assertThrows(ExportException.class, () -> TomatoExporter.export(protocol));
        assertEquals("missing_sample_name", ex.code());
        assertEquals(3, TomatoExporter.toTree(protocol, new TomatoOptions("named", null, null)).path("method").size());
    }

    @Test
    void cRatesNeedCapacity() {
        Protocol protocol = Protocol.builder()
            .sample("cell", null)
            .recordEvery(1)
            .step(ConstantCurrent.atRate(1.0, null, 4.2))
            .build();

        assertThrows(MissingCapacityException.class, () -> TomatoExporter.export(protocol));
    }

    @Test
    void impedanceIsUnsupported() {
        Protocol protocol = ProtocolCodec.read(resource("protocols/with-impedance.json"));

        var ex = assertThrows(UnsupportedStepException.class, () -> TomatoExporter.export(protocol));
        assertEquals("unsupported_step", ex.code());
    }
}
