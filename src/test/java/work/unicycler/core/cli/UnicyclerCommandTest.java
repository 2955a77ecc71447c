package work.unicycler.core.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.unicycler.core.support.ProtocolTestSupport.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class UnicyclerCommandTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void printsResolvedMethod() throws Exception {
        int exitCode = run("--protocol", resource("protocols/tagged-cycling.json").toString());

        assertEquals(0, exitCode);
        JsonNode method = JSON.readTree(out.toString()).path("method");
        assertEquals(8, method.size());
        assertEquals("loop", method.get(4).path("step").asText());
        assertEquals(2, method.get(4).path("loop_to").asInt());
    }

    @Test
    void printsTrace() throws Exception {
        int exitCode = run("-p", resource("protocols/nested-rests.yaml").toString(), "-f", "trace");

        assertEquals(0, exitCode);
        JsonNode root = JSON.readTree(out.toString());
        assertEquals(408, root.path("indices").size());
        assertEquals("open_circuit_voltage", root.path("steps").get(0).path("step").asText());
        assertEquals(850, root.path("stepsTaken").asInt());
    }

    @Test
    void printsLoopTree() throws Exception {
        int exitCode = run("-p", resource("protocols/nested-rests.yaml").toString(), "--format", "TREE");

        assertEquals(0, exitCode);
        JsonNode outer = JSON.readTree(out.toString()).path("tree").get(0);
        assertEquals(34, outer.path("count").asInt());
        assertEquals(12, outer.path("body").get(0).path("count").asInt());
    }

    @Test
    void printsPybammExperiment() throws Exception {
        int exitCode = run("-p", resource("protocols/tagged-cycling.json").toString(), "-f", "pybamm");

        assertEquals(0, exitCode);
        JsonNode experiment = JSON.readTree(out.toString());
        assertEquals(1 + 3 * 3 + 10 * 2, experiment.size());
        assertEquals("Rest for 600.0 seconds", experiment.get(0).asText());
    }

    @Test
    void configFileSuppliesSampleAndFormatting() throws Exception {
        int exitCode = run(
            "-p", resource("protocols/nested-rests.yaml").toString(),
            "-f", "tomato",
            "--config", resource("config/unicycler.toml").toString(),
            "--tomato-output", "/srv/tomato"
        );

        assertEquals(0, exitCode);
        String printed = out.toString().trim();
        assertFalse(printed.contains("\n"));
        JsonNode root = JSON.readTree(printed);
        assertEquals("from-config", root.path("sample").path("name").asText());
        assertEquals(3.0, root.path("sample").path("capacity_mAh").asDouble());
        assertEquals("/srv/tomato", root.path("tomato").path("output").path("path").asText());
    }

    @Test
    void commandLineOverridesConfig() throws Exception {
        int exitCode = run(
            "-p", resource("protocols/nested-rests.yaml").toString(),
            "-f", "tomato",
            "--config", resource("config/unicycler.toml").toString(),
            "--sample-name", "from-cli"
        );

        assertEquals(0, exitCode);
        assertEquals("from-cli", JSON.readTree(out.toString()).path("sample").path("name").asText());
    }

    @Test
    void protocolErrorsExitWithOne() {
        int exitCode = run("-p", resource("protocols/nested-rests.yaml").toString(), "-f", "trace", "--max-iterations", "100");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("[runaway_expansion]"));
    }

    @Test
    void unsupportedStepsExitWithOne() {
        int exitCode = run("-p", resource("protocols/with-impedance.json").toString(), "-f", "pybamm");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("does not support step type: impedance_spectroscopy"));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, run("-p", resource("protocols/nested-rests.yaml").toString(), "-f", "csv"));
        assertTrue(err.toString().contains("Unsupported output format: csv"));
        assertEquals(2, run("-p", "does/not/exist.json"));
        assertEquals(2, run());
    }

    @Test
    void outputFormatParsing() {
        assertEquals(OutputFormat.RESOLVED, OutputFormat.from(null));
        assertEquals(OutputFormat.PYBAMM, OutputFormat.from(" PyBaMM "));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.from("xml"));
    }

    @Test
    void versionMentionsTool() {
        assertTrue(new VersionProvider().getVersion()[0].startsWith("unicycler (java) "));
    }
}
