package work.unicycler.core.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.unicycler.core.api.ProtocolCodec;
import work.unicycler.core.api.ProtocolEngine;
import work.unicycler.core.config.UnicyclerConfig;
import work.unicycler.core.config.UnicyclerConfigLoader;
import work.unicycler.core.export.PybammExporter;
import work.unicycler.core.export.TomatoExporter;
import work.unicycler.core.export.TomatoOptions;
import work.unicycler.core.loops.ExecutionTrace;
import work.unicycler.core.loops.LoopNode;
import work.unicycler.core.model.Protocol;
import work.unicycler.core.model.Step;
import work.unicycler.core.resolve.ResolvedSequence;

@CommandLine.Command(
    name = "unicycler",
    description = "Resolve, unroll and export battery cycling protocols.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class UnicyclerCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(UnicyclerCommand.class);

    record ResolvedView(List<Step> method) {}

    record TreeView(List<LoopNode> tree) {}

    record TraceView(List<Integer> indices, List<Step> steps, int stepsTaken) {}

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec commandSpec;

    @CommandLine.Option(
        names = {"-p", "--protocol"},
        required = true,
        paramLabel = "PATH",
        description = "Protocol file (.json, .yaml or .yml)."
    )
    private Path protocolPath;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Output: resolved|tree|trace|pybamm|tomato.",
        defaultValue = "resolved"
    )
    private String formatRaw;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "PATH",
        description = "TOML configuration (default: ./" + UnicyclerConfigLoader.DEFAULT_FILE_NAME + " when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configPath;

    @CommandLine.Option(
        names = "--max-iterations",
        description = "Ceiling on simulated steps while unrolling loops.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxIterations;

    @CommandLine.Option(
        names = "--sample-name",
        description = "Override the sample name of the protocol.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String sampleName;

    @CommandLine.Option(
        names = "--capacity",
        paramLabel = "MAH",
        description = "Override the sample capacity in mAh.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Double capacityMah;

    @CommandLine.Option(
        names = "--tomato-output",
        description = "Output directory written into tomato jobs.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String tomatoOutput;

    @Override
    public Integer call() throws Exception {
        OutputFormat format;
        try {
            format = OutputFormat.from(formatRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(commandSpec.commandLine(), ex.getMessage());
        }
        if (!Files.isRegularFile(protocolPath)) {
            throw new CommandLine.ParameterException(commandSpec.commandLine(), "Protocol file not found: " + protocolPath.toAbsolutePath());
        }

        UnicyclerConfig config = effectiveConfig();
        Protocol protocol = ProtocolCodec.read(
            protocolPath,
            config.sampleName().orElse(null),
            config.capacityMah().orElse(null)
        );
        Object payload = render(format, protocol, config);

        ObjectWriter writer = config.prettyPrint()
            ? ProtocolCodec.jsonMapper().writerWithDefaultPrettyPrinter()
            : ProtocolCodec.jsonMapper().writer();
        try {
            commandSpec.commandLine().getOut().println(writer.writeValueAsString(payload));
        } catch (JsonProcessingException ex) {
            throw new CommandLine.ExecutionException(commandSpec.commandLine(), "Unable to serialize output: " + ex.getOriginalMessage(), ex);
        }
        commandSpec.commandLine().getOut().flush();
        return 0;
    }

    private Object render(OutputFormat format, Protocol protocol, UnicyclerConfig config) {
        return switch (format) {
            case RESOLVED -> new ResolvedView(ProtocolEngine.resolveAndCheck(protocol).steps());
            case TREE -> new TreeView(ProtocolEngine.buildLoopTree(protocol));
            case TRACE -> {
                ResolvedSequence resolved = ProtocolEngine.resolveAndCheck(protocol);
                ExecutionTrace trace = ProtocolEngine.unroll(resolved, config.maxIterations());
                yield new TraceView(trace.indices(), trace.steps(resolved), trace.stepsTaken());
            }
            case PYBAMM -> PybammExporter.export(protocol, config.maxIterations());
            case TOMATO -> TomatoExporter.toTree(protocol, new TomatoOptions(null, null, tomatoOutput));
        };
    }

    private UnicyclerConfig effectiveConfig() {
        Path path = configPath != null ? configPath : Paths.get(UnicyclerConfigLoader.DEFAULT_FILE_NAME);
        if (configPath != null && !Files.isRegularFile(configPath)) {
            throw new CommandLine.ParameterException(commandSpec.commandLine(), "Configuration file not found: " + configPath.toAbsolutePath());
        }
        UnicyclerConfig.Builder builder = UnicyclerConfigLoader.load(path).toBuilder();
        if (maxIterations != null) {
            builder.maxIterations(maxIterations);
        }
        if (sampleName != null) {
            builder.sampleName(sampleName);
        }
        if (capacityMah != null) {
            builder.capacityMah(capacityMah);
        }
        UnicyclerConfig config = builder.build();
        log.debug("Effective configuration: {}", config);
        return config;
    }
}
