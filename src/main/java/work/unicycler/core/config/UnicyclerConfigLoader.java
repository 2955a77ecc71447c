package work.unicycler.core.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@link UnicyclerConfig} from a TOML file ({@code [unroll]}, {@code [sample]} and {@code [output]} tables).
 */
public final class UnicyclerConfigLoader {
    public static final String DEFAULT_FILE_NAME = "unicycler.toml";

    private static final Logger log = LoggerFactory.getLogger(UnicyclerConfigLoader.class);

    private UnicyclerConfigLoader() {}

    public static UnicyclerConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.debug("No configuration at {}, using defaults", path);
            return UnicyclerConfig.defaults();
        }
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration: " + path, ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid configuration " + path + ": " + errors);
        }
        try {
            return fromToml(result);
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid configuration " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static UnicyclerConfig fromToml(TomlParseResult result) {
        var builder = UnicyclerConfig.builder();
        TomlTable unroll = result.getTable("unroll");
        if (unroll != null) {
            Long maxIterations = unroll.getLong("max_iterations");
            if (maxIterations != null) {
                builder.maxIterations(Math.toIntExact(maxIterations));
            }
        }
        TomlTable sample = result.getTable("sample");
        if (sample != null) {
            builder.sampleName(sample.getString("name"));
            if (sample.contains("capacity_mAh")) {
                builder.capacityMah(number(sample, "capacity_mAh"));
            }
        }
        TomlTable output = result.getTable("output");
        if (output != null) {
            Boolean pretty = output.getBoolean("pretty");
            if (pretty != null) {
                builder.prettyPrint(pretty);
            }
        }
        return builder.build();
    }

    private static Double number(TomlTable table, String key) {
        if (table.isLong(key)) {
            return table.getLong(key).doubleValue();
        }
        return table.getDouble(key);
    }
}
