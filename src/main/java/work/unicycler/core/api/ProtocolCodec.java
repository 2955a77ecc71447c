package work.unicycler.core.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import work.unicycler.core.error.ProtocolException;
import work.unicycler.core.error.StructuralException;
import work.unicycler.core.model.Protocol;
import work.unicycler.core.model.StepKind;

/**
 * Reads and writes protocols as JSON or YAML documents.
 */
public final class ProtocolCodec {
    private static final ObjectMapper JSON = configure(new ObjectMapper());
    private static final ObjectMapper YAML = configure(new ObjectMapper(new YAMLFactory()));

    private ProtocolCodec() {}

    public static ObjectMapper jsonMapper() {
        return JSON;
    }

    public static Protocol fromJson(String json) {
        return fromJson(json, null, null);
    }

    public static Protocol fromJson(String json, String sampleName, Double capacityMah) {
        return bind(parse(JSON, json), sampleName, capacityMah);
    }

    public static Protocol fromYaml(String yaml) {
        return fromYaml(yaml, null, null);
    }

    public static Protocol fromYaml(String yaml, String sampleName, Double capacityMah) {
        return bind(parse(YAML, yaml), sampleName, capacityMah);
    }

    public static Protocol read(Path path) {
        return read(path, null, null);
    }

    public static Protocol read(Path path, String sampleName, Double capacityMah) {
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read protocol: " + path, ex);
        }
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
            return fromYaml(content, sampleName, capacityMah);
        }
        return fromJson(content, sampleName, capacityMah);
    }

    public static String toJson(Protocol protocol) {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(protocol);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize protocol: " + ex.getOriginalMessage(), ex);
        }
    }

    public static String write(Protocol protocol, Path path) {
        String json = toJson(protocol);
        try {
            var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, json);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write protocol: " + path, ex);
        }
        return json;
    }

    private static JsonNode parse(ObjectMapper mapper, String content) {
        try {
            JsonNode root = mapper.readTree(content);
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("Protocol document must be an object");
            }
            return root;
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid protocol document: " + ex.getOriginalMessage(), ex);
        }
    }

    private static Protocol bind(JsonNode root, String sampleName, Double capacityMah) {
        ObjectNode document = ((ObjectNode) root).deepCopy();
        applyOverrides(document, sampleName, capacityMah);
        checkStepTypes(document.get("method"));
        try {
            return JSON.treeToValue(document, Protocol.class);
        } catch (JsonProcessingException ex) {
            ProtocolException cause = protocolCause(ex);
            if (cause != null) {
                throw cause;
            }
            throw new IllegalArgumentException("Invalid protocol document: " + ex.getOriginalMessage(), ex);
        }
    }

    private static void applyOverrides(ObjectNode document, String sampleName, Double capacityMah) {
        if ((sampleName == null || sampleName.isBlank()) && capacityMah == null) {
            return;
        }
        JsonNode existing = document.get("sample");
        ObjectNode sample = existing instanceof ObjectNode node ? node : document.putObject("sample");
        if (sampleName != null && !sampleName.isBlank()) {
            sample.put("name", sampleName);
        }
        if (capacityMah != null) {
            sample.put("capacity_mAh", capacityMah);
        }
    }

    private static void checkStepTypes(JsonNode method) {
        if (method == null || !method.isArray()) {
            return;
        }
        for (int i = 0; i < method.size(); i++) {
            JsonNode step = method.get(i);
            JsonNode type = step == null ? null : step.get("step");
            if (type == null || !type.isTextual() || type.asText().isBlank()) {
                throw new StructuralException(
                    "incomplete_step",
                    "Step at index " + i + " is incomplete, needs a 'step' type.",
                    Map.of("index", i)
                );
            }
            try {
                StepKind.fromWireName(type.asText());
            } catch (IllegalArgumentException ex) {
                throw new StructuralException(
                    "incomplete_step",
                    "Step at index " + i + ": " + ex.getMessage(),
                    Map.of("index", i, "step", type.asText())
                );
            }
        }
    }

    private static ProtocolException protocolCause(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ProtocolException protocolException) {
                return protocolException;
            }
            current = current.getCause();
        }
        return null;
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.coercionConfigFor(LogicalType.Float)
            .setCoercion(CoercionInputShape.EmptyString, CoercionAction.AsNull)
            .setAcceptBlankAsEmpty(Boolean.TRUE);
        mapper.coercionConfigFor(LogicalType.Integer)
            .setCoercion(CoercionInputShape.EmptyString, CoercionAction.AsNull)
            .setAcceptBlankAsEmpty(Boolean.TRUE);
        return mapper;
    }
}
