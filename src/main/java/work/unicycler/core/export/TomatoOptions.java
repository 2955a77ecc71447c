package work.unicycler.core.export;

/**
 * Overrides and output settings for {@link TomatoExporter}.
 */
public record TomatoOptions(String sampleName, Double capacityMah, String outputPath) {
    public static final String DEFAULT_OUTPUT_PATH = "C:/tomato_data";

    public TomatoOptions {
        outputPath = outputPath == null || outputPath.isBlank() ? DEFAULT_OUTPUT_PATH : outputPath;
    }

    public static TomatoOptions defaults() {
        return new TomatoOptions(null, null, null);
    }
}
