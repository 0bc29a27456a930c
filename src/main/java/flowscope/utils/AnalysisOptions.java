package flowscope.utils;

/**
 * Knobs shared by one analysis run.
 */
public class AnalysisOptions {
    public static final int DEFAULT_MAX_CONSTRAINT_DISJUNCTS = 4096;

    /** Upper bound on the disjuncts one guard may expand to */
    public int maxConstraintDisjuncts = DEFAULT_MAX_CONSTRAINT_DISJUNCTS;

    /** Maximum number of edges of an enumerated path, null for unbounded */
    public Integer maxPathLength;

    public String outputDirectory;

    public static AnalysisOptions defaults() {
        return new AnalysisOptions();
    }

    /**
     * Build options from {@code key=value} arguments.
     * @throws IllegalArgumentException on malformed pairs, unknown keys or bad numbers
     */
    public static AnalysisOptions fromArgs(String... args) {
        AnalysisOptions options = new AnalysisOptions();
        for (String arg : args) {
            String[] argParts = arg.split("=", 2);
            if (argParts.length != 2 || argParts[0].isEmpty()) {
                throw new IllegalArgumentException("Invalid argument: " + arg);
            }
            options.set(argParts[0], argParts[1]);
        }
        return options;
    }

    public static boolean isOptionKey(String key) {
        return switch (key) {
            case "output", "max_path_length", "max_disjuncts" -> true;
            default -> false;
        };
    }

    private void set(String key, String value) {
        switch (key) {
            case "output" -> outputDirectory = value;
            case "max_path_length" -> maxPathLength = parsePositive(key, value);
            case "max_disjuncts" -> maxConstraintDisjuncts = parsePositive(key, value);
            default -> throw new IllegalArgumentException("Invalid argument: " + key + "=" + value);
        }
    }

    private static int parsePositive(String key, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
        return parsed;
    }

    @Override
    public String toString() {
        return String.format("AnalysisOptions{maxConstraintDisjuncts=%d, maxPathLength=%s, outputDirectory=%s}",
                maxConstraintDisjuncts, maxPathLength, outputDirectory);
    }
}
