package flowscope;

import flowscope.analyzer.AnalysisReport;
import flowscope.analyzer.SourceAnalyzer;
import flowscope.parser.SourceParseException;
import flowscope.utils.AnalysisOptions;
import flowscope.utils.Logging;

import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line front end.
 * <pre>
 *   input=foo.c output=out [max_path_length=N] [max_disjuncts=N]
 * </pre>
 */
public class Main {

    public static void main(String[] args) {
        if (!Logging.init()) {
            System.exit(1);
        }
        System.exit(run(args));
    }

    static int run(String[] args) {
        String input = null;
        List<String> optionArgs = new ArrayList<>();
        for (String arg : args) {
            Logging.info("FlowScope", "Arg: " + arg);
            if (arg.startsWith("input=")) {
                input = arg.substring("input=".length());
            } else {
                optionArgs.add(arg);
            }
        }

        AnalysisOptions options;
        try {
            options = AnalysisOptions.fromArgs(optionArgs.toArray(new String[0]));
        } catch (IllegalArgumentException e) {
            Logging.error("FlowScope", e.getMessage());
            return 1;
        }
        if (input == null) {
            Logging.error("FlowScope", "Input file not specified");
            return 1;
        }
        if (options.outputDirectory == null) {
            Logging.error("FlowScope", "Output directory not specified");
            return 1;
        }

        try {
            File outputDir = prepareOutputDirectory(options.outputDirectory);
            AnalysisReport report = new SourceAnalyzer(options).analyze(Path.of(input));
            report.writeTo(outputDir);
        } catch (SourceParseException e) {
            Logging.error("FlowScope", "Cannot parse " + input + ": " + e.getMessage());
            return 1;
        } catch (IOException e) {
            Logging.error("FlowScope", "I/O error: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    static File prepareOutputDirectory(String path) throws IOException {
        File outputDir = new File(path);
        if (outputDir.exists() && !outputDir.isDirectory()) {
            throw new IOException("Output path is not a directory: " + path);
        }
        if (!outputDir.exists()) {
            if (!outputDir.mkdirs()) {
                throw new IOException("Failed to create output directory: " + path);
            }
            Logging.info("FlowScope", "Output directory created: " + path);
        } else {
            FileUtils.cleanDirectory(outputDir);
            Logging.info("FlowScope", "Output directory cleaned: " + path);
        }
        return outputDir;
    }
}
