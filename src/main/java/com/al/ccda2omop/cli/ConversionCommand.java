package com.al.ccda2omop.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.context.ConfigurableApplicationContext;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Unmatched;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Entry point options. With {@code --input} the application converts (or
 * analyzes) the given files and exits; without it the REST service starts.
 * Options are handed to Spring as {@code app.conversion.*} properties and
 * anything unrecognised, such as {@code --server.port=9090}, is passed
 * through unchanged.
 *
 * @author CCDA2OMOP Team
 * @since 1.0.0
 */
@Command(name = "ccda2omop", mixinStandardHelpOptions = true, version = "ccda2omop 1.0.0",
        exitCodeOnInvalidInput = 1,
        description = "Converts C-CDA documents to OMOP CDM CSV files using YAML mapping rules.")
public class ConversionCommand implements Callable<Integer> {

    static final String PREFIX = "--app.conversion.";

    @Option(names = {"-i", "--input"}, description = "C-CDA file or directory of *.xml files")
    String input;

    @Option(names = {"-o", "--output"}, description = "Output directory for the OMOP CSV files (default: ./output)")
    String output;

    @Option(names = {"--concept"}, description = "OMOP CONCEPT table (tab-delimited)")
    String conceptFile;

    @Option(names = {"--relationship"}, description = "OMOP CONCEPT_RELATIONSHIP table (tab-delimited)")
    String relationshipFile;

    @Option(names = {"--vocab-dir"}, description = "Directory of supplementary concept files")
    String vocabDir;

    @Option(names = {"--rules-file"}, description = "Rule file or directory (default: bundled rules)")
    String rulesPath;

    @Option(names = {"-v", "--verbose"}, description = "Verbose output")
    boolean verbose;

    @Option(names = {"--report"}, description = "Produce a conversion report")
    boolean report;

    @Option(names = {"--report-output"}, description = "Report file; a .json suffix selects JSON (default: stdout)")
    String reportOutput;

    @Option(names = {"--continue-on-error"}, description = "Skip failing documents instead of aborting")
    boolean continueOnError;

    @Option(names = {"--analyze"}, description = "List the coded values and their OMOP mapping instead of converting")
    boolean analyze;

    @Option(names = {"--analyze-output"}, description = "Analysis CSV file (default: stdout)")
    String analyzeOutput;

    @Option(names = {"--summary"}, description = "With --analyze, print the section to OMOP table overview")
    boolean summary;

    @Unmatched
    List<String> passThrough = new ArrayList<>();

    private final Class<?> applicationClass;

    public ConversionCommand(Class<?> applicationClass) {
        this.applicationClass = applicationClass;
    }

    @Override
    public Integer call() {
        SpringApplication application = new SpringApplication(applicationClass);
        boolean commandLine = isCommandLineRun();
        if (commandLine) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        ConfigurableApplicationContext context = application.run(toPropertyArguments());
        return commandLine ? SpringApplication.exit(context) : 0;
    }

    /**
     * Whether the arguments ask for a one-shot run rather than the service.
     */
    public boolean isCommandLineRun() {
        return input != null || passThrough.stream().anyMatch(arg -> arg.startsWith(PREFIX + "input="));
    }

    String[] toPropertyArguments() {
        List<String> args = new ArrayList<>();
        addValue(args, "input", input);
        addValue(args, "output-dir", output);
        addValue(args, "concept-file", conceptFile);
        addValue(args, "relationship-file", relationshipFile);
        addValue(args, "vocab-dir", vocabDir);
        addValue(args, "rules-path", rulesPath);
        addValue(args, "report-output", reportOutput);
        addFlag(args, "verbose", verbose);
        addFlag(args, "report", report);
        addFlag(args, "continue-on-error", continueOnError);
        addFlag(args, "analyze", analyze);
        addValue(args, "analyze-output", analyzeOutput);
        addFlag(args, "analyze-summary", summary);
        args.addAll(passThrough);
        return args.toArray(new String[0]);
    }

    private static void addValue(List<String> args, String key, String value) {
        if (value != null) {
            args.add(PREFIX + key + "=" + value);
        }
    }

    private static void addFlag(List<String> args, String key, boolean set) {
        if (set) {
            args.add(PREFIX + key + "=true");
        }
    }
}
