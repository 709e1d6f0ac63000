package work.canopy.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.canopy.api.Orchestrator;
import work.canopy.api.OrchestratorConfiguration;
import work.canopy.envelope.HashProfile;
import work.canopy.shared.DurationParser;

@CommandLine.Command(
    name = "canopy",
    description = "Validate, plan and run declarative experiments.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CanopyCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-e", "--experiment"},
        required = true,
        description = "Experiment YAML file."
    )
    private Path experiment;

    @CommandLine.Option(
        names = "--project-root",
        description = "Project root holding registries, schemas and methods (default: working directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path projectRoot;

    @CommandLine.Option(
        names = "--profile",
        description = "Input hashing profile (full|dev|test).",
        defaultValue = "full"
    )
    private String profile;

    @CommandLine.Option(
        names = "--output-dir",
        description = "Directory for step outputs (default: <manifest-dir>/.data).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path outputDirectory;

    @CommandLine.Option(
        names = "--timeout",
        description = "Per-primitive timeout (e.g. 30s, 2m, 1h; plain numbers are milliseconds).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--parallel",
        description = "Maximum number of independent steps run at once.",
        defaultValue = "1"
    )
    private int parallel;

    @CommandLine.Option(
        names = "--skip-file-check",
        description = "Do not require primitive files to exist during validation."
    )
    private boolean skipFileCheck;

    @CommandLine.Option(
        names = "--interpreter",
        description = "Command used to launch primitive files.",
        split = " ",
        defaultValue = "Rscript"
    )
    private List<String> interpreter;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(names = "--validate", description = "Only validate the experiment and print the report.")
    private boolean validateOnly;

    @CommandLine.Option(names = "--plan", description = "Only print the execution plan.")
    private boolean planOnly;

    @Override
    public Integer call() throws Exception {
        if (validateOnly && planOnly) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--validate and --plan are mutually exclusive.");
        }
        applyLogLevel();

        var root = projectRoot != null ? projectRoot.toAbsolutePath().normalize() : Paths.get("").toAbsolutePath();
        var configuration = OrchestratorConfiguration.builder()
            .experimentPath(experiment.toAbsolutePath().normalize())
            .projectRoot(root)
            .profile(HashProfile.from(profile))
            .outputDirectory(outputDirectory == null ? null : outputDirectory.toAbsolutePath().normalize())
            .primitiveTimeout(DurationParser.parse(timeoutRaw))
            .maxParallelSteps(parallel)
            .verifyPrimitiveFiles(!skipFileCheck)
            .interpreter(interpreter)
            .build();
        var orchestrator = new Orchestrator(configuration);
        var out = spec.commandLine().getOut();

        if (planOnly) {
            out.println(orchestrator.visualize());
            return 0;
        }
        if (validateOnly) {
            var report = orchestrator.validate();
            var payload = new LinkedHashMap<String, Object>();
            payload.put("valid", report.valid());
            payload.put("errors", report.errors());
            payload.put("warnings", report.warnings());
            out.println(JSON_WRITER.writeValueAsString(payload));
            return report.valid() ? 0 : 1;
        }

        var result = orchestrator.run();
        out.println(result.toPrettyJson());
        return result.exitCode();
    }

    private void applyLogLevel() {
        if (logLevelRaw == null || logLevelRaw.isBlank()) {
            return;
        }
        var root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.toLevel(logLevelRaw, Level.INFO));
        }
    }
}
