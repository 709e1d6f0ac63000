package work.canopy.primitive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.canopy.error.ErrorKind;
import work.canopy.error.PrimitiveExecutionException;
import work.canopy.parse.YamlDocuments;
import work.canopy.shared.Values;

/**
 * Runs primitives as external processes:
 * {@code <interpreter...> <primitive file> <inputs.json> <output path> <params.json>}.
 * The process must print one JSON object on stdout; anything else is a failure regardless of exit code.
 */
public final class ProcessPrimitiveExecutor implements PrimitiveExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessPrimitiveExecutor.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int MAX_ECHOED_OUTPUT = 500;

    private final List<String> interpreter;
    private final Path workingDirectory;
    private final Optional<Duration> timeout;

    public ProcessPrimitiveExecutor(List<String> interpreter, Path workingDirectory, Optional<Duration> timeout) {
        this.interpreter = List.copyOf(interpreter);
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public PrimitiveOutcome execute(PrimitiveInvocation invocation) {
        var reference = invocation.primitive().reference();
        var scratch = new ArrayList<Path>();
        try {
            var inputsFile = writeJson(scratch, "inputs", inputsDocument(invocation));
            var paramsFile = writeJson(scratch, "params", Values.copyMap(invocation.params()));
            var stdoutFile = scratchFile(scratch, "stdout", ".log");
            var stderrFile = scratchFile(scratch, "stderr", ".log");

            var command = new ArrayList<>(interpreter);
            command.add(invocation.primitive().absolutePath().toString());
            command.add(inputsFile.toString());
            command.add(invocation.outputPath().toString());
            command.add(paramsFile.toString());
            LOG.debug("Launching {}: {}", reference, command);

            var process = new ProcessBuilder(command)
                .directory(workingDirectory.toFile())
                .redirectOutput(stdoutFile.toFile())
                .redirectError(stderrFile.toFile())
                .start();
            int exitCode = await(process, reference);
            return interpret(
                exitCode,
                Files.readString(stdoutFile, StandardCharsets.UTF_8),
                Files.readString(stderrFile, StandardCharsets.UTF_8)
            );
        } catch (IOException ex) {
            throw new PrimitiveExecutionException(ErrorKind.PRIMITIVE_LAUNCH_FAILED, "Failed to run primitive " + reference + ": " + ex.getMessage(), reference, ex);
        } finally {
            for (var path : scratch) {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException ex) {
                    LOG.debug("Could not delete scratch file {}", path, ex);
                }
            }
        }
    }

    static PrimitiveOutcome interpret(int exitCode, String stdout, String stderr) {
        Map<String, Object> response;
        try {
            response = stdout.isBlank() ? new LinkedHashMap<>() : parseObject(stdout);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            var echoed = stdout.length() > MAX_ECHOED_OUTPUT ? stdout.substring(0, MAX_ECHOED_OUTPUT) : stdout;
            return PrimitiveOutcome.failure(
                ErrorKind.PRIMITIVE_INVALID_OUTPUT,
                "Invalid response",
                "Primitive returned non-JSON output: " + echoed.strip(),
                List.of()
            );
        }
        if (exitCode != 0) {
            var fallback = stderr == null || stderr.isBlank() ? "Primitive failed with exit code " + exitCode : stderr.strip();
            return PrimitiveOutcome.failure(
                ErrorKind.PRIMITIVE_FAILED,
                Values.asString(response.get("error"), "Unknown error"),
                Values.asString(response.get("message"), fallback),
                PrimitiveOutcome.warningsFrom(response)
            );
        }
        return PrimitiveOutcome.success(response);
    }

    private int await(Process process, String reference) {
        try {
            if (timeout.isEmpty()) {
                return process.waitFor();
            }
            if (!process.waitFor(timeout.get().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new PrimitiveExecutionException(
                    ErrorKind.PRIMITIVE_TIMEOUT,
                    "Primitive " + reference + " did not finish within " + timeout.get(),
                    reference
                );
            }
            return process.exitValue();
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new PrimitiveExecutionException(ErrorKind.PRIMITIVE_LAUNCH_FAILED, "Interrupted while running " + reference, reference, ex);
        }
    }

    private static Map<String, Object> parseObject(String stdout) throws JsonProcessingException {
        var parsed = YamlDocuments.convertNode(JSON.readTree(stdout));
        if (!(parsed instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Primitive response is not a JSON object");
        }
        return Values.copyMap(Values.asMap(parsed));
    }

    private static Map<String, Object> inputsDocument(PrimitiveInvocation invocation) {
        var inputs = new LinkedHashMap<String, Object>();
        invocation.inputs().forEach((name, path) -> inputs.put(name, path.toString()));
        return inputs;
    }

    private static Path writeJson(List<Path> scratch, String prefix, Map<String, Object> document) throws IOException {
        var path = scratchFile(scratch, prefix, ".json");
        JSON.writeValue(path.toFile(), document);
        return path;
    }

    private static Path scratchFile(List<Path> scratch, String prefix, String suffix) throws IOException {
        var path = Files.createTempFile("canopy-" + prefix + "-", suffix);
        scratch.add(path);
        return path;
    }
}
