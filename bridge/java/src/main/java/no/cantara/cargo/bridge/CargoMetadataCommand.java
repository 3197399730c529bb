package no.cantara.cargo.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs {@code cargo metadata} as a subprocess and returns its standard output.
 *
 * <pre>
 *   &lt;cargo&gt; metadata --no-deps --format-version=1 --manifest-path &lt;dir&gt;/Cargo.toml
 * </pre>
 *
 * <p>The executable is the one given to the constructor, else {@code $CARGO}, else
 * {@code cargo} from the {@code PATH}. No timeout is applied; the calling thread blocks
 * until the process exits.
 */
public class CargoMetadataCommand implements MetadataSource {

    private static final Logger log = LoggerFactory.getLogger(CargoMetadataCommand.class);

    static final String MANIFEST_FILE = "Cargo.toml";

    private final String executable;

    public CargoMetadataCommand() {
        this(null);
    }

    public CargoMetadataCommand(String executable) {
        this.executable = executable != null && !executable.isBlank()
            ? executable
            : defaultExecutable();
    }

    static String defaultExecutable() {
        String fromEnv = System.getenv("CARGO");
        return fromEnv != null && !fromEnv.isBlank() ? fromEnv : "cargo";
    }

    public String executable() {
        return executable;
    }

    List<String> command(Path projectDir) {
        return List.of(
            executable, "metadata",
            "--no-deps",
            "--format-version=1",
            "--manifest-path", projectDir.resolve(MANIFEST_FILE).toString()
        );
    }

    @Override
    public String fetch(Path projectDir) {
        List<String> command = command(projectDir);
        log.debug("Running: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                .directory(projectDir.toFile())
                .redirectErrorStream(false)
                .start();
        } catch (IOException e) {
            throw new ExternalToolException("Could not start '" + executable + "': " + e.getMessage(), e);
        }

        // Drain stderr on our own thread so a chatty tool cannot block on a full pipe.
        ExecutorService stderrReader = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "cargo-metadata-stderr");
            t.setDaemon(true);
            return t;
        });
        Future<String> stderr = stderrReader.submit(() -> readAll(process.getErrorStream()));

        try {
            String stdout;
            try (InputStream in = process.getInputStream()) {
                stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            String errors = stderr.get().strip();

            if (exitCode != 0) {
                log.warn("{} metadata exited with code {} for {}", executable, exitCode, projectDir);
                throw new ExternalToolException(
                    executable + " metadata exited with code " + exitCode
                        + (errors.isEmpty() ? "" : ": " + errors),
                    exitCode);
            }
            if (!errors.isEmpty()) {
                log.debug("{} metadata stderr: {}", executable, errors);
            }
            if (stdout.isBlank()) {
                throw new ExternalToolException(executable + " metadata produced no output for " + projectDir, exitCode);
            }
            return stdout;
        } catch (IOException e) {
            process.destroy();
            throw new ExternalToolException("Failed to read output of '" + executable + "'", e);
        } catch (ExecutionException e) {
            throw new ExternalToolException("Failed to read error output of '" + executable + "'", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new ExternalToolException("Interrupted while waiting for '" + executable + "'", e);
        } finally {
            stderrReader.shutdownNow();
        }
    }

    private static String readAll(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
