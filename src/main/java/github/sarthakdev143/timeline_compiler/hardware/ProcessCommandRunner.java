package github.sarthakdev143.timeline_compiler.hardware;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a command with merged stdout and stderr. Output is drained on a separate thread so that the timeout holds
 * even when the process never closes its output.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(ProcessCommandRunner.class);
    private static final long OUTPUT_GRACE_MILLIS = 1000;

    @Override
    public CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        logger.debug("Running command: {}", String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();

        InputStream stdout = process.getInputStream();
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(stdout));

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            output.cancel(true);
            stdout.close();
            throw new IOException("Command timed out after " + timeout.toMillis() + "ms: " + command.get(0));
        }
        return new CommandResult(process.exitValue(), collect(output, command));
    }

    private static String collect(CompletableFuture<String> output, List<String> command)
            throws IOException, InterruptedException {
        try {
            // a child that inherited the stream can keep it open after the process exits
            return output.get(OUTPUT_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            output.cancel(true);
            logger.debug("Output of {} still open after exit, returning without it", command.get(0));
            return "";
        } catch (ExecutionException ex) {
            throw new IOException("Could not read output of " + command.get(0), ex.getCause());
        }
    }

    private static String readAll(InputStream stdout) {
        try (stdout) {
            return new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
