package github.sarthakdev143.timeline_compiler.hardware;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion. Used by hardware detection to query the encoder binary.
 */
public interface CommandRunner {

    /**
     * @throws IOException when the command cannot be started or does not finish within {@code timeout}
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;

    record CommandResult(int exitCode, String output) {

        public boolean succeeded() {
            return exitCode == 0;
        }
    }
}
