package github.sarthakdev143.timeline_compiler.hardware;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessCommandRunnerTest {

    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @Test
    void silentSlowCommandIsKilledAtTheTimeout() {
        long started = System.nanoTime();

        assertThatThrownBy(() -> runner.run(List.of("sh", "-c", "sleep 4; echo done"), Duration.ofMillis(300)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("timed out after 300ms");

        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        assertThat(elapsedMillis).isLessThan(3000);
    }

    @Test
    void outputAndExitCodeAreReturned() throws Exception {
        CommandRunner.CommandResult result = runner.run(List.of("sh", "-c", "echo hello; echo oops 1>&2"), Duration.ofSeconds(10));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.output()).contains("hello").contains("oops");
    }

    @Test
    void nonZeroExitIsReportedNotThrown() throws Exception {
        CommandRunner.CommandResult result = runner.run(List.of("sh", "-c", "exit 3"), Duration.ofSeconds(10));

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.succeeded()).isFalse();
    }
}
