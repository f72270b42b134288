package github.sarthakdev143.timeline_compiler.config;

import github.sarthakdev143.timeline_compiler.hardware.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Fails startup when the FFmpeg binary that compiled commands will name is unusable, or a configured font directory
 * is missing.
 */
@Component
@ConditionalOnProperty(name = "timeline-compiler.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);

    private final TimelineCompilerProperties properties;
    private final CommandRunner commandRunner;

    public StartupPreflightChecks(TimelineCompilerProperties properties, CommandRunner commandRunner) {
        this.properties = properties;
        this.commandRunner = commandRunner;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkFfmpegBinary(FfmpegBinary.resolve());
        checkFontDirectories();
    }

    void checkFfmpegBinary(String ffmpegPath) {
        String hint = "Install FFmpeg or set " + FfmpegBinary.FFMPEG_PATH_ENV + " to a valid ffmpeg executable path.";
        CommandRunner.CommandResult result;
        try {
            result = commandRunner.run(
                    List.of(ffmpegPath, "-version"),
                    Duration.ofSeconds(properties.getProbeTimeoutSeconds()));
        } catch (IOException ex) {
            throw new IllegalStateException("FFmpeg at '" + ffmpegPath + "' could not be run. " + hint, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while checking FFmpeg at '" + ffmpegPath + "'.", ex);
        }
        if (!result.succeeded()) {
            throw new IllegalStateException(
                    "FFmpeg at '" + ffmpegPath + "' exited with " + result.exitCode() + " for -version. " + hint);
        }
        logger.info("Using {}", firstLine(result.output()));
    }

    void checkFontDirectories() {
        for (String configured : properties.getFontDirectories()) {
            Path directory = Path.of(configured);
            if (!Files.isDirectory(directory)) {
                throw new IllegalStateException(
                        "Font directory not found at " + directory.toAbsolutePath()
                                + ". Fix timeline-compiler.font-directories.");
            }
        }
    }

    private static String firstLine(String output) {
        String trimmed = output == null ? "" : output.strip();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline).strip();
    }
}
