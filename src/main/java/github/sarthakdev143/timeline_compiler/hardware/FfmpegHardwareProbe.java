package github.sarthakdev143.timeline_compiler.hardware;

import github.sarthakdev143.timeline_compiler.config.TimelineCompilerProperties;
import github.sarthakdev143.timeline_compiler.model.HardwareCapabilities;
import github.sarthakdev143.timeline_compiler.model.HardwareProfile;
import github.sarthakdev143.timeline_compiler.model.HardwareType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Probes the encoder binary in two steps: the encoder has to be listed by {@code -encoders}, and a tenth of a second
 * of test pattern has to encode with it. Listing alone is not enough because builds routinely list encoders whose
 * driver is missing.
 */
@Component
public class FfmpegHardwareProbe implements HardwareCapabilityProvider {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegHardwareProbe.class);

    private final CommandRunner commandRunner;
    private final TimelineCompilerProperties properties;

    public FfmpegHardwareProbe(CommandRunner commandRunner, TimelineCompilerProperties properties) {
        this.commandRunner = commandRunner;
        this.properties = properties;
    }

    @Override
    public HardwareCapabilities detect(String ffmpegPath) {
        String encoders = listEncoders(ffmpegPath);
        if (encoders == null) {
            logger.warn("Could not list encoders of {}, falling back to software encoding", ffmpegPath);
            return HardwareCapabilities.softwareOnly();
        }

        List<HardwareProfile> verified = new ArrayList<>();
        for (HardwareType type : HardwareType.detectionOrder()) {
            if (!encoders.contains(type.codecName())) {
                continue;
            }
            String device = null;
            if (type == HardwareType.VAAPI) {
                device = properties.getVaapiDevice();
                if (!Files.exists(Path.of(device))) {
                    logger.debug("Skipping {}: render node {} does not exist", type, device);
                    continue;
                }
            }
            if (smokeTest(ffmpegPath, type, device)) {
                verified.add(HardwareProfile.of(type, device));
            }
        }

        HardwareProfile software = HardwareProfile.software();
        HardwareProfile primary = verified.isEmpty() ? software : verified.get(0);
        logger.info("Hardware detection for {} selected {} ({} verified encoders)",
                ffmpegPath, primary.codecName(), verified.size());
        return new HardwareCapabilities(primary, verified, software);
    }

    List<String> smokeTestCommand(String ffmpegPath, HardwareType type, String device) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-hide_banner");
        if (device != null) {
            command.add("-vaapi_device");
            command.add(device);
        }
        command.add("-f");
        command.add("lavfi");
        command.add("-i");
        command.add("testsrc=duration=0.1:size=320x240:rate=1");
        if (type == HardwareType.VAAPI) {
            command.add("-vf");
            command.add("format=nv12,hwupload");
        }
        command.add("-c:v");
        command.add(type.codecName());
        command.add("-f");
        command.add("null");
        command.add("-");
        return command;
    }

    private String listEncoders(String ffmpegPath) {
        try {
            CommandRunner.CommandResult result = commandRunner.run(List.of(ffmpegPath, "-hide_banner", "-encoders"), timeout());
            if (!result.succeeded()) {
                logger.debug("Encoder listing exited with {}", result.exitCode());
                return null;
            }
            return result.output();
        } catch (IOException ex) {
            logger.debug("Encoder listing failed: {}", ex.getMessage());
            return null;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.debug("Encoder listing interrupted");
            return null;
        }
    }

    private boolean smokeTest(String ffmpegPath, HardwareType type, String device) {
        try {
            CommandRunner.CommandResult result = commandRunner.run(smokeTestCommand(ffmpegPath, type, device), timeout());
            if (!result.succeeded()) {
                logger.debug("{} is listed but failed to encode (exit {})", type.codecName(), result.exitCode());
            }
            return result.succeeded();
        } catch (IOException ex) {
            logger.debug("{} smoke test failed: {}", type.codecName(), ex.getMessage());
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.debug("{} smoke test interrupted", type.codecName());
            return false;
        }
    }

    private Duration timeout() {
        return Duration.ofSeconds(properties.getProbeTimeoutSeconds());
    }
}
