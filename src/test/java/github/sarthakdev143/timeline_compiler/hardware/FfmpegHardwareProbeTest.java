package github.sarthakdev143.timeline_compiler.hardware;

import github.sarthakdev143.timeline_compiler.config.TimelineCompilerProperties;
import github.sarthakdev143.timeline_compiler.model.HardwareCapabilities;
import github.sarthakdev143.timeline_compiler.model.HardwareProfile;
import github.sarthakdev143.timeline_compiler.model.HardwareType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FfmpegHardwareProbeTest {

    private static final List<String> LIST_ENCODERS = List.of("ffmpeg", "-hide_banner", "-encoders");

    @Mock
    private CommandRunner commandRunner;

    private TimelineCompilerProperties properties;
    private FfmpegHardwareProbe probe;

    @BeforeEach
    void setUp() {
        properties = new TimelineCompilerProperties();
        properties.setVaapiDevice("/nonexistent/dri/renderD128");
        probe = new FfmpegHardwareProbe(commandRunner, properties);
    }

    @Test
    void listedEncoderThatEncodesBecomesPrimary() throws Exception {
        when(commandRunner.run(any(), any(Duration.class))).thenAnswer(invocation -> {
            List<String> command = invocation.getArgument(0);
            if (command.equals(LIST_ENCODERS)) {
                return new CommandRunner.CommandResult(0, " V....D h264_nvenc  NVIDIA NVENC H.264 encoder\n"
                        + " V....D h264_qsv    H.264 (Intel Quick Sync Video acceleration)\n");
            }
            return new CommandRunner.CommandResult(0, "");
        });

        HardwareCapabilities capabilities = probe.detect("ffmpeg");

        assertThat(capabilities.primary().type()).isEqualTo(HardwareType.NVENC);
        assertThat(capabilities.all()).extracting(HardwareProfile::type)
                .containsExactly(HardwareType.NVENC, HardwareType.QSV);
        assertThat(capabilities.fallback().isSoftware()).isTrue();
    }

    @Test
    void listedEncoderThatFailsToEncodeIsDropped() throws Exception {
        when(commandRunner.run(any(), any(Duration.class))).thenAnswer(invocation -> {
            List<String> command = invocation.getArgument(0);
            if (command.equals(LIST_ENCODERS)) {
                return new CommandRunner.CommandResult(0, " h264_nvenc\n h264_qsv\n");
            }
            boolean nvenc = command.contains("h264_nvenc");
            return new CommandRunner.CommandResult(nvenc ? 1 : 0, nvenc ? "Cannot load libcuda.so.1" : "");
        });

        HardwareCapabilities capabilities = probe.detect("ffmpeg");

        assertThat(capabilities.primary().type()).isEqualTo(HardwareType.QSV);
        assertThat(capabilities.find(HardwareType.NVENC)).isEmpty();
    }

    @Test
    void failedListingMeansSoftwareOnly() throws Exception {
        when(commandRunner.run(any(), any(Duration.class))).thenThrow(new IOException("No such file"));

        HardwareCapabilities capabilities = probe.detect("/missing/ffmpeg");

        assertThat(capabilities.primary().isSoftware()).isTrue();
        assertThat(capabilities.all()).isEmpty();
    }

    @Test
    void nonZeroListingExitMeansSoftwareOnly() throws Exception {
        when(commandRunner.run(any(), any(Duration.class))).thenReturn(new CommandRunner.CommandResult(1, "h264_nvenc"));

        assertThat(probe.detect("ffmpeg").primary().isSoftware()).isTrue();
        verify(commandRunner, times(1)).run(any(), any(Duration.class));
    }

    @Test
    void vaapiIsNotSmokeTestedWithoutARenderNode() throws Exception {
        when(commandRunner.run(any(), any(Duration.class))).thenReturn(new CommandRunner.CommandResult(0, " h264_vaapi\n"));

        HardwareCapabilities capabilities = probe.detect("ffmpeg");

        assertThat(capabilities.primary().isSoftware()).isTrue();
        verify(commandRunner, times(1)).run(any(), any(Duration.class));
    }

    @Test
    void vaapiSmokeTestUploadsThroughTheDevice() {
        List<String> command = probe.smokeTestCommand("ffmpeg", HardwareType.VAAPI, "/dev/dri/renderD128");

        assertThat(command).containsSequence("-vaapi_device", "/dev/dri/renderD128");
        assertThat(command).containsSequence("-vf", "format=nv12,hwupload");
        assertThat(command).containsSequence("-c:v", "h264_vaapi", "-f", "null", "-");
    }

    @Test
    void smokeTestEncodesATestPattern() {
        List<String> command = probe.smokeTestCommand("ffmpeg", HardwareType.QSV, null);

        assertThat(command).containsSequence("-f", "lavfi", "-i", "testsrc=duration=0.1:size=320x240:rate=1");
        assertThat(command).doesNotContain("-vaapi_device", "-vf");
    }
}
