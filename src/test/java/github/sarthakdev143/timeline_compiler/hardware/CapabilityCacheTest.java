package github.sarthakdev143.timeline_compiler.hardware;

import github.sarthakdev143.timeline_compiler.model.HardwareCapabilities;
import github.sarthakdev143.timeline_compiler.model.HardwareProfile;
import github.sarthakdev143.timeline_compiler.model.HardwareType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CapabilityCacheTest {

    @Mock
    private HardwareCapabilityProvider provider;

    @InjectMocks
    private CapabilityCache cache;

    @Test
    void detectsOncePerBinary() {
        HardwareProfile nvenc = HardwareProfile.of(HardwareType.NVENC, null);
        when(provider.detect("/opt/ffmpeg")).thenReturn(new HardwareCapabilities(nvenc, List.of(nvenc), null));
        when(provider.detect("ffmpeg")).thenReturn(HardwareCapabilities.softwareOnly());

        cache.get("/opt/ffmpeg");
        cache.get("/opt/ffmpeg");
        HardwareCapabilities other = cache.get("ffmpeg");

        verify(provider, times(1)).detect("/opt/ffmpeg");
        assertThat(other.primary().isSoftware()).isTrue();
    }

    @Test
    void invalidateForcesDetectionAgain() {
        when(provider.detect("ffmpeg")).thenReturn(HardwareCapabilities.softwareOnly());

        cache.get("ffmpeg");
        cache.invalidate();
        cache.get("ffmpeg");
        cache.invalidate("ffmpeg");
        cache.get("ffmpeg");

        verify(provider, times(3)).detect("ffmpeg");
    }
}
