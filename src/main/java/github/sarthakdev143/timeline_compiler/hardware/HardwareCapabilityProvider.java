package github.sarthakdev143.timeline_compiler.hardware;

import github.sarthakdev143.timeline_compiler.model.HardwareCapabilities;

public interface HardwareCapabilityProvider {

    /**
     * Detects which encoders the given binary can actually use. Never throws for a missing or broken encoder; those
     * are left out of the result.
     */
    HardwareCapabilities detect(String ffmpegPath);
}
