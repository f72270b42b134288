package github.sarthakdev143.timeline_compiler.hardware;

import github.sarthakdev143.timeline_compiler.model.ExportJob;
import github.sarthakdev143.timeline_compiler.model.HardwareCapabilities;
import github.sarthakdev143.timeline_compiler.model.HardwareProfile;
import github.sarthakdev143.timeline_compiler.model.HardwareType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the encoder profile for one job from the detected capabilities.
 */
@Component
public class HardwareProfileSelector {

    private static final Logger logger = LoggerFactory.getLogger(HardwareProfileSelector.class);

    public HardwareProfile select(HardwareCapabilities capabilities, ExportJob job) {
        if (!job.hardwareAccelerationEnabled() || job.preferredHardware() == HardwareType.SOFTWARE) {
            return capabilities.fallback();
        }
        HardwareType preferred = job.preferredHardware();
        if (preferred == null) {
            return capabilities.primary();
        }
        return capabilities.find(preferred).orElseGet(() -> {
            logger.warn("Requested {} encoder is not available, using software encoding", preferred);
            return capabilities.fallback();
        });
    }
}
