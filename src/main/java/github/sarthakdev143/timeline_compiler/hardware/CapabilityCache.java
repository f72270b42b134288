package github.sarthakdev143.timeline_compiler.hardware;

import github.sarthakdev143.timeline_compiler.config.FfmpegBinary;
import github.sarthakdev143.timeline_compiler.model.HardwareCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Detection results per encoder binary. Detection runs at most once per binary until it is invalidated.
 */
@Component
public class CapabilityCache {

    private static final Logger logger = LoggerFactory.getLogger(CapabilityCache.class);

    private final HardwareCapabilityProvider provider;
    private final Map<String, HardwareCapabilities> cache = new ConcurrentHashMap<>();

    public CapabilityCache(HardwareCapabilityProvider provider) {
        this.provider = provider;
    }

    public HardwareCapabilities get() {
        return get(FfmpegBinary.resolve());
    }

    public HardwareCapabilities get(String ffmpegPath) {
        return cache.computeIfAbsent(ffmpegPath, provider::detect);
    }

    public void invalidate() {
        logger.info("Clearing cached hardware capabilities for {} binaries", cache.size());
        cache.clear();
    }

    public void invalidate(String ffmpegPath) {
        cache.remove(ffmpegPath);
    }
}
