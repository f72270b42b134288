package github.sarthakdev143.timeline_compiler.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of hardware detection: the preferred profile, every verified profile in priority order, and the software
 * fallback.
 */
public record HardwareCapabilities(HardwareProfile primary, List<HardwareProfile> all, HardwareProfile fallback) {

    public HardwareCapabilities {
        all = all == null ? List.of() : List.copyOf(all);
        fallback = fallback == null ? HardwareProfile.software() : fallback;
        primary = primary == null ? fallback : primary;
    }

    public static HardwareCapabilities softwareOnly() {
        HardwareProfile software = HardwareProfile.software();
        return new HardwareCapabilities(software, List.of(), software);
    }

    public Optional<HardwareProfile> find(HardwareType type) {
        return all.stream().filter(profile -> profile.type() == type).findFirst();
    }
}
