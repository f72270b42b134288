package github.sarthakdev143.timeline_compiler.hardware;

import github.sarthakdev143.timeline_compiler.config.TimelineCompilerProperties;
import github.sarthakdev143.timeline_compiler.model.FilterVariant;
import github.sarthakdev143.timeline_compiler.model.HardwareProfile;
import github.sarthakdev143.timeline_compiler.model.HardwareType;
import org.springframework.stereotype.Component;

@Component
public class FilterVariantsRegistry {

    private final TimelineCompilerProperties properties;
    private final FilterVariants cpu = new CpuFilterVariants();
    private final FilterVariants cuda = new CudaFilterVariants();
    private final FilterVariants vaapi = new VaapiFilterVariants();

    public FilterVariantsRegistry(TimelineCompilerProperties properties) {
        this.properties = properties;
    }

    public FilterVariants forProfile(HardwareProfile profile) {
        if (profile.type() == HardwareType.VAAPI) {
            return vaapi;
        }
        if (profile.filterVariant() == FilterVariant.CUDA && properties.isGpuFiltersEnabled()) {
            return cuda;
        }
        return cpu;
    }
}
