package github.sarthakdev143.timeline_compiler.hardware;

import github.sarthakdev143.timeline_compiler.config.TimelineCompilerProperties;
import github.sarthakdev143.timeline_compiler.model.HardwareProfile;
import github.sarthakdev143.timeline_compiler.model.HardwareType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FilterVariantsRegistryTest {

    private final TimelineCompilerProperties properties = new TimelineCompilerProperties();
    private final FilterVariantsRegistry registry = new FilterVariantsRegistry(properties);

    @Test
    void nvencUsesCpuFiltersUnlessGpuFiltersAreEnabled() {
        HardwareProfile nvenc = HardwareProfile.of(HardwareType.NVENC, null);

        assertThat(registry.forProfile(nvenc)).isInstanceOf(CpuFilterVariants.class);

        properties.setGpuFiltersEnabled(true);
        assertThat(registry.forProfile(nvenc)).isInstanceOf(CudaFilterVariants.class);
    }

    @Test
    void vaapiUploadsFramesBeforeEncoding() {
        FilterVariants variants = registry.forProfile(HardwareProfile.of(HardwareType.VAAPI, "/dev/dri/renderD128"));

        assertThat(variants).isInstanceOf(VaapiFilterVariants.class);
        assertThat(variants.outputUpload()).contains("format=nv12,hwupload=extra_hw_frames=64:derive_device=vaapi");
    }

    @Test
    void softwareHasNoUploadStep() {
        FilterVariants variants = registry.forProfile(HardwareProfile.software());

        assertThat(variants.outputUpload()).isEmpty();
        assertThat(variants.scaleToFit(1280, 720)).isEqualTo("scale=1280:720:force_original_aspect_ratio=decrease");
    }

    @Test
    void cudaResizeDownloadsInTheUploadedFormat() {
        String resize = new CudaFilterVariants().finalResize(1280, 720, "black");

        assertThat(resize).contains("hwupload_cuda,scale_cuda=1280:720:force_original_aspect_ratio=decrease");
        assertThat(resize).contains("hwdownload,format=yuv420p");
        assertThat(resize).doesNotContain("nv12");
    }
}
