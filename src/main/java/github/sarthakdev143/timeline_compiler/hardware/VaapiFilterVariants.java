package github.sarthakdev143.timeline_compiler.hardware;

import java.util.Optional;

public class VaapiFilterVariants extends CpuFilterVariants {

    @Override
    public Optional<String> outputUpload() {
        return Optional.of("format=nv12,hwupload=extra_hw_frames=64:derive_device=vaapi");
    }
}
