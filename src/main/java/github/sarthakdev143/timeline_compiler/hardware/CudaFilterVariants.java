package github.sarthakdev143.timeline_compiler.hardware;

/**
 * Runs the final resize on the GPU. Compositing stays on the CPU because overlay inputs mix alpha and non-alpha
 * frames that the CUDA overlay cannot take. {@code scale_cuda} keeps the uploaded software format, so the download
 * asks for the same {@code yuv420p}.
 */
public class CudaFilterVariants extends CpuFilterVariants {

    @Override
    public String finalResize(int width, int height, String fillColor) {
        return "format=yuv420p,hwupload_cuda,scale_cuda=" + width + ":" + height + ":force_original_aspect_ratio=decrease,"
                + "hwdownload,format=yuv420p,"
                + "pad=" + width + ":" + height + ":(ow-iw)/2:(oh-ih)/2:color=" + fillColor;
    }
}
