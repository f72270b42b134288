package github.sarthakdev143.timeline_compiler.command;

import github.sarthakdev143.timeline_compiler.catalog.CatalogedInputs;
import github.sarthakdev143.timeline_compiler.config.FfmpegBinary;
import github.sarthakdev143.timeline_compiler.config.TimelineCompilerProperties;
import github.sarthakdev143.timeline_compiler.graph.CompiledGraph;
import github.sarthakdev143.timeline_compiler.model.ExportJob;
import github.sarthakdev143.timeline_compiler.model.HardwareProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes a compiled graph and the job's encoding settings into an argument vector. Arguments are literal
 * strings for direct process invocation; nothing here is shell-quoted.
 */
@Component
public class CommandAssembler {

    private static final Logger logger = LoggerFactory.getLogger(CommandAssembler.class);

    private final TimelineCompilerProperties properties;

    public CommandAssembler(TimelineCompilerProperties properties) {
        this.properties = properties;
    }

    public List<String> assemble(CatalogedInputs inputs, CompiledGraph graph, ExportJob job, HardwareProfile hardware) {
        return assemble(FfmpegBinary.resolve(), inputs, graph, job, hardware);
    }

    public List<String> assemble(
            String ffmpegPath,
            CatalogedInputs inputs,
            CompiledGraph graph,
            ExportJob job,
            HardwareProfile hardware) {
        if (job.outputPath() == null || job.outputPath().isBlank()) {
            throw new IllegalArgumentException("Output path must not be blank.");
        }

        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-y");
        if (hardware.device() != null) {
            command.add("-vaapi_device");
            command.add(hardware.device());
        }

        List<String> inputPaths = inputs.inputPaths();
        for (int index = 0; index < inputPaths.size(); index++) {
            if (inputs.isStillImage(index)) {
                command.add("-loop");
                command.add("1");
            }
            command.add("-i");
            command.add(inputPaths.get(index));
        }

        command.add("-filter_complex");
        command.add(graph.filterComplex());
        command.add("-map");
        command.add(graph.videoLabel());
        if (graph.hasAudio()) {
            command.add("-map");
            command.add(graph.audioLabel());
        }

        command.add("-c:v");
        command.add(hardware.codecFor(job.preferHevc()));
        if (graph.hasAudio()) {
            command.add("-c:a");
            command.add("aac");
        }

        addEncoderFlags(command, job, hardware);

        if (job.threads() > 0) {
            command.add("-threads");
            command.add(String.valueOf(job.threads()));
        }
        command.add("-r");
        command.add(String.valueOf(job.frameRate()));
        command.add(job.outputPath());

        logger.debug("Assembled command: {}", String.join(" ", command));
        return command;
    }

    private void addEncoderFlags(List<String> command, ExportJob job, HardwareProfile hardware) {
        if (!hardware.isSoftware() || job.preset() == null || job.preset().isBlank()) {
            command.addAll(hardware.encoderFlags());
            return;
        }
        command.add("-preset");
        command.add(job.preset());
        command.add("-crf");
        command.add(String.valueOf(properties.getSoftwareCrf()));
        command.add("-b:a");
        command.add(properties.getSoftwareAudioBitrate());
    }
}
