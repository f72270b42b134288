package github.sarthakdev143.timeline_compiler.service.impl;

import github.sarthakdev143.timeline_compiler.catalog.CatalogedInputs;
import github.sarthakdev143.timeline_compiler.catalog.InputCataloger;
import github.sarthakdev143.timeline_compiler.command.CommandAssembler;
import github.sarthakdev143.timeline_compiler.dimension.CanvasPlan;
import github.sarthakdev143.timeline_compiler.dimension.DimensionNegotiator;
import github.sarthakdev143.timeline_compiler.exception.MissingAssetException;
import github.sarthakdev143.timeline_compiler.graph.CompiledGraph;
import github.sarthakdev143.timeline_compiler.graph.FilterGraphCompiler;
import github.sarthakdev143.timeline_compiler.hardware.CapabilityCache;
import github.sarthakdev143.timeline_compiler.hardware.FilterVariants;
import github.sarthakdev143.timeline_compiler.hardware.FilterVariantsRegistry;
import github.sarthakdev143.timeline_compiler.hardware.HardwareProfileSelector;
import github.sarthakdev143.timeline_compiler.model.CompiledCommand;
import github.sarthakdev143.timeline_compiler.model.ExportJob;
import github.sarthakdev143.timeline_compiler.model.HardwareCapabilities;
import github.sarthakdev143.timeline_compiler.model.HardwareProfile;
import github.sarthakdev143.timeline_compiler.model.HardwareType;
import github.sarthakdev143.timeline_compiler.model.LayeredTimeline;
import github.sarthakdev143.timeline_compiler.model.MediaKind;
import github.sarthakdev143.timeline_compiler.model.TrackDescriptor;
import github.sarthakdev143.timeline_compiler.service.FontDirectoryResolver;
import github.sarthakdev143.timeline_compiler.service.TimelineCompilationService;
import github.sarthakdev143.timeline_compiler.timeline.TimelineBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Service
public class DefaultTimelineCompilationService implements TimelineCompilationService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultTimelineCompilationService.class);

    private final InputCataloger inputCataloger;
    private final TimelineBuilder timelineBuilder;
    private final DimensionNegotiator dimensionNegotiator;
    private final FilterGraphCompiler filterGraphCompiler;
    private final CommandAssembler commandAssembler;
    private final CapabilityCache capabilityCache;
    private final HardwareProfileSelector hardwareProfileSelector;
    private final FilterVariantsRegistry filterVariantsRegistry;
    private final FontDirectoryResolver fontDirectoryResolver;
    private final Counter requestCounter;
    private final Counter failureCounter;
    private final Counter skippedSegmentCounter;

    public DefaultTimelineCompilationService(
            InputCataloger inputCataloger,
            TimelineBuilder timelineBuilder,
            DimensionNegotiator dimensionNegotiator,
            FilterGraphCompiler filterGraphCompiler,
            CommandAssembler commandAssembler,
            CapabilityCache capabilityCache,
            HardwareProfileSelector hardwareProfileSelector,
            FilterVariantsRegistry filterVariantsRegistry,
            FontDirectoryResolver fontDirectoryResolver,
            MeterRegistry meterRegistry) {
        this.inputCataloger = inputCataloger;
        this.timelineBuilder = timelineBuilder;
        this.dimensionNegotiator = dimensionNegotiator;
        this.filterGraphCompiler = filterGraphCompiler;
        this.commandAssembler = commandAssembler;
        this.capabilityCache = capabilityCache;
        this.hardwareProfileSelector = hardwareProfileSelector;
        this.filterVariantsRegistry = filterVariantsRegistry;
        this.fontDirectoryResolver = fontDirectoryResolver;
        this.requestCounter = meterRegistry.counter("timeline.compile.requests");
        this.failureCounter = meterRegistry.counter("timeline.compile.failures");
        this.skippedSegmentCounter = meterRegistry.counter("timeline.compile.skipped.segments");
    }

    @Override
    public CompiledCommand compile(List<TrackDescriptor> tracks, ExportJob job) {
        requestCounter.increment();
        try {
            requireAssets(tracks, job);
            List<Path> fontDirectories = job.hasSubtitles()
                    ? fontDirectoryResolver.resolve(job.fontFamilies())
                    : List.of();

            CatalogedInputs inputs = inputCataloger.catalog(tracks);
            LayeredTimeline timelines = timelineBuilder.build(tracks, job.frameRate());
            CanvasPlan plan = dimensionNegotiator.negotiate(timelines, job);

            HardwareProfile hardware = hardwareProfileSelector.select(capabilitiesFor(job), job);
            FilterVariants variants = filterVariantsRegistry.forProfile(hardware);

            CompiledGraph graph = filterGraphCompiler.compile(timelines, inputs, plan, job, variants, fontDirectories);
            List<String> argv = commandAssembler.assemble(inputs, graph, job, hardware);

            if (graph.skippedSegments() > 0) {
                skippedSegmentCounter.increment(graph.skippedSegments());
            }
            String videoCodec = hardware.codecFor(job.preferHevc());
            logger.info("Compiled {} tracks into {} arguments using {}", tracks.size(), argv.size(), videoCodec);
            return new CompiledCommand(argv, graph, plan, hardware, videoCodec, timelines.totalDuration());
        } catch (RuntimeException ex) {
            failureCounter.increment();
            throw ex;
        }
    }

    @Override
    public HardwareCapabilities hardwareCapabilities() {
        return capabilityCache.get();
    }

    @Override
    public HardwareCapabilities refreshHardwareCapabilities() {
        capabilityCache.invalidate();
        return capabilityCache.get();
    }

    /**
     * Jobs that cannot use hardware never trigger detection.
     */
    private HardwareCapabilities capabilitiesFor(ExportJob job) {
        if (!job.hardwareAccelerationEnabled() || job.preferredHardware() == HardwareType.SOFTWARE) {
            return HardwareCapabilities.softwareOnly();
        }
        return capabilityCache.get();
    }

    private void requireAssets(List<TrackDescriptor> tracks, ExportJob job) {
        if (job.hasSubtitles() && !Files.isRegularFile(job.subtitlePath())) {
            throw new MissingAssetException("Subtitle file", job.subtitlePath());
        }
        for (TrackDescriptor track : tracks) {
            if (track.kind() != MediaKind.TEXT || !track.visible()) {
                continue;
            }
            Path fontFile = track.textStyle().fontFile();
            if (fontFile != null && !Files.isRegularFile(fontFile)) {
                throw new MissingAssetException("Font file", fontFile);
            }
        }
    }
}
