package github.sarthakdev143.timeline_compiler.graph;

import github.sarthakdev143.timeline_compiler.catalog.CatalogedInputs;
import github.sarthakdev143.timeline_compiler.config.TimelineCompilerProperties;
import github.sarthakdev143.timeline_compiler.dimension.CanvasPlan;
import github.sarthakdev143.timeline_compiler.dimension.CropPolicy;
import github.sarthakdev143.timeline_compiler.exception.TimelineContractException;
import github.sarthakdev143.timeline_compiler.exception.UnresolvableSegmentException;
import github.sarthakdev143.timeline_compiler.hardware.FilterVariants;
import github.sarthakdev143.timeline_compiler.model.Canvas;
import github.sarthakdev143.timeline_compiler.model.ExportJob;
import github.sarthakdev143.timeline_compiler.model.LayeredTimeline;
import github.sarthakdev143.timeline_compiler.model.MediaKind;
import github.sarthakdev143.timeline_compiler.model.Segment;
import github.sarthakdev143.timeline_compiler.model.Timeline;
import github.sarthakdev143.timeline_compiler.model.TrackDescriptor;
import github.sarthakdev143.timeline_compiler.model.Transform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Compiles layered timelines into an FFmpeg filter graph.
 * <p>
 * Video stages run in a fixed order: per-segment normalization, per-layer concatenation, compositing of every
 * overlay item in layer order, aspect crop, final resize, subtitle burn-in. Audio is compiled independently by
 * {@link AudioMixCompiler}.
 */
@Component
public class FilterGraphCompiler {

    static final String VIDEO_OUTPUT = "video";
    static final String UPLOADED_VIDEO_OUTPUT = "video_hw";

    private static final Logger logger = LoggerFactory.getLogger(FilterGraphCompiler.class);
    private static final String TRANSPARENT = "black@0.0";
    private static final double EPSILON = 1e-6;

    private final TimelineCompilerProperties properties;
    private final AudioMixCompiler audioMixCompiler;
    private final DrawtextFilterFactory drawtextFilterFactory;

    public FilterGraphCompiler(
            TimelineCompilerProperties properties,
            AudioMixCompiler audioMixCompiler,
            DrawtextFilterFactory drawtextFilterFactory) {
        this.properties = properties;
        this.audioMixCompiler = audioMixCompiler;
        this.drawtextFilterFactory = drawtextFilterFactory;
    }

    public CompiledGraph compile(
            LayeredTimeline timelines,
            CatalogedInputs inputs,
            CanvasPlan plan,
            ExportJob job,
            FilterVariants variants,
            List<Path> fontDirectories) {
        double totalDuration = timelines.totalDuration();
        if (totalDuration <= EPSILON) {
            throw new TimelineContractException("Timeline has no duration; add at least one placed track, text clip or gap.");
        }

        FilterGraphBuilder graph = new FilterGraphBuilder();
        SkippedSegments skipped = new SkippedSegments();
        Stage stage = new Stage(graph, timelines, inputs, plan, job, variants, skipped);

        GraphLabel current = compileBase(stage, totalDuration);
        for (OverlayItem item : overlayItems(timelines, stage.baseLayer)) {
            current = applyOverlay(stage, current, item);
        }

        if (plan.policy() == CropPolicy.CROP) {
            current = graph.chain(current, "cropped", variants.crop(plan.crop()), "setsar=1");
        }

        if (plan.needsFinalResize()) {
            Canvas desired = plan.desired();
            current = graph.chain(
                    current,
                    "resized",
                    variants.finalResize(desired.width(), desired.height(), properties.getFillColor()),
                    "setsar=1");
        }

        if (job.hasSubtitles()) {
            current = graph.chain(current, "subtitled", subtitleFilter(job.subtitlePath(), fontDirectories), "setsar=1");
        }

        GraphLabel video = graph.promote(current, VIDEO_OUTPUT);
        Optional<String> upload = variants.outputUpload();
        if (upload.isPresent()) {
            GraphLabel uploaded = graph.named(UPLOADED_VIDEO_OUTPUT);
            graph.chainInto(List.of(video), uploaded, List.of(upload.get()));
            video = uploaded;
        }

        GraphLabel audio = audioMixCompiler.compile(graph, timelines, inputs, totalDuration, skipped);

        List<String> stages = graph.render();
        logger.info("Compiled filter graph with {} stages, {} skipped segments", stages.size(), skipped.count());
        return new CompiledGraph(
                stages,
                video.render(),
                audio == null ? null : audio.render(),
                skipped.count());
    }

    private GraphLabel compileBase(Stage stage, double totalDuration) {
        Canvas working = stage.plan.working();
        Timeline baseLayer = stage.baseLayer;
        if (baseLayer == null) {
            logger.info("No base video layer, compositing onto a flat {} canvas of {}s",
                    properties.getFillColor(), FilterText.time(totalDuration));
            return flatClip(stage, "base", working, totalDuration, properties.getFillColor());
        }

        GraphLabel layer = compileVideoLayer(stage, baseLayer, true);
        double layerEnd = baseLayer.totalDuration();
        double remaining = totalDuration - layerEnd;
        if (remaining <= EPSILON) {
            return layer;
        }

        logger.debug("Padding base layer from {}s to {}s", FilterText.time(layerEnd), FilterText.time(totalDuration));
        GraphLabel normalized = stage.graph.chain(layer, "basesar", "setsar=1");
        GraphLabel tail = flatClip(stage, "tail", working, remaining, properties.getFillColor());
        return stage.graph.chain(List.of(normalized, tail), "base", List.of("concat=n=2:v=1:a=0"));
    }

    /**
     * Normalizes and concatenates one video layer. Hidden and unresolvable segments are replaced by a gap clip of
     * the same length so later segments keep their timing.
     */
    private GraphLabel compileVideoLayer(Stage stage, Timeline timeline, boolean base) {
        FilterGraphBuilder graph = stage.graph;
        Canvas working = stage.plan.working();
        String gapColor = padColor(base);

        List<GraphLabel> parts = new ArrayList<>();
        for (Segment segment : timeline.segments()) {
            if (segment.isGap()) {
                parts.add(flatClip(stage, "gap", working, segment.duration(), gapColor));
                continue;
            }
            if (!segment.source().visible()) {
                parts.add(flatClip(stage, "hidden", working, segment.duration(), gapColor));
                continue;
            }
            Optional<Integer> inputIndex = stage.resolve(segment);
            if (inputIndex.isEmpty()) {
                parts.add(flatClip(stage, "gap", working, segment.duration(), gapColor));
                continue;
            }
            parts.add(normalizeVideoSegment(stage, segment, inputIndex.get(), base));
        }

        GraphLabel joined = parts.size() == 1
                ? parts.get(0)
                : graph.chain(parts, "layer", List.of("concat=n=" + parts.size() + ":v=1:a=0"));
        if (stage.job.normalizeFrameRate()) {
            joined = graph.chain(joined, "fps", "fps=" + FilterText.time(stage.timelines.fps()) + ":start_time=0");
        }
        return joined;
    }

    private GraphLabel normalizeVideoSegment(Stage stage, Segment segment, int inputIndex, boolean base) {
        TrackDescriptor track = segment.source();
        Canvas working = stage.plan.working();
        Transform transform = stage.plan.effectiveTransform(track);
        FilterVariants variants = stage.variants;
        if (transform.isNonZero()) {
            return placeOnBackground(stage, segment, inputIndex, transform, base);
        }

        List<String> filters = new ArrayList<>();
        filters.add(trim(segment));
        filters.add("setpts=PTS-STARTPTS");
        boolean needsScale = !track.hasDeclaredSize()
                || track.width() != working.width()
                || track.height() != working.height();
        if (!base) {
            // upper layers keep alpha so the padding stays see-through
            filters.add("format=yuva420p");
        }
        if (needsScale) {
            filters.add(variants.scaleAndPad(working.width(), working.height(), padColor(base)));
        }
        filters.add("setsar=1");
        return stage.graph.chain(List.of(stage.graph.videoInput(inputIndex)), "seg", filters);
    }

    /**
     * Renders a moved or scaled clip onto its own canvas-sized background so the layer keeps a uniform size.
     */
    private GraphLabel placeOnBackground(Stage stage, Segment segment, int inputIndex, Transform transform, boolean base) {
        FilterGraphBuilder graph = stage.graph;
        FilterVariants variants = stage.variants;
        Canvas working = stage.plan.working();
        GraphLabel background = flatClip(stage, "bg", working, segment.duration(), padColor(base));

        List<String> foreground = new ArrayList<>();
        foreground.add(trim(segment));
        foreground.add("setpts=PTS-STARTPTS");
        if (!base) {
            foreground.add("format=yuva420p");
        }
        foreground.add(variants.scaleAndPad(working.width(), working.height(), padColor(base)));
        if (transform.hasScale()) {
            foreground.add(variants.scaleToFit(
                    scaled(working.width(), transform.scale()),
                    scaled(working.height(), transform.scale())));
        }
        foreground.add("setsar=1");
        GraphLabel clip = graph.chain(List.of(graph.videoInput(inputIndex)), "fg", foreground);

        return graph.chain(List.of(background, clip), "placed", List.of(
                variants.overlay(
                        FilterText.centeredOffset("W", "w", transform.x()),
                        FilterText.centeredOffset("H", "h", transform.y()),
                        null),
                "setsar=1"));
    }

    private GraphLabel applyOverlay(Stage stage, GraphLabel current, OverlayItem item) {
        return switch (item.kind()) {
            case VIDEO -> overlayVideoLayer(stage, current, item.timeline());
            case IMAGE -> overlayImage(stage, current, item.segment());
            case TEXT -> stage.graph.chain(current, "text", drawtextFilterFactory.build(item.segment(), stage.plan.working()));
            default -> throw new IllegalStateException("Unexpected overlay kind " + item.kind());
        };
    }

    private GraphLabel overlayVideoLayer(Stage stage, GraphLabel current, Timeline timeline) {
        if (!timeline.hasMedia()) {
            return current;
        }
        FilterGraphBuilder graph = stage.graph;
        GraphLabel layer = compileVideoLayer(stage, timeline, false);
        double start = timeline.firstStart();
        double end = timeline.totalDuration();
        if (start > EPSILON) {
            layer = graph.chain(layer, "shifted", "tpad=start_duration=" + FilterText.time(start)
                    + ":start_mode=add:color=" + TRANSPARENT);
        }
        return graph.chain(List.of(current, layer), "comp", List.of(
                stage.variants.overlay("(W-w)/2", "(H-h)/2", FilterText.enableBetween(start, end))));
    }

    private GraphLabel overlayImage(Stage stage, GraphLabel current, Segment segment) {
        if (!segment.source().visible()) {
            return current;
        }
        Optional<Integer> inputIndex = stage.resolve(segment);
        if (inputIndex.isEmpty()) {
            return current;
        }
        FilterGraphBuilder graph = stage.graph;
        Canvas working = stage.plan.working();
        Transform transform = stage.plan.effectiveTransform(segment.source());

        List<String> filters = new ArrayList<>();
        filters.add("trim=duration=" + FilterText.time(segment.duration()));
        filters.add("setsar=1");
        if (segment.startTime() > EPSILON) {
            filters.add("tpad=start_duration=" + FilterText.time(segment.startTime())
                    + ":start_mode=add:color=" + TRANSPARENT);
        }
        filters.add(stage.variants.scaleToFit(
                scaled(working.width(), transform.scale()),
                scaled(working.height(), transform.scale())));
        if (transform.hasRotation()) {
            String radians = FilterText.time(Math.toRadians(transform.rotation()));
            filters.add("format=rgba");
            filters.add("rotate=" + radians + ":ow=rotw(" + radians + "):oh=roth(" + radians + "):c=none");
        }
        GraphLabel prepared = graph.chain(List.of(graph.videoInput(inputIndex.get())), "img", filters);

        return graph.chain(List.of(current, prepared), "comp", List.of(stage.variants.overlay(
                FilterText.centeredOffset("W", "w", transform.x()),
                FilterText.centeredOffset("H", "h", transform.y()),
                FilterText.enableBetween(segment.startTime(), segment.endTime()))));
    }

    String subtitleFilter(Path subtitlePath, List<Path> fontDirectories) {
        String filter = "subtitles='" + FilterText.escapePath(subtitlePath) + "'";
        if (fontDirectories != null && !fontDirectories.isEmpty()) {
            filter += ":fontsdir='" + FilterText.escapeFontDirectories(fontDirectories) + "'";
        }
        return filter;
    }

    /**
     * Overlay items in the order they are composited: by layer, and within a layer video before images before text.
     */
    List<OverlayItem> overlayItems(LayeredTimeline timelines, Timeline baseLayer) {
        List<OverlayItem> items = new ArrayList<>();
        for (Timeline timeline : timelines.byMedium(MediaKind.VIDEO)) {
            if (timeline != baseLayer) {
                items.add(new OverlayItem(timeline.key().layer(), MediaKind.VIDEO, timeline.firstStart(), timeline, null));
            }
        }
        for (Timeline timeline : timelines.byMedium(MediaKind.IMAGE)) {
            for (Segment segment : timeline.segments()) {
                items.add(new OverlayItem(timeline.key().layer(), MediaKind.IMAGE, segment.startTime(), null, segment));
            }
        }
        for (Segment segment : timelines.textSegments()) {
            items.add(new OverlayItem(segment.source().layer(), MediaKind.TEXT, segment.startTime(), null, segment));
        }
        items.sort(Comparator.comparingInt(OverlayItem::layer)
                .thenComparing(OverlayItem::kind)
                .thenComparingDouble(OverlayItem::start));
        return items;
    }

    private GraphLabel flatClip(Stage stage, String hint, Canvas canvas, double duration, String color) {
        List<String> filters = new ArrayList<>();
        filters.add("color=" + color + ":size=" + canvas.sizeExpression()
                + ":duration=" + FilterText.time(duration)
                + ":rate=" + FilterText.time(stage.timelines.fps()));
        if (TRANSPARENT.equals(color)) {
            filters.add("format=yuva420p");
        }
        filters.add("setpts=PTS-STARTPTS");
        filters.add("setsar=1");
        return stage.graph.chain(List.of(), hint, filters);
    }

    private String padColor(boolean base) {
        return base ? properties.getFillColor() : TRANSPARENT;
    }

    private static String trim(Segment segment) {
        return "trim=start=" + FilterText.time(segment.sourceStart()) + ":duration=" + FilterText.time(segment.duration());
    }

    private static int scaled(int dimension, double factor) {
        return Math.max(1, (int) Math.round(dimension * factor));
    }

    record OverlayItem(int layer, MediaKind kind, double start, Timeline timeline, Segment segment) {
    }

    /**
     * Per-compilation state handed through the stage methods.
     */
    private final class Stage {

        private final FilterGraphBuilder graph;
        private final LayeredTimeline timelines;
        private final CatalogedInputs inputs;
        private final CanvasPlan plan;
        private final ExportJob job;
        private final FilterVariants variants;
        private final SkippedSegments skipped;
        private final Timeline baseLayer;

        private Stage(
                FilterGraphBuilder graph,
                LayeredTimeline timelines,
                CatalogedInputs inputs,
                CanvasPlan plan,
                ExportJob job,
                FilterVariants variants,
                SkippedSegments skipped) {
            this.graph = graph;
            this.timelines = timelines;
            this.inputs = inputs;
            this.plan = plan;
            this.job = job;
            this.variants = variants;
            this.skipped = skipped;
            this.baseLayer = baseLayer(timelines);
        }

        private Optional<Integer> resolve(Segment segment) {
            try {
                return Optional.of(inputs.indexFor(segment));
            } catch (UnresolvableSegmentException ex) {
                logger.warn("Skipping {} segment: {}", segment.medium(), ex.getMessage());
                skipped.record(segment);
                return Optional.empty();
            }
        }
    }

    /**
     * The lowest video layer, unless an image layer sits below it or it has no media at all.
     */
    private static Timeline baseLayer(LayeredTimeline timelines) {
        List<Timeline> videoLayers = timelines.byMedium(MediaKind.VIDEO);
        if (videoLayers.isEmpty()) {
            return null;
        }
        Timeline lowestVideo = videoLayers.get(0);
        if (!lowestVideo.hasMedia()) {
            return null;
        }
        for (Timeline imageLayer : timelines.byMedium(MediaKind.IMAGE)) {
            if (imageLayer.key().layer() < lowestVideo.key().layer()) {
                return null;
            }
        }
        return lowestVideo;
    }
}
