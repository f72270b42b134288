package github.sarthakdev143.timeline_compiler.graph;

import github.sarthakdev143.timeline_compiler.model.Canvas;
import github.sarthakdev143.timeline_compiler.model.Segment;
import github.sarthakdev143.timeline_compiler.model.TextAlign;
import github.sarthakdev143.timeline_compiler.model.TextStyle;
import github.sarthakdev143.timeline_compiler.model.TrackDescriptor;
import github.sarthakdev143.timeline_compiler.model.Transform;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds one {@code drawtext} filter per text clip.
 */
@Component
public class DrawtextFilterFactory {

    private static final double CENTER_TOLERANCE = 0.01;

    public String build(Segment segment, Canvas canvas) {
        TrackDescriptor track = segment.source();
        TextStyle style = track.textStyle();
        Transform transform = track.transform();

        List<String> params = new ArrayList<>();
        params.add("text='" + FilterText.escapeDrawText(style.textCase().apply(track.textContent())) + "'");
        if (style.fontFile() != null) {
            params.add("fontfile='" + FilterText.escapePath(style.fontFile()) + "'");
        } else {
            params.add("font='" + primaryFamily(style.fontFamily()) + "'");
        }
        params.add("fontsize=" + Math.max(1, Math.round(style.fontSize() * transform.scale())));
        params.add("fontcolor=" + FilterText.color(style.color()));
        addPosition(params, transform, style.align(), canvas);

        if (style.strokeColor() != null && !style.strokeColor().isBlank()) {
            params.add("borderw=2");
            params.add("bordercolor=" + FilterText.color(style.strokeColor()));
        }
        if (style.shadow()) {
            params.add("shadowx=2");
            params.add("shadowy=2");
            params.add("shadowcolor=0x000000");
        }
        if (style.backgroundColor() != null
                && !style.backgroundColor().isBlank()
                && !"transparent".equalsIgnoreCase(style.backgroundColor().trim())) {
            params.add("box=1");
            params.add("boxcolor=" + FilterText.color(style.backgroundColor()));
            params.add("boxborderw=5");
        }
        params.add(FilterText.enableBetween(segment.startTime(), segment.endTime()));
        return "drawtext=" + String.join(":", params);
    }

    private void addPosition(List<String> params, Transform transform, TextAlign align, Canvas canvas) {
        if (!transform.hasPosition()) {
            params.add("x=(w-text_w)/2");
            params.add("y=(h-text_h)/2");
            return;
        }

        // editor coordinates are [-1, 1]; drawtext placement works in [0, 1]
        double normalizedX = (transform.x() + 1.0) / 2.0;
        double normalizedY = (transform.y() + 1.0) / 2.0;

        switch (align) {
            case CENTER -> {
                long offset = Math.round((normalizedX - 0.5) * canvas.width());
                params.add(offset == 0 ? "x=(w-text_w)/2" : "x=(w-text_w)/2" + signed(offset));
            }
            case RIGHT -> params.add("x=w-text_w-" + Math.round((1.0 - normalizedX) * canvas.width()));
            case LEFT -> params.add("x=" + Math.round(normalizedX * canvas.width()));
        }

        if (Math.abs(normalizedY - 0.5) < CENTER_TOLERANCE) {
            params.add("y=(h-text_h)/2");
        } else {
            params.add("y=(h-text_h)/2" + signed(Math.round((normalizedY - 0.5) * canvas.height())));
        }
    }

    private static String signed(long value) {
        return value >= 0 ? "+" + value : String.valueOf(value);
    }

    private static String primaryFamily(String fontFamily) {
        if (fontFamily == null || fontFamily.isBlank()) {
            return "Arial";
        }
        String first = fontFamily.split(",")[0].replace("'", "").replace("\"", "").trim();
        return first.isEmpty() ? "Arial" : first.replace(":", "\\:");
    }
}
