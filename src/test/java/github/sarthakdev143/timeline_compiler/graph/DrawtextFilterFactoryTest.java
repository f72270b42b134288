package github.sarthakdev143.timeline_compiler.graph;

import github.sarthakdev143.timeline_compiler.model.Canvas;
import github.sarthakdev143.timeline_compiler.model.Segment;
import github.sarthakdev143.timeline_compiler.model.TextAlign;
import github.sarthakdev143.timeline_compiler.model.TextCase;
import github.sarthakdev143.timeline_compiler.model.TextStyle;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static github.sarthakdev143.timeline_compiler.TrackFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;

class DrawtextFilterFactoryTest {

    private static final Canvas CANVAS = new Canvas(1920, 1080);

    private final DrawtextFilterFactory factory = new DrawtextFilterFactory();

    @Test
    void defaultStyleIsCenteredAndEscaped() {
        Segment segment = Segment.of(text(0, "It's 50%: done", 0, 60).build(), 30);

        assertThat(factory.build(segment, CANVAS)).isEqualTo(
                "drawtext=text='It\\'s 50\\%\\: done':font='Arial':fontsize=40:fontcolor=0xFFFFFF"
                        + ":x=(w-text_w)/2:y=(h-text_h)/2:enable='between(t,0.000,2.000)'");
    }

    @Test
    void styledTextCarriesPositionStrokeShadowAndBox() {
        TextStyle style = new TextStyle(
                "Open Sans, sans-serif", null, 30, "rgb(255, 0, 0)", "#000", "#112233", true,
                TextAlign.LEFT, TextCase.UPPERCASE);
        Segment segment = Segment.of(
                text(0, "breaking news", 30, 90).transform(-0.5, 0.5, 2.0, 0.0).style(style).build(), 30);

        String filter = factory.build(segment, CANVAS);

        assertThat(filter).startsWith("drawtext=text='BREAKING NEWS':font='Open Sans':fontsize=60:fontcolor=0xFF0000");
        assertThat(filter).contains(":x=480:y=(h-text_h)/2+270");
        assertThat(filter).contains(":borderw=2:bordercolor=0x000000");
        assertThat(filter).contains(":shadowx=2:shadowy=2:shadowcolor=0x000000");
        assertThat(filter).contains(":box=1:boxcolor=0x112233:boxborderw=5");
        assertThat(filter).endsWith(":enable='between(t,1.000,3.000)'");
    }

    @Test
    void rightAlignedTextMeasuresFromTheRightEdge() {
        TextStyle style = new TextStyle(null, null, 0, null, null, "transparent", false, TextAlign.RIGHT, null);
        Segment segment = Segment.of(text(0, "Credits", 0, 30).transform(1.0, 0.0, 1.0, 0.0).style(style).build(), 30);

        String filter = factory.build(segment, CANVAS);

        assertThat(filter).contains(":x=w-text_w-0:y=(h-text_h)/2");
        assertThat(filter).doesNotContain("box=1");
    }

    @Test
    void fontFileWinsOverFamily() {
        TextStyle style = new TextStyle(
                "Roboto", Path.of("/fonts/Roboto-Bold.ttf"), 40, "#fff", null, null, false, TextAlign.CENTER, TextCase.NONE);
        Segment segment = Segment.of(text(0, "Hi", 0, 30).style(style).build(), 30);

        assertThat(factory.build(segment, CANVAS))
                .contains("fontfile='/fonts/Roboto-Bold.ttf'")
                .doesNotContain("font='Roboto'");
    }
}
