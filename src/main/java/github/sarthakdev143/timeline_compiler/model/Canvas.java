package github.sarthakdev143.timeline_compiler.model;

public record Canvas(int width, int height) {

    public Canvas {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Canvas dimensions must be positive, got " + width + "x" + height + ".");
        }
    }

    public double ratio() {
        return (double) width / height;
    }

    public boolean isPortrait() {
        return ratio() < 1.0;
    }

    public boolean isLandscape() {
        return ratio() > 1.0;
    }

    public String sizeExpression() {
        return width + "x" + height;
    }
}
