package github.sarthakdev143.timeline_compiler.dimension;

public record CropWindow(int width, int height, int x, int y) {

    public double ratio() {
        return (double) width / height;
    }
}
