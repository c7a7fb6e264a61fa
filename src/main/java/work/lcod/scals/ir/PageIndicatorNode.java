package work.lcod.scals.ir;

public record PageIndicatorNode(
    String id,
    String currentPageBinding,
    int currentPage,
    int pageCount,
    double dotSize,
    double dotSpacing,
    Color dotColor,
    Color currentDotColor,
    EdgeInsets padding
) implements RenderNode {
    public static final String KIND = "pageIndicator";

    @Override
    public String kind() {
        return KIND;
    }
}
