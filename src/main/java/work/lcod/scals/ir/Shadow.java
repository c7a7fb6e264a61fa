package work.lcod.scals.ir;

public record Shadow(Color color, double radius, double x, double y) {}
