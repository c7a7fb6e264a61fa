package work.lcod.scals.ir;

public record Border(Color color, double width) {}
