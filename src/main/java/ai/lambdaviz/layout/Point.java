package ai.lambdaviz.layout;

public record Point(double x, double y) {
  public Point shifted(final double dx, final double dy) {
    return new Point(x + dx, y + dy);
  }
}
