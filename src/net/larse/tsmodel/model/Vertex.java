package net.larse.tsmodel.model;

/** A breakpoint of a piecewise-linear trajectory: a year and the fitted value at that year. */
public final class Vertex {
  private final int year;
  private final double fittedValue;

  public Vertex(int year, double fittedValue) {
    this.year = year;
    this.fittedValue = fittedValue;
  }

  public int year() {
    return year;
  }

  public double fittedValue() {
    return fittedValue;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Vertex)) {
      return false;
    }
    Vertex that = (Vertex) o;
    return year == that.year && Double.compare(fittedValue, that.fittedValue) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * year + Double.hashCode(fittedValue);
  }

  @Override
  public String toString() {
    return "(" + year + ", " + fittedValue + ")";
  }
}
