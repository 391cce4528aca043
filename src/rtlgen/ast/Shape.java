package rtlgen.ast;

import java.util.Objects;
import rtlgen.util.Bits;

/**
 * Bit width and signedness of a {@link Value}.
 */
public final class Shape {
  private final int width;
  private final boolean signed;

  public Shape(int width, boolean signed) {
    if (width < 0)
      throw new IllegalArgumentException("Width must be non-negative, not " + width);
    this.width = width;
    this.signed = signed;
  }

  public static Shape unsigned(int width) { return new Shape(width, false); }
  public static Shape signed(int width) { return new Shape(width, true); }

  /**
   * Creates the unsigned shape that can hold the values 0 .. count-1.
   * A range of a single value (or none) has width 0.
   * @param count the number of distinct values
   * @return the shape
   */
  public static Shape forRange(int count) {
    if (count <= 1)
      return unsigned(0);
    return unsigned(Bits.bitsFor(count - 1));
  }

  public int getWidth() { return width; }
  public boolean isSigned() { return signed; }

  @Override
  public int hashCode() {
    return Objects.hash(width, signed);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Shape other = (Shape)obj;
    return width == other.width && signed == other.signed;
  }
  @Override
  public String toString() {
    return (signed ? "signed(" : "unsigned(") + width + ")";
  }
}
