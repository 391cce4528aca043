package rtlgen.ast;

import rtlgen.util.Bits;

/**
 * A constant value with a fixed shape.
 */
public final class Const extends Value {
  private final long value;
  private final Shape shape;

  /**
   * Creates a constant of the minimal shape able to hold value.
   * @param value the constant
   */
  public Const(long value) { this(value, value < 0 ? Shape.signed(Bits.bitsFor(value)) : Shape.unsigned(Bits.bitsFor(value))); }

  /**
   * Creates a constant of a given shape; value is truncated (and sign-extended for signed shapes) to the shape.
   * @param value the constant
   * @param shape the shape
   */
  public Const(long value, Shape shape) {
    this.shape = shape;
    this.value = normalize(value, shape);
  }

  private static long normalize(long value, Shape shape) {
    int width = shape.getWidth();
    if (width >= 64)
      return value;
    if (width == 0)
      return 0;
    long mask = (1L << width) - 1;
    value &= mask;
    if (shape.isSigned() && ((value >>> (width - 1)) & 1) != 0)
      value |= ~mask;
    return value;
  }

  public long getValue() { return value; }

  @Override
  public Shape shape() {
    return shape;
  }

  /**
   * Converts an object into a constant.
   * Accepts constants, integers, booleans and concatenations of constant-castable values.
   * @param obj the object to convert
   * @return the constant
   * @throws IllegalArgumentException if obj is not constant-castable
   */
  public static Const cast(Object obj) {
    if (obj instanceof Const)
      return (Const)obj;
    if (obj instanceof Boolean)
      return new Const((Boolean)obj ? 1 : 0, Shape.unsigned(1));
    if (obj instanceof Integer || obj instanceof Long || obj instanceof Short || obj instanceof Byte)
      return new Const(((Number)obj).longValue());
    if (obj instanceof Cat) {
      long result = 0;
      int offset = 0;
      for (Value part : ((Cat)obj).getParts()) {
        Const partConst = Const.cast(part);
        int partWidth = partConst.width();
        if (offset < 64) {
          long partBits = partWidth >= 64 ? partConst.value : partConst.value & ((1L << partWidth) - 1);
          result |= partBits << offset;
        }
        offset += partWidth;
      }
      return new Const(result, Shape.unsigned(offset));
    }
    throw new IllegalArgumentException("Object " + obj + " cannot be converted to a constant");
  }

  @Override
  public String toString() {
    return String.format("(const %d'%s%d)", shape.getWidth(), shape.isSigned() ? "sd" : "d", value);
  }
}
