package rtlgen.util;

/**
 * Utility methods for bit-width computations.
 */
public class Bits {
  private Bits() {}

  /**
   * Computes ceil(log2(n)) for n &gt;= 0, with log2Ceil(0) == 0.
   * @param n the non-negative value
   * @return the number of bits required to index n distinct values
   */
  public static int log2Ceil(long n) {
    if (n < 0)
      throw new IllegalArgumentException("log2Ceil of negative value " + n);
    if (n <= 1)
      return 0;
    return 64 - Long.numberOfLeadingZeros(n - 1);
  }

  /** @see #bitsFor(long, boolean) */
  public static int bitsFor(long n) { return bitsFor(n, false); }

  /**
   * Computes the minimum number of bits required to represent n.
   * Negative values and zero always require a sign bit, i.e. bitsFor(0) == 1 and bitsFor(-1) == 1.
   * @param n the value to represent
   * @param requireSignBit true iff the representation has to include a sign bit for non-negative n
   * @return the bit count
   */
  public static int bitsFor(long n, boolean requireSignBit) {
    int r;
    if (n == Long.MAX_VALUE) {
      r = 63;
    } else if (n > 0) {
      r = log2Ceil(n + 1);
    } else {
      requireSignBit = true;
      // -n overflows for Long.MIN_VALUE; it needs all 64 bits.
      if (n == Long.MIN_VALUE)
        return 64;
      r = log2Ceil(-n);
    }
    if (requireSignBit)
      r += 1;
    return r;
  }

  /**
   * Formats the low bits of a value as a binary string (MSB first).
   * @param value the value
   * @param width the number of bits to output
   * @return the binary string of length width
   */
  public static String toBinaryString(long value, int width) {
    StringBuilder sb = new StringBuilder(width);
    for (int i = width - 1; i >= 0; --i) {
      boolean bit = i < 64 ? ((value >>> i) & 1) != 0 : value < 0;
      sb.append(bit ? '1' : '0');
    }
    return sb.toString();
  }
}
