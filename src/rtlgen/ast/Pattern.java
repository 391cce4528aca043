package rtlgen.ast;

import java.util.Objects;
import rtlgen.util.Bits;

/**
 * A case pattern: either a bit string over {0,1,-} (MSB first, '-' = don't care) or an integer constant.
 */
public final class Pattern {
  private final String bits;
  private final long value;

  private Pattern(String bits, long value) {
    this.bits = bits;
    this.value = value;
  }

  /**
   * Creates a bit-string pattern. Whitespace is ignored.
   * @param pattern the bit string
   * @return the pattern
   * @throws IllegalArgumentException if the string contains characters other than 0, 1, - and whitespace
   */
  public static Pattern ofBits(String pattern) {
    StringBuilder sb = new StringBuilder();
    for (char c : pattern.toCharArray()) {
      if (c == '0' || c == '1' || c == '-')
        sb.append(c);
      else if (!Character.isWhitespace(c))
        throw new IllegalArgumentException("Pattern '" + pattern + "' must consist of 0, 1 and - bits");
    }
    return new Pattern(sb.toString(), 0);
  }

  public static Pattern ofValue(long value) { return new Pattern(null, value); }

  public boolean isBits() { return bits != null; }

  /** Returns the bit string, without whitespace. Only valid if {@link #isBits()}. */
  public String getBits() {
    if (bits == null)
      throw new IllegalStateException("Pattern " + this + " is not a bit pattern");
    return bits;
  }

  /** Returns the constant value. Only valid if !{@link #isBits()}. */
  public long getValue() {
    if (bits != null)
      throw new IllegalStateException("Pattern " + this + " is not a value pattern");
    return value;
  }

  /**
   * Renders the pattern as a bit string of the given width.
   * @param width the width of the switch test
   * @return the bit string (MSB first)
   */
  public String toBits(int width) {
    if (bits != null) {
      if (bits.length() != width)
        throw new IllegalArgumentException("Pattern '" + bits + "' does not have width " + width);
      return bits;
    }
    return Bits.toBinaryString(value, width);
  }

  /**
   * Tests if the pattern matches a value of a test expression with the given width.
   * @param testValue the value of the test expression
   * @param width the width of the test expression
   * @return true iff the pattern matches
   */
  public boolean matches(long testValue, int width) {
    String patternBits = toBits(width);
    String valueBits = Bits.toBinaryString(testValue, width);
    for (int i = 0; i < width; ++i) {
      char p = patternBits.charAt(i);
      if (p != '-' && p != valueBits.charAt(i))
        return false;
    }
    return true;
  }

  @Override
  public int hashCode() {
    return Objects.hash(bits, value);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Pattern other = (Pattern)obj;
    return Objects.equals(bits, other.bits) && (bits != null || value == other.value);
  }
  @Override
  public String toString() {
    return bits != null ? bits : Long.toString(value);
  }
}
