package rtlgen.ast;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.LongFunction;

/**
 * A named, assignable value.
 */
public class Signal extends Value {
  private final Shape shape;
  private final String name;
  private final long init;
  private final LongFunction<String> decoder;

  /** Creates a 1-bit signal. */
  public Signal(String name) { this(Shape.unsigned(1), name); }

  public Signal(int width, String name) { this(Shape.unsigned(width), name); }

  public Signal(Shape shape, String name) { this(shape, name, 0, null); }

  /**
   * @param shape the shape of the signal
   * @param name the signal name
   * @param init the value of the signal after reset
   * @param decoder converts a value of the signal into a human-readable string, or null
   */
  public Signal(Shape shape, String name, long init, LongFunction<String> decoder) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Signal name must not be empty");
    this.shape = shape;
    this.name = name;
    this.init = init;
    this.decoder = decoder;
  }

  public String getName() { return name; }
  public long getInit() { return init; }

  /**
   * Renders a value of this signal, using the decoder if present.
   * @param value the value to render
   * @return the human-readable string
   */
  public String decode(long value) {
    if (decoder != null)
      return decoder.apply(value);
    return Long.toString(value);
  }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public Set<Signal> lhsSignals() {
    Set<Signal> ret = new LinkedHashSet<>();
    ret.add(this);
    return ret;
  }

  @Override
  public String toString() {
    return "(sig " + name + ")";
  }
}
