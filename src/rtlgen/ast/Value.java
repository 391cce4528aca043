package rtlgen.ast;

import java.util.List;
import java.util.Set;

/**
 * Base class of the expression algebra. Values are compared by identity.
 */
public abstract class Value {

  /**
   * Returns the bit width and signedness of this value.
   * @return the shape
   */
  public abstract Shape shape();

  public int width() { return shape().getWidth(); }

  /**
   * Builds a 1-bit reduction that is true iff any bit of this value is set.
   * @return the reduction operator
   */
  public Operator bool() { return new Operator("b", List.of(this)); }

  /** Builds a bitwise inversion of this value. */
  public Operator not() { return new Operator("~", List.of(this)); }

  /**
   * Builds a 1-bit equality comparison.
   * @param other a Value or an object castable with {@link Value#cast(Object)}
   * @return the comparison operator
   */
  public Operator equalTo(Object other) { return new Operator("==", List.of(this, Value.cast(other))); }

  /**
   * Builds an assignment statement with this value as the target.
   * @param rhs a Value or an object castable with {@link Value#cast(Object)}
   * @return the assignment
   */
  public Assign eq(Object rhs) { return new Assign(this, Value.cast(rhs)); }

  /**
   * Returns the signals written if this value is the target of an assignment.
   * @return the ordered set of signals
   * @throws IllegalArgumentException if the value cannot be assigned to
   */
  public Set<Signal> lhsSignals() {
    throw new IllegalArgumentException("Value " + this + " cannot be used in assignments");
  }

  /**
   * Converts an object into a Value.
   * Values are returned as-is, integers and booleans become a {@link Const}.
   * @param obj the object to convert
   * @return the value
   * @throws IllegalArgumentException if obj has no Value representation
   */
  public static Value cast(Object obj) {
    if (obj instanceof Value)
      return (Value)obj;
    if (obj instanceof Integer || obj instanceof Long || obj instanceof Short || obj instanceof Byte || obj instanceof Boolean)
      return Const.cast(obj);
    throw new IllegalArgumentException("Object " + obj + " cannot be converted to a value");
  }
}
