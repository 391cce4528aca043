package rtlgen.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Bit concatenation. The first part occupies the least significant bits.
 */
public final class Cat extends Value {
  private final List<Value> parts;

  public Cat(Collection<? extends Value> parts) { this.parts = new ArrayList<>(parts); }
  public Cat(Value... parts) { this(List.of(parts)); }

  public List<Value> getParts() { return Collections.unmodifiableList(parts); }

  @Override
  public Shape shape() {
    return Shape.unsigned(parts.stream().mapToInt(Value::width).sum());
  }

  @Override
  public Set<Signal> lhsSignals() {
    Set<Signal> ret = new LinkedHashSet<>();
    for (Value part : parts)
      ret.addAll(part.lhsSignals());
    return ret;
  }

  @Override
  public String toString() {
    return "(cat " + parts.stream().map(Object::toString).collect(Collectors.joining(" ")) + ")";
  }
}
