package rtlgen.ast;

import java.util.Set;

/**
 * Assignment of an expression to a signal or a concatenation of signals.
 */
public final class Assign extends Statement {
  private final Value target;
  private final Value rhs;

  public Assign(Value target, Value rhs) {
    // Fails early for non-assignable targets such as constants.
    target.lhsSignals();
    this.target = target;
    this.rhs = rhs;
  }

  public Value getTarget() { return target; }
  public Value getRhs() { return rhs; }

  @Override
  public Set<Signal> lhsSignals() {
    return target.lhsSignals();
  }

  @Override
  public String toString() {
    return "(eq " + target + " " + rhs + ")";
  }
}
