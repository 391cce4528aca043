package rtlgen.ast;

import java.util.Set;

/**
 * A placeholder statement whose concrete form is only known once the enclosing construct is complete.
 * Must be resolved before it is handed to the IR.
 */
public abstract class LateBoundStatement extends Statement {

  /**
   * Produces the concrete statement. May itself return a LateBoundStatement.
   * @return the resolved statement
   * @throws IllegalStateException if the information required for resolution is not yet available
   */
  public abstract Statement resolve();

  @Override
  public Set<Signal> lhsSignals() {
    return resolve().lhsSignals();
  }
}
