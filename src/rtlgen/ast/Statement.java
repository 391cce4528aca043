package rtlgen.ast;

import java.util.Set;

/**
 * Base class of all statements.
 */
public abstract class Statement {
  /**
   * Returns the signals written by this statement.
   * @return an ordered set of signals
   */
  public abstract Set<Signal> lhsSignals();
}
