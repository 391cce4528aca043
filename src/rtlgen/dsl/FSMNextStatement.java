package rtlgen.dsl;

import rtlgen.ast.LateBoundStatement;
import rtlgen.ast.Statement;

/**
 * A transition to an FSM state. Resolves to an assignment of the state register once the encoding is fixed.
 */
public class FSMNextStatement extends LateBoundStatement {
  private final FSMFrame fsm;
  private final String state;

  FSMNextStatement(FSMFrame fsm, String state) {
    this.fsm = fsm;
    this.state = state;
  }

  public String getState() { return state; }

  @Override
  public Statement resolve() {
    if (!fsm.isClosed())
      throw new IllegalStateException("Transition to '" + state + "' cannot be resolved before FSM '" + fsm.getFsmName() + "' is complete");
    return fsm.getSignal().eq(fsm.getEncoding().get(state));
  }

  @Override
  public String toString() {
    return "(next " + fsm.getFsmName() + " " + state + ")";
  }
}
