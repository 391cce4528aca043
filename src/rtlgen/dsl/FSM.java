package rtlgen.dsl;

import java.util.Map;
import rtlgen.ast.Signal;

/**
 * Handle to a state machine created by {@link Module#FSM(String, String, String, java.util.function.Consumer)}.
 * Also registered as a generated object of the elaborated fragment under the FSM name.
 */
public class FSM {
  private final FSMFrame frame;

  FSM(FSMFrame frame) { this.frame = frame; }

  public String getName() { return frame.getFsmName(); }

  /** The domain that drives the state register. */
  public String getDomain() { return frame.getDomain(); }

  /**
   * Returns a 1-bit signal that is high while the FSM is in the given state. Counts as a reference to the state.
   * The signal is driven from the combinational domain.
   * @param state the state name
   * @return the indicator signal; the same object for every call with the same state
   * @throws DslNameException if the FSM is complete and the state does not exist
   */
  public Signal ongoing(String state) { return frame.reference(state); }

  /**
   * Returns the state register.
   * @return the signal holding the current state encoding
   * @throws IllegalStateException if the FSM is not complete yet
   */
  public Signal getState() {
    if (!frame.isClosed())
      throw new IllegalStateException("The state register of FSM '" + getName() + "' is created once the FSM is complete");
    return frame.getSignal();
  }

  /**
   * Returns the state encodings. Before the FSM is complete, these reflect the reference order and are subject to change.
   * @return a read-only map from state name to encoding
   */
  public Map<String, Integer> getEncoding() { return frame.getEncoding(); }

  /** Returns the map from encoding to state name; empty before the FSM is complete. */
  public Map<Integer, String> getDecoding() { return frame.getDecoding(); }

  public boolean isComplete() { return frame.isClosed(); }

  @Override
  public String toString() {
    return "(fsm " + getName() + " " + getEncoding() + ")";
  }
}
