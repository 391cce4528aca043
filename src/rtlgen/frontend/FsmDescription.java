package rtlgen.frontend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of a state machine, as read by {@link FsmDescriptionReader}.
 */
public class FsmDescription {

  public static class SignalDesc {
    public String name;
    public int width = 1;
    public boolean signed = false;

    public SignalDesc(String name, int width, boolean signed) {
      this.name = name;
      this.width = width;
      this.signed = signed;
    }
  }

  public static class TransitionDesc {
    /** Name of the condition signal, optionally prefixed by '!' for negation, or null for an unconditional transition. */
    public String when;
    /** Target state. */
    public String to;

    public TransitionDesc(String when, String to) {
      this.when = when;
      this.to = to;
    }
  }

  public static class StateDesc {
    public String name;
    /** Per domain: signal name to assigned value (an integer or another signal name). */
    public Map<String, Map<String, Object>> assignments = new LinkedHashMap<>();
    public List<TransitionDesc> transitions = new ArrayList<>();

    public StateDesc(String name) { this.name = name; }
  }

  public String name = "fsm";
  public String domain = "sync";
  /** The initial state, or null for the first state. */
  public String init = null;
  public List<SignalDesc> signals = new ArrayList<>();
  public List<StateDesc> states = new ArrayList<>();
}
