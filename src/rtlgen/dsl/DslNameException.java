package rtlgen.dsl;

/**
 * A name is defined twice (submodules, clock domains, FSM states), or referenced without being defined.
 */
public class DslNameException extends DslException {
  private static final long serialVersionUID = 1L;

  public DslNameException(String message) { super(message); }
}
