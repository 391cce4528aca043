package rtlgen.dsl;

/**
 * A construct was used outside of the construct it belongs to, e.g. Elif without If or Case outside of Switch.
 */
public class ScopeException extends DslException {
  private static final long serialVersionUID = 1L;

  public ScopeException(String message) { super(message); }
}
