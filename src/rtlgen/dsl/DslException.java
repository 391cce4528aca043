package rtlgen.dsl;

/**
 * Base class of all errors in a procedural hardware description. These are input errors of the description, not transient failures.
 */
public class DslException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public DslException(String message) { super(message); }
  public DslException(String message, Throwable cause) { super(message, cause); }
}
