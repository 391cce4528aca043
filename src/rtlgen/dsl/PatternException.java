package rtlgen.dsl;

/**
 * A Case pattern is malformed, has the wrong width, or cannot be converted to a constant.
 */
public class PatternException extends DslException {
  private static final long serialVersionUID = 1L;

  public PatternException(String message) { super(message); }
  public PatternException(String message, Throwable cause) { super(message, cause); }
}
