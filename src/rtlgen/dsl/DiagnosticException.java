package rtlgen.dsl;

/**
 * An advisory diagnostic that was turned into an error by {@link rtlgen.ui.RTLGenConfig#diagnostics_as_errors}.
 */
public class DiagnosticException extends DslException {
  private static final long serialVersionUID = 1L;

  private final Diagnostic diagnostic;

  public DiagnosticException(Diagnostic diagnostic) {
    super(diagnostic.toString());
    this.diagnostic = diagnostic;
  }

  public Diagnostic getDiagnostic() { return diagnostic; }
}
