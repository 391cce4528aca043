package rtlgen.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Collects the diagnostics reported while building a module.
 */
public class DiagnosticSink {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final boolean asErrors;

  public DiagnosticSink() { this(false); }

  /**
   * @param asErrors if true, {@link #report(Diagnostic)} throws a {@link DiagnosticException} after recording the diagnostic
   */
  public DiagnosticSink(boolean asErrors) { this.asErrors = asErrors; }

  /**
   * Records a diagnostic and logs it as a warning.
   * @param diagnostic the diagnostic
   */
  public void report(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
    logger.warn("{} [{}]", diagnostic, diagnostic.getKind());
    if (asErrors)
      throw new DiagnosticException(diagnostic);
  }

  public List<Diagnostic> getDiagnostics() { return Collections.unmodifiableList(diagnostics); }

  /** Returns the recorded diagnostics of one kind. */
  public List<Diagnostic> getDiagnostics(Diagnostic.Kind kind) {
    return diagnostics.stream().filter(diag -> diag.getKind() == kind).collect(Collectors.toList());
  }

  public boolean isEmpty() { return diagnostics.isEmpty(); }
}
