package rtlgen.dsl;

import rtlgen.ast.SrcLoc;

/**
 * A non-fatal finding about a description that is accepted, but likely not what the designer intended.
 */
public class Diagnostic {
  public enum Kind {
    /** A Case pattern is wider than the Switch test and can never match. */
    DeadCase,
    /** A Case or Default follows a Default and can never be selected. */
    CaseAfterDefault,
    /** A signed value is used as an If/Elif condition. */
    SignedCondition,
    /** A statement domain is named like one of the builder registries. */
    SuspiciousDomainName
  }

  private final Kind kind;
  private final String message;
  private final SrcLoc srcLoc;

  public Diagnostic(Kind kind, String message, SrcLoc srcLoc) {
    this.kind = kind;
    this.message = message;
    this.srcLoc = srcLoc;
  }

  public Kind getKind() { return kind; }
  public String getMessage() { return message; }
  public SrcLoc getSrcLoc() { return srcLoc; }

  @Override
  public String toString() {
    return srcLoc + ": " + message;
  }
}
