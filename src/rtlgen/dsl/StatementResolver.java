package rtlgen.dsl;

import java.util.ArrayList;
import java.util.List;
import rtlgen.ast.Assign;
import rtlgen.ast.LateBoundStatement;
import rtlgen.ast.Property;
import rtlgen.ast.Statement;
import rtlgen.ast.StatementList;
import rtlgen.ast.Switch;

/**
 * Replaces all {@link LateBoundStatement}s in a statement tree by their resolved form.
 */
public class StatementResolver {
  private StatementResolver() {}

  /**
   * Resolves a single statement, recursing into branch bodies.
   * @param stmt the statement
   * @return a statement tree without late-bound statements
   */
  public static Statement resolve(Statement stmt) {
    if (stmt instanceof LateBoundStatement)
      return resolve(((LateBoundStatement)stmt).resolve());
    if (stmt instanceof Switch) {
      Switch switchStmt = (Switch)stmt;
      List<Switch.Case> cases = new ArrayList<>();
      for (Switch.Case c : switchStmt.getCases())
        cases.add(new Switch.Case(c.getPatterns(), resolveAll(c.getBody()), c.getSrcLoc()));
      return new Switch(switchStmt.getTest(), cases, switchStmt.getSrcLoc());
    }
    if (stmt instanceof Assign || stmt instanceof Property)
      return stmt;
    throw new IllegalStateException("Unexpected statement type " + stmt.getClass().getSimpleName());
  }

  /**
   * Resolves a list of statements.
   * @param stmts the statements
   * @return a new list of resolved statements
   */
  public static StatementList resolveAll(List<Statement> stmts) {
    StatementList ret = new StatementList();
    for (Statement stmt : stmts)
      ret.add(resolve(stmt));
    return ret;
  }
}
