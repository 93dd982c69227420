package hdlnet.ast;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A placeholder whose concrete statement is only known after the enclosing block closes.
 * {@link #resolveAll(List)} replaces placeholders before a statement list leaves the builder.
 */
public abstract class LateBoundStatement extends Statement {
  protected LateBoundStatement(SrcLoc srcLoc) { super(srcLoc); }

  /** Produces the concrete statement. Only valid once the enclosing block has closed. */
  public abstract Statement resolve();

  /** Placeholders drive nothing until resolved. */
  @Override
  public Set<Signal> lhsSignals() {
    return new LinkedHashSet<>();
  }

  @Override
  public Set<Signal> rhsSignals() {
    return new LinkedHashSet<>();
  }

  /** Resolves placeholders in a statement list, descending into switch bodies. */
  public static List<Statement> resolveAll(List<Statement> statements) {
    List<Statement> result = new ArrayList<>(statements.size());
    for (Statement stmt : statements)
      result.add(resolve(stmt));
    return result;
  }

  private static Statement resolve(Statement stmt) {
    if (stmt instanceof LateBoundStatement)
      return resolve(((LateBoundStatement)stmt).resolve());
    if (stmt instanceof Switch) {
      Switch sw = (Switch)stmt;
      List<Switch.Case> cases = new ArrayList<>();
      for (Switch.Case c : sw.getCases())
        cases.add(new Switch.Case(c.patterns(), resolveAll(c.body()), c.srcLoc()));
      return new Switch(sw.getTest(), cases, sw.getSrcLoc());
    }
    return stmt;
  }
}
