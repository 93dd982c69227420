package hdlnet.ast;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the body of the first case whose patterns match the test value.
 * Cases are kept in declaration order; a case with null patterns is the default.
 */
public final class Switch extends Statement {
  public record Case(List<String> patterns, List<Statement> body, SrcLoc srcLoc) {
    public Case {
      patterns = patterns == null ? null : List.copyOf(patterns);
      body = List.copyOf(body);
    }
    public boolean isDefault() { return patterns == null; }
  }

  private final Value test;
  private final List<Case> cases;

  public Switch(Value test, List<Case> cases, SrcLoc srcLoc) {
    super(srcLoc);
    this.test = test;
    this.cases = List.copyOf(cases);
  }

  public Value getTest() { return test; }
  public List<Case> getCases() { return cases; }

  @Override
  public Set<Signal> lhsSignals() {
    Set<Signal> result = new LinkedHashSet<>();
    cases.forEach(c -> c.body().forEach(stmt -> result.addAll(stmt.lhsSignals())));
    return result;
  }

  @Override
  public Set<Signal> rhsSignals() {
    Set<Signal> result = new LinkedHashSet<>(test.rhsSignals());
    cases.forEach(c -> c.body().forEach(stmt -> result.addAll(stmt.rhsSignals())));
    return result;
  }

  @Override
  public String toString() {
    String body = cases.stream()
                      .map(c -> "(" + (c.isDefault() ? "default" : "(" + String.join(" ", c.patterns()) + ")") +
                                c.body().stream().map(stmt -> " " + stmt).collect(Collectors.joining()) + ")")
                      .collect(Collectors.joining(" "));
    return "(switch " + test + " " + body + ")";
  }
}
