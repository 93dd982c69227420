package hdlnet.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Multi-way selection: evaluates to the value of the first case whose patterns match the test.
 * A case with null patterns is the default. If nothing matches the result is zero.
 */
public final class SwitchValue extends Value {
  /** One alternative; {@code patterns} is null for the default case. */
  public record Case(List<String> patterns, Value value) {}

  private final Value test;
  private final List<Case> cases;
  private final Shape shape;

  public SwitchValue(Value test, List<Case> cases, SrcLoc srcLoc) {
    super(srcLoc);
    this.test = test;
    this.cases = List.copyOf(cases);
    this.shape = Shape.unify(this.cases.stream().map(c -> c.value().shape()).toArray(Shape[]::new));
  }

  /** Starts building a selection on {@code test}. */
  public static Builder on(Object test) { return new Builder(Value.cast(test)); }

  public static class Builder {
    private final Value test;
    private final List<Case> cases = new ArrayList<>();
    private final SrcLoc srcLoc = SrcLoc.capture();

    Builder(Value test) { this.test = test; }

    /** Adds a case; patterns are normalized as for {@link Value#matches(Object...)}. */
    public Builder when(Object value, Object... patterns) {
      cases.add(new Case(Patterns.normalize(List.of(patterns), test.shape(), srcLoc), Value.cast(value)));
      return this;
    }
    public Builder otherwise(Object value) {
      cases.add(new Case(null, Value.cast(value)));
      return this;
    }
    public SwitchValue build() { return new SwitchValue(test, cases, srcLoc); }
  }

  public Value getTest() { return test; }
  public List<Case> getCases() { return cases; }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public List<Value> operands() {
    List<Value> result = new ArrayList<>();
    result.add(test);
    cases.forEach(c -> result.add(c.value()));
    return result;
  }

  @Override
  public boolean isAssignable() {
    return cases.stream().allMatch(c -> c.value().isAssignable());
  }

  @Override
  protected void collectLhsSignals(Set<Signal> out) {
    cases.forEach(c -> c.value().collectLhsSignals(out));
  }

  @Override
  public String toString() {
    String body = cases.stream()
                      .map(c -> "(" + (c.patterns() == null ? "default" : "(" + String.join(" ", c.patterns()) + ")") + " " + c.value() + ")")
                      .collect(Collectors.joining(" "));
    return "(switch-value " + test + " " + body + ")";
  }
}
