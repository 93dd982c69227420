package hdlnet.ast;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Concatenation of values, first part in the least significant bits. */
public final class Concat extends Value {
  private final List<Value> parts;
  private final Shape shape;

  public Concat(List<Value> parts, SrcLoc srcLoc) {
    super(srcLoc);
    this.parts = List.copyOf(parts);
    this.shape = Shape.unsigned(this.parts.stream().mapToInt(Value::width).sum());
  }

  public List<Value> getParts() { return parts; }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public List<Value> operands() {
    return parts;
  }

  @Override
  public boolean isAssignable() {
    return parts.stream().allMatch(Value::isAssignable);
  }

  @Override
  protected void collectLhsSignals(Set<Signal> out) {
    parts.forEach(part -> part.collectLhsSignals(out));
  }

  @Override
  public String toString() {
    return "(cat" + parts.stream().map(part -> " " + part).collect(Collectors.joining()) + ")";
  }
}
