package hdlnet.ast;

import hdlnet.error.DomainError;
import java.util.List;

/** Placeholder for the clock of a domain; replaced by the concrete clock signal before emission. */
public final class ClockSignal extends Value {
  private final String domain;

  public ClockSignal(String domain) {
    super(SrcLoc.capture());
    if (domain.equals("comb"))
      throw new DomainError("Domain 'comb' does not have a clock", srcLoc);
    this.domain = domain;
  }

  public String getDomain() { return domain; }

  @Override
  public Shape shape() {
    return Shape.unsigned(1);
  }

  @Override
  public List<Value> operands() {
    return List.of();
  }

  @Override
  public String toString() {
    return "(clk " + domain + ")";
  }
}
