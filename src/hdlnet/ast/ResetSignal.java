package hdlnet.ast;

import hdlnet.error.DomainError;
import java.util.List;

/**
 * Placeholder for the reset of a domain.
 * Unless {@code allowResetLess} is set, lowering fails for a domain without a reset.
 */
public final class ResetSignal extends Value {
  private final String domain;
  private final boolean allowResetLess;

  public ResetSignal(String domain) { this(domain, false); }

  public ResetSignal(String domain, boolean allowResetLess) {
    super(SrcLoc.capture());
    if (domain.equals("comb"))
      throw new DomainError("Domain 'comb' does not have a reset", srcLoc);
    this.domain = domain;
    this.allowResetLess = allowResetLess;
  }

  public String getDomain() { return domain; }
  public boolean isAllowResetLess() { return allowResetLess; }

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
    return "(rst " + domain + ")";
  }
}
