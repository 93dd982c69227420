package hdlnet.ir;

import hdlnet.ast.ClockSignal;
import hdlnet.ast.Const;
import hdlnet.ast.ResetSignal;
import hdlnet.ast.Shape;
import hdlnet.ast.Value;
import hdlnet.error.DomainError;
import java.util.Map;

/**
 * Replaces {@link ClockSignal} and {@link ResetSignal} placeholders with the signals of the domains
 * visible in each fragment, and checks that every driven domain exists.
 */
public class DomainLowerer {
  private final Map<String, ClockDomain> topDomains;

  public DomainLowerer(Map<String, ClockDomain> topDomains) { this.topDomains = topDomains; }

  private static Value lower(Value value, Map<String, ClockDomain> domains) {
    if (value instanceof ClockSignal) {
      ClockSignal clk = (ClockSignal)value;
      return lookup(domains, clk.getDomain(), value).getClk();
    }
    if (value instanceof ResetSignal) {
      ResetSignal rst = (ResetSignal)value;
      ClockDomain domain = lookup(domains, rst.getDomain(), value);
      if (domain.getRst() != null)
        return domain.getRst();
      if (rst.isAllowResetLess())
        return Const.of(0, Shape.unsigned(1));
      throw new DomainError("Signal " + value + " refers to reset of reset-less domain '" + rst.getDomain() + "'", value.getSrcLoc());
    }
    return value;
  }

  private static ClockDomain lookup(Map<String, ClockDomain> domains, String name, Value ref) {
    ClockDomain domain = domains.get(name);
    if (domain == null)
      throw new DomainError("Signal " + ref + " refers to nonexistent domain '" + name + "'", ref.getSrcLoc());
    return domain;
  }

  /** Lowers a top-level port request against the domains of the top fragment. */
  public Value resolvePortSignal(Value signal) { return lower(signal, topDomains); }

  public void apply(Fragment fragment) {
    for (String domain : fragment.statements.keySet())
      if (!domain.equals("comb") && !fragment.domains.containsKey(domain))
        throw new DomainError("Domain '" + domain + "' is used but not defined", fragment.getSrcLoc());
    for (String domain : fragment.extraUsedDomains())
      if (!domain.equals("comb") && !fragment.domains.containsKey(domain))
        throw new DomainError("Domain '" + domain + "' is used but not defined", fragment.getSrcLoc());
    Map<String, ClockDomain> domains = fragment.domains;
    fragment.transformValues(new ValueTransformer() {
      @Override
      protected Value onClockSignal(ClockSignal value) {
        return lower(value, domains);
      }
      @Override
      protected Value onResetSignal(ResetSignal value) {
        return lower(value, domains);
      }
    });
    for (Fragment.Subfragment sub : fragment.subfragments)
      apply(sub.fragment());
  }
}
