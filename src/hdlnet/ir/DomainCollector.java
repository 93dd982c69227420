package hdlnet.ir;

import hdlnet.ast.ClockSignal;
import hdlnet.ast.ResetSignal;
import hdlnet.ast.Statement;
import hdlnet.ast.Value;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Collects the domains a fragment tree uses and the domains it defines. */
public class DomainCollector {
  private final Set<String> usedDomains = new LinkedHashSet<>();
  private final Set<String> definedDomains = new LinkedHashSet<>();

  public Set<String> getUsedDomains() { return usedDomains; }
  public Set<String> getDefinedDomains() { return definedDomains; }

  public void collect(Fragment fragment) {
    definedDomains.addAll(fragment.domains.keySet());
    usedDomains.addAll(fragment.statements.keySet());
    usedDomains.addAll(fragment.extraUsedDomains());
    // Placeholders are found by a transform that changes nothing.
    ValueTransformer finder = new ValueTransformer() {
      @Override
      protected Value onClockSignal(ClockSignal value) {
        usedDomains.add(value.getDomain());
        return value;
      }
      @Override
      protected Value onResetSignal(ResetSignal value) {
        usedDomains.add(value.getDomain());
        return value;
      }
    };
    for (List<Statement> stmts : fragment.statements.values())
      finder.onStatements(stmts);
    fragment.visitValues(finder);
    for (Fragment.Subfragment sub : fragment.subfragments)
      collect(sub.fragment());
  }
}
