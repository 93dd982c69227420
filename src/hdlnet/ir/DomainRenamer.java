package hdlnet.ir;

import hdlnet.ast.ClockSignal;
import hdlnet.ast.ResetSignal;
import hdlnet.ast.Value;
import hdlnet.error.DomainError;
import java.util.LinkedHashMap;
import java.util.Map;

/** Renames clock domains throughout a fragment subtree, including the domain objects themselves. */
public class DomainRenamer {
  private final Map<String, String> renames;

  public DomainRenamer(Map<String, String> renames) {
    if (renames.containsKey("comb"))
      throw new DomainError("Domain 'comb' may not be renamed");
    if (renames.containsValue("comb"))
      throw new DomainError("A domain may not be renamed to 'comb'");
    this.renames = Map.copyOf(renames);
  }

  public Fragment apply(Fragment fragment) {
    fragment.checkNotFrozen();
    LinkedHashMap<String, ClockDomain> renamed = new LinkedHashMap<>();
    fragment.domains.forEach((name, domain) -> {
      String newName = renames.get(name);
      if (newName == null) {
        renamed.put(name, domain);
        return;
      }
      // Domain objects are shared with descendants; rename each object once.
      if (domain.getName().equals(name))
        domain.rename(newName);
      renamed.put(newName, domain);
    });
    fragment.domains.clear();
    fragment.domains.putAll(renamed);

    fragment.renameDomainReferences(renames);
    fragment.transformValues(new ValueTransformer() {
      @Override
      protected Value onClockSignal(ClockSignal value) {
        String newName = renames.get(value.getDomain());
        return newName == null ? value : new ClockSignal(newName);
      }
      @Override
      protected Value onResetSignal(ResetSignal value) {
        String newName = renames.get(value.getDomain());
        return newName == null ? value : new ResetSignal(newName, value.isAllowResetLess());
      }
    });
    for (Fragment.Subfragment sub : fragment.subfragments)
      apply(sub.fragment());
    return fragment;
  }
}
