package hdlnet.ir;

import hdlnet.ast.Signal;
import hdlnet.ast.SrcLoc;
import hdlnet.ast.Statement;
import hdlnet.ast.Value;
import hdlnet.error.DomainError;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Adds a per-domain control condition to every fragment of a subtree. */
abstract class ControlInserter {
  protected final Map<String, Value> controls;
  protected final SrcLoc srcLoc;

  protected ControlInserter(Map<String, ?> controls, SrcLoc srcLoc) {
    if (controls.containsKey("comb"))
      throw new DomainError("Cannot add controls on the 'comb' domain", srcLoc);
    LinkedHashMap<String, Value> cast = new LinkedHashMap<>();
    controls.forEach((domain, control) -> {
      Value value = Value.cast(control);
      cast.put(domain, value.width() == 1 ? value : value.bool());
    });
    this.controls = cast;
    this.srcLoc = srcLoc;
  }

  public Fragment apply(Fragment fragment) {
    fragment.checkNotFrozen();
    for (Map.Entry<String, List<Statement>> entry : fragment.statements.entrySet()) {
      Value control = controls.get(entry.getKey());
      if (control == null)
        continue;
      Set<Signal> driven = new LinkedHashSet<>();
      for (Statement stmt : entry.getValue())
        driven.addAll(stmt.lhsSignals());
      entry.setValue(insertControl(new ArrayList<>(entry.getValue()), control, driven));
    }
    onLeaf(fragment);
    for (Fragment.Subfragment sub : fragment.subfragments)
      apply(sub.fragment());
    return fragment;
  }

  /** @return The statements of one controlled domain with {@code control} applied */
  protected abstract List<Statement> insertControl(List<Statement> stmts, Value control, Set<Signal> driven);

  /** Applies controls to domains referenced outside of statements, e.g. memory ports. */
  protected void onLeaf(Fragment fragment) {}
}
