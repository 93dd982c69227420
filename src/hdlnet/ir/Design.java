package hdlnet.ir;

import hdlnet.ast.Signal;
import hdlnet.ast.Statement;
import hdlnet.ast.Value;
import hdlnet.error.ShapeError;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A prepared fragment tree: the final port list and, per fragment, its hierarchical name,
 * the signals it uses or routes and the local names of those signals.
 * <p>
 * Signal usage is tracked so that every fragment on the path between two uses of a signal
 * also uses it: each new use walks up from the using fragment and from the signal's current
 * lowest common ancestor until both meet.
 */
public class Design {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** A top-level port; the direction is null if it is to be inferred from the netlist. */
  public record DesignPort(String name, Signal signal, PortDirection direction) {}

  private static class FragmentInfo {
    final Fragment parent;
    final int depth;
    List<String> name;
    final LinkedHashSet<Signal> usedSignals = new LinkedHashSet<>();
    final LinkedHashMap<Signal, String> signalNames = new LinkedHashMap<>();

    FragmentInfo(Fragment parent, int depth) {
      this.parent = parent;
      this.depth = depth;
    }
  }

  private final Fragment fragment;
  private final List<String> hierarchy;
  private final List<DesignPort> ports;
  private final Map<Fragment, FragmentInfo> infos = new IdentityHashMap<>();
  private final List<Fragment> fragments = new ArrayList<>();
  private final LinkedHashMap<Signal, Fragment> signalLca = new LinkedHashMap<>();

  Design(Fragment fragment, List<PortSpec> portSpecs, List<String> hierarchy) {
    this.fragment = fragment;
    this.hierarchy = List.copyOf(hierarchy);
    collectFragments(fragment, null, 0);

    List<PortSpec> lowered = new ArrayList<>();
    for (PortSpec port : portSpecs) {
      if (!(port.signal() instanceof Signal))
        throw new ShapeError("Port " + port.signal() + " did not resolve to a signal");
      lowered.add(port);
      useSignal(fragment, (Signal)port.signal());
    }
    for (Fragment frag : fragments)
      collectUses(frag);

    assignSignalNames(fragment, lowered);
    for (Fragment frag : fragments)
      if (frag != fragment)
        assignSignalNames(frag, List.of());
    assignFragmentNames(fragment, this.hierarchy);

    Map<Signal, String> topNames = infos.get(fragment).signalNames;
    List<DesignPort> named = new ArrayList<>();
    for (PortSpec port : lowered) {
      Signal signal = (Signal)port.signal();
      named.add(new DesignPort(port.name() != null ? port.name() : topNames.get(signal), signal, port.direction()));
    }
    this.ports = Collections.unmodifiableList(named);
    logger.debug("Prepared design '{}' with {} fragments and {} ports", String.join(".", hierarchy), fragments.size(), ports.size());
  }

  private void collectFragments(Fragment frag, Fragment parent, int depth) {
    infos.put(frag, new FragmentInfo(parent, depth));
    fragments.add(frag);
    for (Fragment.Subfragment sub : frag.subfragments)
      collectFragments(sub.fragment(), frag, depth + 1);
  }

  private void collectUses(Fragment frag) {
    if (frag.isLeaf()) {
      // Leaf fragments become cells of the parent module.
      Fragment owner = infos.get(frag).parent != null ? infos.get(frag).parent : frag;
      for (Signal signal : frag.portSignals())
        useSignal(owner, signal);
      return;
    }
    for (Map.Entry<String, List<Statement>> entry : frag.statements.entrySet()) {
      if (entry.getKey().equals("comb") || entry.getValue().isEmpty())
        continue;
      ClockDomain domain = frag.domains.get(entry.getKey());
      useSignal(frag, domain.getClk());
      if (domain.getRst() != null)
        useSignal(frag, domain.getRst());
    }
    for (List<Statement> stmts : frag.statements.values()) {
      for (Statement stmt : stmts) {
        for (Signal signal : stmt.lhsSignals())
          useSignal(frag, signal);
        for (Signal signal : stmt.rhsSignals())
          useSignal(frag, signal);
      }
    }
  }

  private boolean mark(Fragment frag, Signal signal) { return infos.get(frag).usedSignals.add(signal); }
  private Fragment parentOf(Fragment frag) { return infos.get(frag).parent; }
  private int depthOf(Fragment frag) { return infos.get(frag).depth; }

  private void useSignal(Fragment frag, Signal signal) {
    if (!mark(frag, signal))
      return;
    Fragment lca = signalLca.get(signal);
    if (lca == null) {
      signalLca.put(signal, frag);
      return;
    }
    Fragment a = frag;
    Fragment b = lca;
    while (depthOf(a) > depthOf(b)) {
      a = parentOf(a);
      // Every fragment already using the signal lies below the current ancestor.
      if (!mark(a, signal))
        return;
    }
    while (depthOf(b) > depthOf(a)) {
      b = parentOf(b);
      mark(b, signal);
    }
    while (a != b) {
      a = parentOf(a);
      b = parentOf(b);
      mark(a, signal);
      mark(b, signal);
    }
    signalLca.put(signal, a);
  }

  private void assignSignalNames(Fragment frag, List<PortSpec> portSpecs) {
    FragmentInfo info = infos.get(frag);
    Set<String> assigned = new HashSet<>();
    // Pre-named ports reserve their names; a signal with the same name shares it.
    for (PortSpec port : portSpecs) {
      if (port.name() == null)
        continue;
      assigned.add(port.name());
      Signal signal = (Signal)port.signal();
      if (signal.getName().equals(port.name()))
        info.signalNames.put(signal, port.name());
    }
    for (PortSpec port : portSpecs)
      if (port.name() == null)
        addSignalName(info, assigned, (Signal)port.signal());
    for (Signal signal : info.usedSignals)
      addSignalName(info, assigned, signal);
  }

  private static void addSignalName(FragmentInfo info, Set<String> assigned, Signal signal) {
    if (info.signalNames.containsKey(signal))
      return;
    String name = signal.getName();
    int suffix = assigned.size();
    while (assigned.contains(name))
      name = signal.getName() + "$" + suffix++;
    info.signalNames.put(signal, name);
    assigned.add(name);
  }

  private void assignFragmentNames(Fragment frag, List<String> name) {
    FragmentInfo info = infos.get(frag);
    info.name = List.copyOf(name);
    Set<String> taken = new HashSet<>(info.signalNames.values());
    for (int i = 0; i < frag.subfragments.size(); ++i) {
      Fragment.Subfragment sub = frag.subfragments.get(i);
      String subName = sub.name();
      if (subName == null)
        subName = "U$" + i;
      else if (taken.contains(subName))
        subName = subName + "$U$" + i;
      taken.add(subName);
      List<String> subHierarchy = new ArrayList<>(name);
      subHierarchy.add(subName);
      assignFragmentNames(sub.fragment(), subHierarchy);
    }
  }

  public Fragment getFragment() { return fragment; }
  public List<String> getHierarchy() { return hierarchy; }
  public List<DesignPort> getPorts() { return ports; }
  /** All fragments in depth-first pre-order, starting with the root. */
  public List<Fragment> getFragments() { return Collections.unmodifiableList(fragments); }
  public Map<Signal, Fragment> getSignalLca() { return Collections.unmodifiableMap(signalLca); }

  public List<String> getFragmentName(Fragment frag) { return info(frag).name; }
  public Map<Signal, String> getSignalNames(Fragment frag) { return Collections.unmodifiableMap(info(frag).signalNames); }
  /** Signals used directly by a fragment or routed through it. */
  public Set<Signal> getUsedSignals(Fragment frag) { return Collections.unmodifiableSet(info(frag).usedSignals); }
  public Fragment getParent(Fragment frag) { return info(frag).parent; }

  private FragmentInfo info(Fragment frag) {
    FragmentInfo info = infos.get(frag);
    if (info == null)
      throw new IllegalArgumentException("Fragment " + frag + " is not part of this design");
    return info;
  }

  /** The local name of a signal in the root fragment. */
  public String getTopName(Value signal) { return infos.get(fragment).signalNames.get(signal); }
}
