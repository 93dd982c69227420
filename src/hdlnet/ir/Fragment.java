package hdlnet.ir;

import hdlnet.ast.ClockSignal;
import hdlnet.ast.ResetSignal;
import hdlnet.ast.Signal;
import hdlnet.ast.SignalArena;
import hdlnet.ast.SrcLoc;
import hdlnet.ast.Statement;
import hdlnet.ast.Value;
import hdlnet.error.AlreadyElaboratedException;
import hdlnet.error.DomainError;
import hdlnet.error.HdlNameError;
import hdlnet.error.ShapeError;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A node of the design hierarchy: per-domain statement lists, clock domain definitions and child fragments.
 * <p>
 * A fragment is exclusively owned by whoever builds it until {@link #prepare} is called.
 * Preparing freezes the whole tree; later structural changes raise {@link AlreadyElaboratedException}.
 */
public class Fragment {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** A child fragment with its optional name. */
  public record Subfragment(Fragment fragment, String name, SrcLoc srcLoc) {}

  protected final LinkedHashMap<String, List<Statement>> statements = new LinkedHashMap<>();
  protected final LinkedHashMap<String, ClockDomain> domains = new LinkedHashMap<>();
  protected final List<Subfragment> subfragments = new ArrayList<>();
  protected final LinkedHashMap<String, Object> generated = new LinkedHashMap<>();
  protected final LinkedHashMap<String, Object> attrs = new LinkedHashMap<>();
  protected final SrcLoc srcLoc;
  private boolean frozen = false;

  public Fragment() { this(SrcLoc.capture()); }
  public Fragment(SrcLoc srcLoc) { this.srcLoc = srcLoc; }

  /**
   * Elaborates {@code obj} until a fragment is produced.
   * @param obj A {@link Fragment} or an {@link Elaboratable}
   */
  public static Fragment get(Object obj) {
    Object current = obj;
    while (!(current instanceof Fragment)) {
      if (!(current instanceof Elaboratable))
        throw new ShapeError("Object " + current + " cannot be elaborated");
      Object next = ((Elaboratable)current).elaborate();
      if (next == null)
        throw new ShapeError("Object " + current + " returned null from elaborate()");
      if (next == current)
        throw new ShapeError("Object " + current + " elaborates to itself");
      logger.trace("Elaborated {} into {}", current, next);
      current = next;
    }
    return (Fragment)current;
  }

  public SrcLoc getSrcLoc() { return srcLoc; }
  public boolean isFrozen() { return frozen; }
  public Map<String, List<Statement>> getStatements() { return Collections.unmodifiableMap(statements); }
  public Map<String, ClockDomain> getDomains() { return Collections.unmodifiableMap(domains); }
  public List<Subfragment> getSubfragments() { return Collections.unmodifiableList(subfragments); }
  public Map<String, Object> getGenerated() { return Collections.unmodifiableMap(generated); }
  public Map<String, Object> getAttrs() { return Collections.unmodifiableMap(attrs); }

  protected void checkNotFrozen() {
    if (frozen)
      throw new AlreadyElaboratedException("Cannot modify a fragment that has already been elaborated", srcLoc);
  }

  public void addStatements(String domain, List<? extends Statement> stmts) {
    checkNotFrozen();
    statements.computeIfAbsent(domain, d -> new ArrayList<>()).addAll(stmts);
  }

  public void addStatements(String domain, Statement... stmts) { addStatements(domain, List.of(stmts)); }

  public void addDomains(ClockDomain... newDomains) { addDomains(List.of(newDomains)); }

  public void addDomains(Collection<ClockDomain> newDomains) {
    checkNotFrozen();
    for (ClockDomain domain : newDomains) {
      ClockDomain existing = domains.get(domain.getName());
      if (existing == domain)
        continue;
      if (existing != null)
        throw new DomainError("Domain '" + domain.getName() + "' is defined more than once", domain.getSrcLoc());
      domains.put(domain.getName(), domain);
    }
  }

  public void addSubfragment(Fragment subfragment, String name) { addSubfragment(subfragment, name, SrcLoc.capture()); }

  public void addSubfragment(Fragment subfragment, String name, SrcLoc srcLoc) {
    checkNotFrozen();
    subfragments.add(new Subfragment(subfragment, name, srcLoc));
  }

  public void addGenerated(String name, Object obj) {
    checkNotFrozen();
    generated.put(name, obj);
  }

  public void setAttr(String key, Object value) {
    checkNotFrozen();
    attrs.put(key, value);
  }

  /** Finds a child fragment by name. */
  public Fragment findSubfragment(String name) {
    for (Subfragment sub : subfragments)
      if (name.equals(sub.name()))
        return sub.fragment();
    throw new HdlNameError("No subfragment named '" + name + "'");
  }

  public Fragment findSubfragment(int index) { return subfragments.get(index).fragment(); }

  /** Looks up an object generated while building a (sub)fragment, e.g. an FSM, by hierarchical path. */
  public Object findGenerated(String... path) {
    Fragment fragment = this;
    for (int i = 0; i < path.length - 1; ++i)
      fragment = fragment.findSubfragment(path[i]);
    Object obj = fragment.generated.get(path[path.length - 1]);
    if (obj == null)
      throw new HdlNameError("No generated object named '" + String.join(".", path) + "'");
    return obj;
  }

  /** Signals this fragment uses outside of its statements, e.g. instance port connections. */
  protected Set<Signal> portSignals() { return Set.of(); }

  /** Whether this fragment becomes cells of its parent's module instead of a module of its own. */
  public boolean isLeaf() { return false; }

  /** Rewrites all values referenced by this fragment (but not by its children). */
  protected void transformValues(ValueTransformer transformer) {
    for (Map.Entry<String, List<Statement>> entry : statements.entrySet())
      entry.setValue(transformer.onStatements(entry.getValue()));
  }

  /** Passes values referenced outside of statements, e.g. port connections, through {@code transformer} without storing the result. */
  protected void visitValues(ValueTransformer transformer) {}

  /** Domain names this fragment needs besides the keys of its statement map. */
  protected Set<String> extraUsedDomains() { return Set.of(); }

  /** Renames domains referenced by this fragment (but not by its children). */
  protected void renameDomainReferences(Map<String, String> renames) {
    LinkedHashMap<String, List<Statement>> renamed = new LinkedHashMap<>();
    statements.forEach((domain, stmts) -> renamed.computeIfAbsent(renames.getOrDefault(domain, domain), d -> new ArrayList<>()).addAll(stmts));
    statements.clear();
    statements.putAll(renamed);
  }

  private void freeze() {
    frozen = true;
    for (Subfragment sub : subfragments)
      sub.fragment().freeze();
  }

  //// Domain propagation ////

  private static String hierName(Subfragment sub, int index) { return sub.name() == null ? "<unnamed #" + index + ">" : sub.name(); }

  void propagateDomainsUp(List<String> hierarchy) {
    LinkedHashMap<String, List<Integer>> domainSubfrags = new LinkedHashMap<>();
    for (int i = 0; i < subfragments.size(); ++i) {
      Subfragment sub = subfragments.get(i);
      List<String> subHierarchy = new ArrayList<>(hierarchy);
      subHierarchy.add(hierName(sub, i));
      sub.fragment().propagateDomainsUp(subHierarchy);
      for (ClockDomain domain : sub.fragment().domains.values()) {
        if (domain.isLocal())
          continue;
        domainSubfrags.computeIfAbsent(domain.getName(), d -> new ArrayList<>()).add(i);
      }
    }

    // A domain defined by several children is renamed in each of them.
    for (Map.Entry<String, List<Integer>> entry : domainSubfrags.entrySet()) {
      String domainName = entry.getKey();
      List<Integer> indices = entry.getValue();
      if (indices.size() == 1)
        continue;
      List<String> names = indices.stream().map(i -> subfragments.get(i).name()).collect(Collectors.toList());
      if (names.contains(null)) {
        String listed = indices.stream()
                            .map(i -> subfragments.get(i).name() == null ? "<unnamed #" + i + ">" : "'" + subfragments.get(i).name() + "'")
                            .sorted()
                            .collect(Collectors.joining(", "));
        throw new DomainError("Domain '" + domainName + "' is defined by subfragments " + listed + " of fragment '" +
                              String.join(".", hierarchy) +
                              "'; it is necessary to either rename subfragment domains explicitly, or give names to subfragments");
      }
      if (new HashSet<>(names).size() != names.size()) {
        String listed = indices.stream().map(i -> "#" + i).sorted().collect(Collectors.joining(", "));
        throw new DomainError("Domain '" + domainName + "' is defined by subfragments " + listed + " of fragment '" +
                              String.join(".", hierarchy) + "', some of which have identical names; it is necessary to either " +
                              "rename subfragment domains explicitly, or give distinct names to subfragments");
      }
      for (int i : indices) {
        Subfragment sub = subfragments.get(i);
        String newName = sub.name() + "_" + domainName;
        logger.debug("Renaming domain '{}' of subfragment '{}' to '{}'", domainName, sub.name(), newName);
        new DomainRenamer(Map.of(domainName, newName)).apply(sub.fragment());
      }
    }

    for (Subfragment sub : subfragments)
      for (ClockDomain domain : sub.fragment().domains.values())
        if (!domain.isLocal())
          addDomains(domain);
  }

  void propagateDomainsDown() {
    for (Subfragment sub : subfragments) {
      for (ClockDomain domain : domains.values()) {
        ClockDomain existing = sub.fragment().domains.get(domain.getName());
        if (existing == null)
          sub.fragment().domains.put(domain.getName(), domain);
        else if (existing != domain)
          throw new DomainError("Domain '" + domain.getName() + "' is defined by a subfragment and by its parent", existing.getSrcLoc());
      }
      sub.fragment().propagateDomainsDown();
    }
  }

  /** Asks the resolver for each domain that is used but not defined; returns the domains created directly. */
  List<ClockDomain> createMissingDomains(MissingDomainResolver resolver) {
    DomainCollector collector = new DomainCollector();
    collector.collect(this);
    Set<String> missing = new TreeSet<>(collector.getUsedDomains());
    missing.removeAll(collector.getDefinedDomains());
    missing.remove("comb");

    List<ClockDomain> newDomains = new ArrayList<>();
    for (String domainName : missing) {
      Object value = resolver.resolve(domainName);
      if (value == null)
        throw new DomainError("Domain '" + domainName + "' is used but not defined");
      if (value instanceof ClockDomain) {
        ClockDomain domain = (ClockDomain)value;
        if (!domain.getName().equals(domainName))
          throw new DomainError("Missing domain resolver returned domain '" + domain.getName() + "' for domain '" + domainName + "'");
        addDomains(domain);
        newDomains.add(domain);
        logger.debug("Created missing domain '{}'", domainName);
      } else {
        Fragment newFragment = get(value);
        if (!newFragment.domains.containsKey(domainName)) {
          String defined = newFragment.domains.keySet().stream().map(n -> "'" + n + "'").collect(Collectors.joining(", "));
          throw new DomainError("Fragment returned by missing domain callback does not define requested domain '" + domainName +
                                "' (defines " + defined + ").");
        }
        addSubfragment(newFragment, "cd_" + domainName, newFragment.srcLoc);
        addDomains(newFragment.domains.values());
        logger.debug("Added fragment 'cd_{}' defining missing domain", domainName);
      }
    }
    return newDomains;
  }

  //// Preparation ////

  /** Prepares with a default resolver that creates plain clock domains for missing names. */
  public Design prepare(List<PortSpec> ports) { return prepare(ports, MissingDomainResolver.createDefault(new SignalArena()), true); }

  public Design prepare(Map<String, PortSpec.Binding> ports, MissingDomainResolver resolver, boolean propagateDomains) {
    List<PortSpec> list = new ArrayList<>();
    ports.forEach((name, binding) -> list.add(new PortSpec(name, binding.signal(), binding.direction())));
    return prepare(list, resolver, propagateDomains);
  }

  public Design prepare(List<PortSpec> ports, MissingDomainResolver resolver, boolean propagateDomains) {
    return prepare(ports, resolver, propagateDomains, List.of("top"));
  }

  /**
   * Propagates and creates domains, lowers domain placeholders and assigns names.
   * @param ports Requested top-level ports
   * @param resolver Called for every domain that is used but not defined
   * @param propagateDomains If false, domains are neither propagated nor created
   * @param hierarchy Hierarchical name of this fragment
   * @return The prepared design; this fragment tree is frozen afterwards
   */
  public Design prepare(List<PortSpec> ports, MissingDomainResolver resolver, boolean propagateDomains, List<String> hierarchy) {
    checkNotFrozen();
    List<PortSpec> portList = validatePorts(ports);

    if (propagateDomains) {
      propagateDomainsUp(hierarchy);
      propagateDomainsDown();
      // A fragment supplied by the resolver may use further missing domains.
      while (true) {
        List<ClockDomain> newDomains = createMissingDomains(resolver);
        propagateDomainsDown();
        for (ClockDomain domain : newDomains) {
          portList.add(new PortSpec(null, domain.getClk(), PortDirection.INPUT));
          if (domain.getRst() != null)
            portList.add(new PortSpec(null, domain.getRst(), PortDirection.INPUT));
        }
        DomainCollector collector = new DomainCollector();
        collector.collect(this);
        Set<String> missing = new HashSet<>(collector.getUsedDomains());
        missing.removeAll(collector.getDefinedDomains());
        missing.remove("comb");
        if (missing.isEmpty())
          break;
      }
    }

    DomainLowerer lowerer = new DomainLowerer(domains);
    List<PortSpec> resolvedPorts = new ArrayList<>();
    for (PortSpec port : portList)
      resolvedPorts.add(new PortSpec(port.name(), lowerer.resolvePortSignal(port.signal()), port.direction()));
    lowerer.apply(this);

    freeze();
    return new Design(this, resolvedPorts, hierarchy);
  }

  private static List<PortSpec> validatePorts(List<PortSpec> ports) {
    Set<String> prenamed = new HashSet<>();
    List<PortSpec> result = new ArrayList<>();
    for (PortSpec port : ports) {
      if (port.name() != null && !prenamed.add(port.name()))
        throw new HdlNameError("Duplicate port name '" + port.name() + "'");
      Value signal = port.signal();
      if (!(signal instanceof Signal || signal instanceof ClockSignal || signal instanceof ResetSignal))
        throw new ShapeError("Only signals may be added as ports, not " + signal);
      result.add(port);
    }
    return result;
  }
}
