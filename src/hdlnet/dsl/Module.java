package hdlnet.dsl;

import hdlnet.ast.Assign;
import hdlnet.ast.Const;
import hdlnet.ast.IntRange;
import hdlnet.ast.LateBoundStatement;
import hdlnet.ast.Patterns;
import hdlnet.ast.Print;
import hdlnet.ast.Property;
import hdlnet.ast.Signal;
import hdlnet.ast.SignalArena;
import hdlnet.ast.SrcLoc;
import hdlnet.ast.Statement;
import hdlnet.ast.Switch;
import hdlnet.ast.Value;
import hdlnet.error.AlreadyElaboratedException;
import hdlnet.error.DomainError;
import hdlnet.error.DriverConflictException;
import hdlnet.error.HdlNameError;
import hdlnet.error.HdlSyntaxError;
import hdlnet.ir.ClockDomain;
import hdlnet.ir.Elaboratable;
import hdlnet.ir.Fragment;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds a fragment from statements nested in conditional blocks.
 * <p>
 * Blocks are opened and closed explicitly ({@link #beginIf}/{@link #endIf} and so on) or through the
 * closure variants ({@link #when}, {@link #switchOn}, {@link #fsm}). A closed block stays on the
 * control stack until a statement or block is added at an outer level, or until {@link #elaborate};
 * only then is it compiled into one {@link Switch} per domain driven from inside it.
 */
public class Module implements Elaboratable {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private abstract static class ControlBlock {
    final SrcLoc srcLoc;
    ControlBlock(SrcLoc srcLoc) { this.srcLoc = srcLoc; }
  }

  private static class IfBlock extends ControlBlock {
    final int depth;
    final List<Value> tests = new ArrayList<>();
    final List<Map<String, List<Statement>>> bodies = new ArrayList<>();
    final List<SrcLoc> srcLocs = new ArrayList<>();
    IfBlock(int depth, SrcLoc srcLoc) {
      super(srcLoc);
      this.depth = depth;
    }
  }

  private static class SwitchBlock extends ControlBlock {
    final Value test;
    final List<List<String>> patterns = new ArrayList<>();
    final List<Map<String, List<Statement>>> bodies = new ArrayList<>();
    final List<SrcLoc> srcLocs = new ArrayList<>();
    boolean gotDefault;
    SwitchBlock(Value test, SrcLoc srcLoc) {
      super(srcLoc);
      this.test = test;
    }
  }

  private static class FsmBlock extends ControlBlock {
    final Fsm fsm;
    FsmBlock(Fsm fsm) {
      super(fsm.getSrcLoc());
      this.fsm = fsm;
    }
  }

  /** A body whose statements are collected separately until its end call. */
  private static class OpenBody {
    final String construct;
    final Map<String, List<Statement>> outer;
    final Value test;
    final List<String> patterns;
    final String stateName;
    final SrcLoc srcLoc;
    OpenBody(String construct, Map<String, List<Statement>> outer, Value test, List<String> patterns, String stateName, SrcLoc srcLoc) {
      this.construct = construct;
      this.outer = outer;
      this.test = test;
      this.patterns = patterns;
      this.stateName = stateName;
      this.srcLoc = srcLoc;
    }
  }

  private record Submodule(Object elaboratable, SrcLoc srcLoc) {}

  private final SignalArena arena;
  private final SrcLoc srcLoc;
  private Map<String, List<Statement>> statements = new LinkedHashMap<>();
  private final List<Statement> topCombStatements = new ArrayList<>();
  private final List<ControlBlock> ctrlStack = new ArrayList<>();
  private final List<OpenBody> openBodies = new ArrayList<>();
  private String ctrlContext = null;
  private int depth = 0;
  private final Map<Signal, String> driving = new LinkedHashMap<>();
  private final Map<Signal, SrcLoc> drivingSrcLocs = new LinkedHashMap<>();
  private final LinkedHashMap<String, Submodule> namedSubmodules = new LinkedHashMap<>();
  private final List<Submodule> anonSubmodules = new ArrayList<>();
  private final LinkedHashMap<String, ClockDomain> domains = new LinkedHashMap<>();
  private final LinkedHashMap<String, Object> generated = new LinkedHashMap<>();
  private boolean frozen = false;

  public Module(SignalArena arena) {
    this.arena = arena;
    this.srcLoc = SrcLoc.capture();
  }

  public SignalArena getArena() { return arena; }

  //// Statements ////

  public Module comb(Statement... stmts) { return domain("comb", stmts); }
  public Module sync(Statement... stmts) { return domain("sync", stmts); }

  /** Adds statements to the given domain at the current nesting level. */
  public Module domain(String domain, Statement... stmts) {
    addStatements(List.of(stmts), domain);
    return this;
  }

  private void checkFrozen() {
    if (frozen)
      throw new AlreadyElaboratedException("Cannot modify a module that has already been elaborated", SrcLoc.capture());
  }

  private void addStatements(List<Statement> stmts, String domain) {
    checkContext("Statements", null);
    flushCtrl();
    for (Statement stmt : stmts) {
      if (!(stmt instanceof Assign || stmt instanceof Property || stmt instanceof Print || stmt instanceof LateBoundStatement))
        throw new HdlSyntaxError("Only assignments, prints, and property checks may be appended to d." + domain, stmt.getSrcLoc());
      for (Signal signal : stmt.lhsSignals()) {
        String current = driving.get(signal);
        if (current == null) {
          driving.put(signal, domain);
          drivingSrcLocs.put(signal, stmt.getSrcLoc());
        } else if (!current.equals(domain)) {
          throw new DriverConflictException("Driver-driver conflict: trying to drive " + signal + " from d." + domain +
                                                ", but it is already driven from d." + current,
                                            stmt.getSrcLoc(), drivingSrcLocs.get(signal));
        }
      }
      statements.computeIfAbsent(domain, d -> new ArrayList<>()).add(stmt);
    }
  }

  //// Control stack ////

  private void checkContext(String construct, String context) {
    checkFrozen();
    if (ctrlContext == null ? context == null : ctrlContext.equals(context))
      return;
    if (ctrlContext == null)
      throw new HdlSyntaxError(construct + " is not permitted outside of " + context, SrcLoc.capture());
    String secondary = ctrlContext.equals("Switch") ? "Case" : "State";
    throw new HdlSyntaxError(construct + " is not permitted directly inside of " + ctrlContext + "; it is permitted inside of " +
                                 ctrlContext + " " + secondary,
                             SrcLoc.capture());
  }

  private ControlBlock topCtrl() { return ctrlStack.isEmpty() ? null : ctrlStack.get(ctrlStack.size() - 1); }

  private void flushCtrl() {
    while (ctrlStack.size() > depth)
      popCtrl();
  }

  private <T extends ControlBlock> T pushCtrl(T block) {
    flushCtrl();
    ctrlStack.add(block);
    return block;
  }

  private void openBody(String construct, Value test, List<String> patterns, String stateName, SrcLoc loc) {
    openBodies.add(new OpenBody(construct, statements, test, patterns, stateName, loc));
    statements = new LinkedHashMap<>();
  }

  private OpenBody closeBody(String construct) {
    checkFrozen();
    if (openBodies.isEmpty())
      throw new HdlSyntaxError("end" + construct + " without matching begin" + construct, SrcLoc.capture());
    OpenBody body = openBodies.get(openBodies.size() - 1);
    if (!body.construct.equals(construct))
      throw new HdlSyntaxError("end" + construct + " called while a " + body.construct + " block is open", SrcLoc.capture());
    openBodies.remove(openBodies.size() - 1);
    return body;
  }

  //// If / Elif / Else ////

  public void beginIf(Object cond) {
    checkContext("If", null);
    Value test = Value.cast(cond);
    SrcLoc loc = SrcLoc.capture();
    pushCtrl(new IfBlock(depth, loc));
    openBody("If", test, null, null, loc);
    ++depth;
  }

  public void endIf() { endIfBody("If"); }

  public void beginElif(Object cond) {
    checkContext("Elif", null);
    Value test = Value.cast(cond);
    SrcLoc loc = SrcLoc.capture();
    IfBlock block = currentIf();
    if (block == null || block.bodies.size() > block.tests.size())
      throw new HdlSyntaxError("Elif without preceding If", loc);
    openBody("Elif", test, null, null, loc);
    ++depth;
  }

  public void endElif() { endIfBody("Elif"); }

  public void beginElse() {
    checkContext("Else", null);
    SrcLoc loc = SrcLoc.capture();
    IfBlock block = currentIf();
    if (block == null || block.bodies.size() > block.tests.size())
      throw new HdlSyntaxError("Else without preceding If/Elif", loc);
    openBody("Else", null, null, null, loc);
    ++depth;
  }

  public void endElse() {
    OpenBody body = closeBody("Else");
    flushCtrl();
    IfBlock block = (IfBlock)topCtrl();
    block.bodies.add(statements);
    block.srcLocs.add(body.srcLoc);
    --depth;
    statements = body.outer;
    popCtrl();
  }

  private IfBlock currentIf() {
    ControlBlock top = topCtrl();
    if (top instanceof IfBlock && ((IfBlock)top).depth == depth)
      return (IfBlock)top;
    return null;
  }

  private void endIfBody(String construct) {
    OpenBody body = closeBody(construct);
    flushCtrl();
    IfBlock block = (IfBlock)topCtrl();
    block.tests.add(body.test);
    block.bodies.add(statements);
    block.srcLocs.add(body.srcLoc);
    --depth;
    statements = body.outer;
  }

  //// Switch / Case / Default ////

  public void beginSwitch(Object test) {
    checkContext("Switch", null);
    SrcLoc loc = SrcLoc.capture();
    pushCtrl(new SwitchBlock(Value.cast(test), loc));
    openBody("Switch", null, null, null, loc);
    ctrlContext = "Switch";
    ++depth;
  }

  public void endSwitch() {
    OpenBody body = closeBody("Switch");
    --depth;
    ctrlContext = null;
    statements = body.outer;
    popCtrl();
  }

  /** Opens a case that is taken if the test matches any of the patterns; with no patterns it is never taken. */
  public void beginCase(Object... patterns) {
    checkContext("Case", "Switch");
    SrcLoc loc = SrcLoc.capture();
    SwitchBlock block = (SwitchBlock)topCtrl();
    if (block.gotDefault)
      logger.warn("{}: A case defined after the default case will never be active", loc);
    List<String> normalized = Patterns.normalize(List.of(patterns), block.test.shape(), loc);
    openBody("Case", null, normalized, null, loc);
    ctrlContext = null;
  }

  public void endCase() {
    OpenBody body = closeBody("Case");
    flushCtrl();
    SwitchBlock block = (SwitchBlock)topCtrl();
    block.patterns.add(body.patterns);
    block.bodies.add(statements);
    block.srcLocs.add(body.srcLoc);
    ctrlContext = "Switch";
    statements = body.outer;
  }

  public void beginDefault() {
    checkContext("Default", "Switch");
    SrcLoc loc = SrcLoc.capture();
    SwitchBlock block = (SwitchBlock)topCtrl();
    if (block.gotDefault)
      logger.warn("{}: A case defined after the default case will never be active", loc);
    openBody("Default", null, null, null, loc);
    ctrlContext = null;
  }

  public void endDefault() {
    OpenBody body = closeBody("Default");
    flushCtrl();
    SwitchBlock block = (SwitchBlock)topCtrl();
    block.patterns.add(null);
    block.bodies.add(statements);
    block.srcLocs.add(body.srcLoc);
    block.gotDefault = true;
    ctrlContext = "Switch";
    statements = body.outer;
  }

  //// FSM ////

  public Fsm beginFsm() { return beginFsm(null, "sync", "fsm"); }

  /**
   * Opens a state machine block.
   * @param init Name of the initial state, or null to start in the first defined state
   * @param domain Domain of the state register; must not be {@code comb}
   * @param name Name of the FSM, used for its signals and to look it up among the generated objects
   */
  public Fsm beginFsm(String init, String domain, String name) {
    checkContext("FSM", null);
    SrcLoc loc = SrcLoc.capture();
    if (domain.equals("comb"))
      throw new DomainError("FSM may not be driven by the '" + domain + "' domain", loc);
    Fsm fsm = new Fsm(arena, name, init, domain, loc);
    pushCtrl(new FsmBlock(fsm));
    generated.put(name, fsm);
    openBody("FSM", null, null, null, loc);
    ctrlContext = "FSM";
    ++depth;
    return fsm;
  }

  public void endFsm() {
    OpenBody body = closeBody("FSM");
    Fsm fsm = ((FsmBlock)topCtrl()).fsm;
    --depth;
    ctrlContext = null;
    statements = body.outer;
    for (String stateName : fsm.encoding.keySet())
      if (!fsm.states.containsKey(stateName))
        throw new HdlNameError("FSM state '" + stateName + "' is referenced but not defined", fsm.getSrcLoc());
    if (fsm.getInit() != null && !fsm.states.containsKey(fsm.getInit()))
      throw new HdlNameError("FSM initial state '" + fsm.getInit() + "' is not defined", fsm.getSrcLoc());
    popCtrl();
  }

  public void beginState(String name) {
    checkContext("FSM State", "FSM");
    SrcLoc loc = SrcLoc.capture();
    Fsm fsm = ((FsmBlock)topCtrl()).fsm;
    if (fsm.states.containsKey(name))
      throw new HdlNameError("FSM state '" + name + "' is already defined", loc);
    fsm.encode(name);
    openBody("State", null, null, name, loc);
    ctrlContext = null;
  }

  public void endState() {
    OpenBody body = closeBody("State");
    flushCtrl();
    Fsm fsm = ((FsmBlock)topCtrl()).fsm;
    fsm.states.put(body.stateName, statements);
    fsm.stateSrcLocs.put(body.stateName, body.srcLoc);
    ctrlContext = "FSM";
    statements = body.outer;
  }

  /** Transitions the innermost enclosing FSM to the given state on the next clock edge. */
  public void next(String state) {
    checkFrozen();
    SrcLoc loc = SrcLoc.capture();
    if (!"FSM".equals(ctrlContext)) {
      for (int i = ctrlStack.size() - 1; i >= 0; --i) {
        if (ctrlStack.get(i) instanceof FsmBlock) {
          Fsm fsm = ((FsmBlock)ctrlStack.get(i)).fsm;
          if (!fsm.isClosed()) {
            fsm.encode(state);
            addStatements(List.of(new FsmNextStatement(fsm, state, loc)), fsm.getDomain());
            return;
          }
        }
      }
    }
    throw new HdlSyntaxError("next(...) is only permitted inside an FSM state", loc);
  }

  //// Closure variants ////

  public Module when(Object cond, Runnable body) {
    beginIf(cond);
    body.run();
    endIf();
    return this;
  }

  public Module elseWhen(Object cond, Runnable body) {
    beginElif(cond);
    body.run();
    endElif();
    return this;
  }

  public Module otherwise(Runnable body) {
    beginElse();
    body.run();
    endElse();
    return this;
  }

  /** Runs {@code cases}, which is expected to call {@link #caseOf} and {@link #defaultCase}, inside a switch on {@code test}. */
  public Module switchOn(Object test, Runnable cases) {
    beginSwitch(test);
    cases.run();
    endSwitch();
    return this;
  }

  public Module caseOf(List<?> patterns, Runnable body) {
    beginCase(patterns.toArray());
    body.run();
    endCase();
    return this;
  }

  public Module caseOf(Object pattern, Runnable body) { return caseOf(List.of(pattern), body); }

  public Module defaultCase(Runnable body) {
    beginDefault();
    body.run();
    endDefault();
    return this;
  }

  public Fsm fsm(String init, String domain, String name, Consumer<Fsm> states) {
    Fsm fsm = beginFsm(init, domain, name);
    states.accept(fsm);
    endFsm();
    return fsm;
  }

  public Module state(String name, Runnable body) {
    beginState(name);
    body.run();
    endState();
    return this;
  }

  //// Block compilation ////

  private void popCtrl() {
    ControlBlock block = ctrlStack.remove(ctrlStack.size() - 1);
    if (block instanceof IfBlock)
      compileIf((IfBlock)block);
    else if (block instanceof SwitchBlock)
      compileSwitch((SwitchBlock)block);
    else
      compileFsm(((FsmBlock)block).fsm);
  }

  private static Set<String> domainsOf(List<Map<String, List<Statement>>> bodies) {
    Set<String> result = new LinkedHashSet<>();
    for (Map<String, List<Statement>> body : bodies)
      result.addAll(body.keySet());
    return result;
  }

  /**
   * Branch {@code k} of {@code n} matches if its condition is set and all earlier conditions are clear,
   * so exactly one case applies for each combination of conditions.
   */
  static String ifPattern(int index, int count) { return "-".repeat(count - 1 - index) + "1" + "0".repeat(index); }

  private void compileIf(IfBlock block) {
    List<Value> tests = new ArrayList<>();
    for (Value test : block.tests)
      tests.add(test.width() == 1 ? test : test.bool());
    int count = tests.size();
    Value cat = Value.cat(tests.toArray());
    for (String domain : domainsOf(block.bodies)) {
      List<Switch.Case> cases = new ArrayList<>();
      for (int i = 0; i < block.bodies.size(); ++i) {
        List<String> patterns = i < count ? List.of(ifPattern(i, count)) : null;
        cases.add(new Switch.Case(patterns, block.bodies.get(i).getOrDefault(domain, List.of()), block.srcLocs.get(i)));
      }
      if (block.bodies.size() == count)
        cases.add(new Switch.Case(null, List.of(), block.srcLoc));
      statements.computeIfAbsent(domain, d -> new ArrayList<>()).add(new Switch(cat, cases, block.srcLoc));
    }
  }

  private void compileSwitch(SwitchBlock block) {
    for (String domain : domainsOf(block.bodies)) {
      List<Switch.Case> cases = new ArrayList<>();
      for (int i = 0; i < block.bodies.size(); ++i)
        cases.add(new Switch.Case(block.patterns.get(i), block.bodies.get(i).getOrDefault(domain, List.of()), block.srcLocs.get(i)));
      statements.computeIfAbsent(domain, d -> new ArrayList<>()).add(new Switch(block.test, cases, block.srcLoc));
    }
  }

  private void compileFsm(Fsm fsm) {
    String signalName = fsm.getName() + "_state";
    if (fsm.states.isEmpty()) {
      fsm.setState(arena.newSignal(0).name(signalName).build());
      return;
    }
    String init = fsm.getInit() != null ? fsm.getInit() : fsm.states.keySet().iterator().next();
    int initEnc = fsm.encoding.get(init);
    if (initEnc != 0) {
      for (Map.Entry<String, Integer> entry : fsm.encoding.entrySet()) {
        if (entry.getValue() == 0) {
          fsm.swapEncodings(init, entry.getKey());
          break;
        }
      }
    }
    Signal state = arena.newSignal(IntRange.of(0, fsm.encoding.size())).name(signalName).build();
    fsm.setState(state);
    logger.debug("FSM '{}' has {} states, initial state '{}'", fsm.getName(), fsm.encoding.size(), init);

    for (Map.Entry<String, Signal> entry : fsm.ongoing.entrySet())
      topCombStatements.add(new Assign(entry.getValue(), state.equalTo(Const.of(fsm.encoding.get(entry.getKey()), state.shape())), fsm.getSrcLoc()));

    List<Map<String, List<Statement>>> bodies = new ArrayList<>(fsm.states.values());
    for (String domain : domainsOf(bodies)) {
      List<Switch.Case> cases = new ArrayList<>();
      for (Map.Entry<String, Map<String, List<Statement>>> entry : fsm.states.entrySet()) {
        String pattern = Patterns.normalize(fsm.encoding.get(entry.getKey()), state.shape(), fsm.getSrcLoc());
        cases.add(new Switch.Case(List.of(pattern), entry.getValue().getOrDefault(domain, List.of()), fsm.stateSrcLocs.get(entry.getKey())));
      }
      statements.computeIfAbsent(domain, d -> new ArrayList<>()).add(new Switch(state, cases, fsm.getSrcLoc()));
    }
  }

  //// Submodules and domains ////

  public Module submodule(Object elaboratable) {
    checkElaboratable(elaboratable);
    checkFrozen();
    anonSubmodules.add(new Submodule(elaboratable, SrcLoc.capture()));
    return this;
  }

  public Module submodule(String name, Object elaboratable) {
    checkElaboratable(elaboratable);
    checkFrozen();
    if (name.isEmpty())
      throw new HdlNameError("Submodule name must not be empty", SrcLoc.capture());
    if (namedSubmodules.containsKey(name))
      throw new HdlNameError("Submodule named '" + name + "' already exists", SrcLoc.capture());
    namedSubmodules.put(name, new Submodule(elaboratable, SrcLoc.capture()));
    return this;
  }

  private static void checkElaboratable(Object obj) {
    if (!(obj instanceof Elaboratable || obj instanceof Fragment))
      throw new HdlSyntaxError("Trying to add " + obj + ", which does not implement elaborate(), as a submodule", SrcLoc.capture());
  }

  public Object getSubmodule(String name) {
    Submodule sub = namedSubmodules.get(name);
    if (sub == null)
      throw new HdlNameError("No submodule named '" + name + "' exists", SrcLoc.capture());
    return sub.elaboratable();
  }

  public Module addDomain(ClockDomain domain) {
    if (domains.containsKey(domain.getName()))
      throw new HdlNameError("Clock domain named '" + domain.getName() + "' already exists", domain.getSrcLoc());
    checkFrozen();
    domains.put(domain.getName(), domain);
    return this;
  }

  //// Elaboration ////

  @Override
  public Fragment elaborate() {
    if (!openBodies.isEmpty())
      throw new HdlSyntaxError(openBodies.get(openBodies.size() - 1).construct + " block is still open", srcLoc);
    while (!ctrlStack.isEmpty())
      popCtrl();
    frozen = true;

    Fragment fragment = new Fragment(srcLoc);
    namedSubmodules.forEach((name, sub) -> fragment.addSubfragment(Fragment.get(sub.elaboratable()), name, sub.srcLoc()));
    for (Submodule sub : anonSubmodules)
      fragment.addSubfragment(Fragment.get(sub.elaboratable()), null, sub.srcLoc());
    statements.forEach((domain, stmts) -> fragment.addStatements(domain, LateBoundStatement.resolveAll(stmts)));
    if (!topCombStatements.isEmpty())
      fragment.addStatements("comb", topCombStatements);
    fragment.addDomains(domains.values());
    generated.forEach(fragment::addGenerated);
    return fragment;
  }
}
