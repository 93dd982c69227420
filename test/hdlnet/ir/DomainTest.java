package hdlnet.ir;

import hdlnet.ast.Assign;
import hdlnet.ast.ClockSignal;
import hdlnet.ast.Const;
import hdlnet.ast.Operator;
import hdlnet.ast.Property;
import hdlnet.ast.ResetSignal;
import hdlnet.ast.Signal;
import hdlnet.ast.SignalArena;
import hdlnet.ast.Statement;
import hdlnet.ast.Switch;
import hdlnet.ast.Value;
import hdlnet.error.DomainError;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DomainTest {
  private SignalArena arena;

  @BeforeEach
  void setUp() {
    arena = new SignalArena();
  }

  @Test
  void testMissingDomainIsCreated() {
    Signal r = arena.signal(1, "r");
    Fragment top = new Fragment();
    top.addStatements("sync", r.assign(1));
    Design design = top.prepare(List.of());
    ClockDomain sync = top.getDomains().get("sync");
    Assertions.assertNotNull(sync);
    Assertions.assertEquals(2, design.getPorts().size());
    Assertions.assertEquals("clk", design.getPorts().get(0).name());
    Assertions.assertSame(sync.getClk(), design.getPorts().get(0).signal());
    Assertions.assertEquals(PortDirection.INPUT, design.getPorts().get(0).direction());
    Assertions.assertEquals("rst", design.getPorts().get(1).name());
  }

  @Test
  void testMissingDomainWithoutResolver() {
    Signal r = arena.signal(1, "r");
    Fragment top = new Fragment();
    top.addStatements("sync", r.assign(1));
    Assertions.assertThrows(DomainError.class, () -> top.prepare(List.of(), MissingDomainResolver.none(), true));
  }

  @Test
  void testResolverMustReturnRequestedDomain() {
    Signal r = arena.signal(1, "r");
    Fragment top = new Fragment();
    top.addStatements("fast", r.assign(1));
    Assertions.assertThrows(DomainError.class, () -> top.prepare(List.of(), name -> new ClockDomain(arena, "slow"), true));
  }

  @Test
  void testDomainsPropagateDown() {
    Signal r = arena.signal(1, "r");
    ClockDomain sync = new ClockDomain(arena, "sync");
    Fragment sub = new Fragment();
    sub.addStatements("sync", r.assign(1));
    Fragment top = new Fragment();
    top.addDomains(sync);
    top.addSubfragment(sub, "sub");
    Design design = top.prepare(List.of());
    Assertions.assertSame(sync, sub.getDomains().get("sync"));
    Assertions.assertTrue(design.getPorts().isEmpty());
  }

  @Test
  void testDomainsPropagateUp() {
    Signal r = arena.signal(1, "r");
    ClockDomain local = new ClockDomain(arena, "pix");
    Fragment sub = new Fragment();
    sub.addDomains(local);
    Fragment other = new Fragment();
    other.addStatements("pix", r.assign(1));
    Fragment top = new Fragment();
    top.addSubfragment(sub, "sub");
    top.addSubfragment(other, "other");
    top.prepare(List.of(), MissingDomainResolver.none(), true);
    Assertions.assertSame(local, top.getDomains().get("pix"));
    Assertions.assertSame(local, other.getDomains().get("pix"));
  }

  @Test
  void testConflictingChildDomainsAreRenamed() {
    Signal p = arena.signal(1, "p");
    Signal q = arena.signal(1, "q");
    ClockDomain syncA = new ClockDomain(arena, "sync");
    ClockDomain syncB = new ClockDomain(arena, "sync");
    Fragment a = new Fragment();
    a.addDomains(syncA);
    a.addStatements("sync", p.assign(1));
    Fragment b = new Fragment();
    b.addDomains(syncB);
    b.addStatements("sync", q.assign(1));
    Fragment top = new Fragment();
    top.addSubfragment(a, "a");
    top.addSubfragment(b, "b");
    top.prepare(List.of(), MissingDomainResolver.none(), true);
    Assertions.assertSame(syncA, top.getDomains().get("a_sync"));
    Assertions.assertSame(syncB, top.getDomains().get("b_sync"));
    Assertions.assertEquals("a_sync_clk", syncA.getClk().getName());
    Assertions.assertTrue(a.getStatements().containsKey("a_sync"));
  }

  @Test
  void testConflictingUnnamedChildDomains() {
    Fragment a = new Fragment();
    a.addDomains(new ClockDomain(arena, "sync"));
    Fragment b = new Fragment();
    b.addDomains(new ClockDomain(arena, "sync"));
    Fragment top = new Fragment();
    top.addSubfragment(a, null);
    top.addSubfragment(b, "b");
    Assertions.assertThrows(DomainError.class, () -> top.prepare(List.of()));
  }

  @Test
  void testDomainRenamer() {
    Signal r = arena.signal(1, "r");
    ClockDomain sync = new ClockDomain(arena, "sync");
    Fragment frag = new Fragment();
    frag.addDomains(sync);
    frag.addStatements("sync", r.assign(1));
    new DomainRenamer(Map.of("sync", "fast")).apply(frag);
    Assertions.assertEquals(List.of("fast"), List.copyOf(frag.getDomains().keySet()));
    Assertions.assertTrue(frag.getStatements().containsKey("fast"));
    Assertions.assertEquals("fast_clk", sync.getClk().getName());
    Assertions.assertEquals("fast_rst", sync.getRst().getName());
    Assertions.assertThrows(DomainError.class, () -> new DomainRenamer(Map.of("comb", "sync")));
  }

  @Test
  void testPlaceholdersAreLowered() {
    Signal c = arena.signal(1, "c");
    Signal r = arena.signal(1, "r");
    ClockDomain sync = new ClockDomain(arena, "sync");
    Fragment frag = new Fragment();
    frag.addDomains(sync);
    frag.addStatements("comb", c.assign(new ClockSignal("sync")), r.assign(new ResetSignal("sync", false)));
    frag.prepare(List.of());
    List<?> stmts = frag.getStatements().get("comb");
    Assertions.assertSame(sync.getClk(), ((Assign)stmts.get(0)).getRhs());
    Assertions.assertSame(sync.getRst(), ((Assign)stmts.get(1)).getRhs());
  }

  @Test
  void testResetOfResetLessDomain() {
    Signal r = arena.signal(1, "r");
    ClockDomain sync = new ClockDomain(arena, "sync", ClockDomain.ClockEdge.POS, true, false, false);
    Fragment frag = new Fragment();
    frag.addDomains(sync);
    frag.addStatements("comb", r.assign(new ResetSignal("sync", false)));
    Assertions.assertThrows(DomainError.class, () -> frag.prepare(List.of()));
  }

  @Test
  void testCombCannotBeClocked() {
    Assertions.assertThrows(DomainError.class, () -> new ClockDomain(arena, "comb"));
    Assertions.assertThrows(DomainError.class, () -> new ClockSignal("comb"));
  }

  @Test
  void testResetInserterLoadsInitialValues() {
    Signal ctl = arena.signal(1, "ctl");
    Signal r = arena.signal(4, "r", 5);
    Signal q = arena.newSignal(1).name("q").resetLess(true).build();
    Signal c = arena.signal(1, "c");
    Signal s = arena.signal(1, "s");
    Fragment sub = new Fragment();
    sub.addStatements("sync", s.assign(1));
    Fragment top = new Fragment();
    top.addStatements("sync", r.assign(1), q.assign(1));
    top.addStatements("comb", c.assign(1));
    top.addSubfragment(sub, "sub");

    new ResetInserter(ctl).apply(top);

    List<Statement> sync = top.getStatements().get("sync");
    Assertions.assertEquals(3, sync.size());
    Switch sw = (Switch)sync.get(2);
    Assertions.assertSame(ctl, sw.getTest());
    Assertions.assertEquals(List.of("1"), sw.getCases().get(0).patterns());
    List<Statement> body = sw.getCases().get(0).body();
    Assertions.assertEquals(1, body.size());
    Assign reset = (Assign)body.get(0);
    Assertions.assertSame(r, reset.getLhs());
    Assertions.assertEquals(5, ((Const)reset.getRhs()).getValue().intValue());
    Assertions.assertEquals(4, reset.getRhs().width());

    Assertions.assertEquals(1, top.getStatements().get("comb").size());
    List<Statement> subSync = sub.getStatements().get("sync");
    Assertions.assertEquals(2, subSync.size());
    Assertions.assertTrue(subSync.get(1) instanceof Switch);
  }

  @Test
  void testResetInserterOnlyTouchesNamedDomains() {
    Signal ctl = arena.signal(1, "ctl");
    Signal r = arena.signal(1, "r");
    Fragment frag = new Fragment();
    frag.addStatements("sync", r.assign(1));
    frag.addStatements("pix", r.assign(0));
    new ResetInserter(Map.of("pix", ctl)).apply(frag);
    Assertions.assertEquals(1, frag.getStatements().get("sync").size());
    Assertions.assertEquals(2, frag.getStatements().get("pix").size());
  }

  @Test
  void testEnableInserterWrapsDomainStatements() {
    Signal en = arena.signal(1, "en");
    Signal r = arena.signal(4, "r");
    Fragment frag = new Fragment();
    frag.addStatements("sync", r.assign(r.add(1).slice(0, 4)), Property.assertion(r.notEqualTo(3)));
    new EnableInserter(en).apply(frag);

    List<Statement> sync = frag.getStatements().get("sync");
    Assertions.assertEquals(1, sync.size());
    Switch sw = (Switch)sync.get(0);
    Assertions.assertSame(en, sw.getTest());
    Assertions.assertEquals(List.of("1"), sw.getCases().get(0).patterns());
    Assertions.assertEquals(2, sw.getCases().get(0).body().size());
    Assertions.assertTrue(sw.getCases().get(0).body().get(1) instanceof Property);
    Assertions.assertEquals(Set.of(r), sw.lhsSignals());
  }

  @Test
  void testEnableInserterGatesMemoryPorts() {
    Signal en = arena.signal(1, "en");
    Signal addr = arena.signal(2, "addr");
    Signal wdata = arena.signal(8, "wdata");
    Signal wen = arena.signal(2, "wen");
    Signal rdata = arena.signal(8, "rdata");
    Signal rdataComb = arena.signal(8, "rdata_comb");
    MemoryInstance mem = new MemoryInstance(8, 4, null);
    mem.addWritePort("sync", addr, wdata, wen);
    mem.addReadPort("sync", addr, rdata, 1, List.of());
    mem.addReadPort(addr, rdataComb);
    Fragment top = new Fragment();
    top.addSubfragment(mem, "mem");

    new EnableInserter(en).apply(top);

    Value writeEn = mem.getWritePorts().get(0).en();
    Assertions.assertEquals("m", ((Operator)writeEn).getOperator());
    Assertions.assertEquals(2, writeEn.width());
    Assertions.assertSame(en, writeEn.operands().get(0));
    Assertions.assertSame(wen, writeEn.operands().get(1));
    Value readEn = mem.getReadPorts().get(0).en();
    Assertions.assertEquals("&", ((Operator)readEn).getOperator());
    Assertions.assertSame(en, readEn.operands().get(1));
    Assertions.assertTrue(mem.getReadPorts().get(1).en() instanceof Const);
  }

  @Test
  void testControlsCannotTargetComb() {
    Signal ctl = arena.signal(1, "ctl");
    Assertions.assertThrows(DomainError.class, () -> new ResetInserter(Map.of("comb", ctl)));
    Assertions.assertThrows(DomainError.class, () -> new EnableInserter(Map.of("comb", ctl)));
  }

  @Test
  void testMultiBitControlIsReduced() {
    Signal ctl = arena.signal(3, "ctl");
    Signal r = arena.signal(1, "r");
    Fragment frag = new Fragment();
    frag.addStatements("sync", r.assign(1));
    new EnableInserter(ctl).apply(frag);
    Switch sw = (Switch)frag.getStatements().get("sync").get(0);
    Assertions.assertEquals(1, sw.getTest().width());
    Assertions.assertEquals("b", ((Operator)sw.getTest()).getOperator());
  }
}
