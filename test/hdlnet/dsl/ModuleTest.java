package hdlnet.dsl;

import hdlnet.ast.Assign;
import hdlnet.ast.Signal;
import hdlnet.ast.SignalArena;
import hdlnet.ast.Statement;
import hdlnet.ast.Switch;
import hdlnet.error.AlreadyElaboratedException;
import hdlnet.error.DriverConflictException;
import hdlnet.error.HdlNameError;
import hdlnet.error.HdlSyntaxError;
import hdlnet.ir.Fragment;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ModuleTest {
  private SignalArena arena;
  private Module m;
  private Signal a;
  private Signal b;
  private Signal x;

  @BeforeEach
  void setUp() {
    arena = new SignalArena();
    m = new Module(arena);
    a = arena.signal(1, "a");
    b = arena.signal(1, "b");
    x = arena.signal(4, "x");
  }

  @Test
  void testIfPatterns() {
    Assertions.assertEquals("--1", Module.ifPattern(0, 3));
    Assertions.assertEquals("-10", Module.ifPattern(1, 3));
    Assertions.assertEquals("100", Module.ifPattern(2, 3));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3, 4, 5})
  void testIfPatternsAreExclusive(int count) {
    for (int value = 0; value < (1 << count); ++value) {
      int matching = 0;
      for (int i = 0; i < count; ++i) {
        String pattern = Module.ifPattern(i, count);
        boolean match = true;
        for (int bit = 0; bit < count; ++bit) {
          char c = pattern.charAt(count - 1 - bit);
          if (c != '-' && (c == '1') != (((value >> bit) & 1) == 1))
            match = false;
        }
        if (match)
          ++matching;
      }
      Assertions.assertEquals(value == 0 ? 0 : 1, matching);
    }
  }

  @Test
  void testIfElseCompilesToSwitch() {
    m.when(a, () -> m.comb(x.assign(1)));
    m.otherwise(() -> m.comb(x.assign(2)));
    Fragment frag = m.elaborate();
    List<Statement> comb = frag.getStatements().get("comb");
    Assertions.assertEquals(1, comb.size());
    Switch sw = (Switch)comb.get(0);
    Assertions.assertEquals(2, sw.getCases().size());
    Assertions.assertEquals(List.of("1"), sw.getCases().get(0).patterns());
    Assertions.assertNull(sw.getCases().get(1).patterns());
  }

  @Test
  void testIfWithoutElseGetsDefault() {
    m.when(a, () -> m.comb(x.assign(1)));
    m.elseWhen(b, () -> m.comb(x.assign(2)));
    Fragment frag = m.elaborate();
    Switch sw = (Switch)frag.getStatements().get("comb").get(0);
    Assertions.assertEquals(3, sw.getCases().size());
    Assertions.assertEquals(List.of("-1"), sw.getCases().get(0).patterns());
    Assertions.assertEquals(List.of("10"), sw.getCases().get(1).patterns());
    Assertions.assertTrue(sw.getCases().get(2).body().isEmpty());
  }

  @Test
  void testSeparateIfChains() {
    m.when(a, () -> m.comb(x.assign(1)));
    m.comb(b.assign(1));
    Assertions.assertThrows(HdlSyntaxError.class, () -> m.beginElif(b));
    Assertions.assertThrows(HdlSyntaxError.class, () -> m.beginElse());
  }

  @Test
  void testOneSwitchPerDomain() {
    Signal r = arena.signal(4, "r");
    m.when(a, () -> {
      m.comb(x.assign(1));
      m.sync(r.assign(2));
    });
    Fragment frag = m.elaborate();
    Assertions.assertTrue(frag.getStatements().get("comb").get(0) instanceof Switch);
    Assertions.assertTrue(frag.getStatements().get("sync").get(0) instanceof Switch);
  }

  @Test
  void testSwitchContext() {
    Assertions.assertThrows(HdlSyntaxError.class, () -> m.beginCase(0));
    m.beginSwitch(x);
    Assertions.assertThrows(HdlSyntaxError.class, () -> m.comb(a.assign(1)));
    Assertions.assertThrows(HdlSyntaxError.class, () -> m.beginIf(a));
    m.beginCase(1, "001-");
    m.comb(a.assign(1));
    m.endCase();
    m.beginDefault();
    m.comb(a.assign(0));
    m.endDefault();
    m.endSwitch();
    Fragment frag = m.elaborate();
    Switch sw = (Switch)frag.getStatements().get("comb").get(0);
    Assertions.assertEquals(List.of("0001", "001-"), sw.getCases().get(0).patterns());
  }

  @Test
  void testUnbalancedEnd() {
    Assertions.assertThrows(HdlSyntaxError.class, () -> m.endIf());
    m.beginIf(a);
    Assertions.assertThrows(HdlSyntaxError.class, () -> m.endSwitch());
  }

  @Test
  void testOpenBlockAtElaboration() {
    m.beginIf(a);
    Assertions.assertThrows(HdlSyntaxError.class, () -> m.elaborate());
  }

  @Test
  void testDomainConflict() {
    m.comb(x.assign(1));
    DriverConflictException e = Assertions.assertThrows(DriverConflictException.class, () -> m.sync(x.assign(2)));
    Assertions.assertTrue(e.getMessage().contains("d.comb"));
  }

  @Test
  void testFrozenAfterElaboration() {
    m.comb(x.assign(1));
    m.elaborate();
    Assertions.assertThrows(AlreadyElaboratedException.class, () -> m.comb(a.assign(1)));
    Assertions.assertThrows(AlreadyElaboratedException.class, () -> m.submodule(new Module(arena)));
  }

  @Test
  void testSubmodules() {
    Module sub = new Module(arena);
    m.submodule("sub", sub);
    Assertions.assertSame(sub, m.getSubmodule("sub"));
    Assertions.assertThrows(HdlNameError.class, () -> m.submodule("sub", new Module(arena)));
    Assertions.assertThrows(HdlNameError.class, () -> m.getSubmodule("other"));
    Assertions.assertThrows(HdlSyntaxError.class, () -> m.submodule("bad", "not a module"));
    Fragment frag = m.elaborate();
    Assertions.assertEquals("sub", frag.getSubfragments().get(0).name());
  }

  @Test
  void testFsmEncoding() {
    Fsm fsm = m.fsm("RUN", "sync", "ctl", f -> {
      m.state("IDLE", () -> m.when(a, () -> m.next("RUN")));
      m.state("RUN", () -> m.next("IDLE"));
    });
    Assertions.assertEquals(0, fsm.getEncoding().get("RUN"));
    Assertions.assertEquals(1, fsm.getEncoding().get("IDLE"));
    Signal state = fsm.getState();
    Assertions.assertEquals(1, state.width());
    Assertions.assertEquals(BigInteger.ZERO, state.getInit());
    Assertions.assertEquals("ctl_state", state.getName());

    Fragment frag = m.elaborate();
    Switch sw = (Switch)frag.getStatements().get("sync").get(0);
    Assertions.assertEquals(2, sw.getCases().size());
    Assertions.assertEquals(List.of("1"), sw.getCases().get(0).patterns());
    Statement transition = sw.getCases().get(1).body().get(0);
    Assertions.assertTrue(transition instanceof Assign);
    Assertions.assertSame(state, ((Assign)transition).getLhs());
    Assertions.assertSame(fsm, frag.findGenerated("ctl"));
  }

  @Test
  void testFsmOngoing() {
    Fsm fsm = m.fsm(null, "sync", "fsm", f -> {
      m.state("A", () -> m.next("B"));
      m.state("B", () -> m.next("A"));
    });
    Signal inA = fsm.ongoing("A");
    Fragment frag = m.elaborate();
    List<Statement> comb = frag.getStatements().get("comb");
    Assertions.assertEquals(2, comb.size());
    Assertions.assertSame(inA, ((Assign)comb.get(0)).getLhs());
  }

  @Test
  void testFsmErrors() {
    Assertions.assertThrows(HdlSyntaxError.class, () -> m.next("A"));
    Assertions.assertThrows(hdlnet.error.DomainError.class, () -> m.beginFsm(null, "comb", "fsm"));

    Module undefined = new Module(arena);
    Assertions.assertThrows(HdlNameError.class,
                            () -> undefined.fsm(null, "sync", "fsm", f -> undefined.state("A", () -> undefined.next("MISSING"))));

    Module duplicate = new Module(arena);
    duplicate.beginFsm();
    duplicate.state("A", () -> {});
    Assertions.assertThrows(HdlNameError.class, () -> duplicate.beginState("A"));
  }
}
