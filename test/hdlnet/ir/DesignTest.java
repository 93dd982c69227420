package hdlnet.ir;

import hdlnet.ast.Signal;
import hdlnet.ast.SignalArena;
import hdlnet.error.AlreadyElaboratedException;
import hdlnet.error.HdlNameError;
import hdlnet.error.ShapeError;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DesignTest {
  private SignalArena arena;

  @BeforeEach
  void setUp() {
    arena = new SignalArena();
  }

  @Test
  void testSignalLcaOfSiblings() {
    Signal x = arena.signal(4, "x");
    Signal p = arena.signal(4, "p");
    Signal q = arena.signal(4, "q");
    Fragment f1 = new Fragment();
    f1.addStatements("comb", p.assign(x));
    Fragment f2 = new Fragment();
    f2.addStatements("comb", q.assign(x));
    Fragment top = new Fragment();
    top.addSubfragment(f1, "f1");
    top.addSubfragment(f2, "f2");

    Design design = top.prepare(List.of());
    Assertions.assertSame(top, design.getSignalLca().get(x));
    Assertions.assertSame(f1, design.getSignalLca().get(p));
    Assertions.assertTrue(design.getUsedSignals(top).contains(x));
    Assertions.assertFalse(design.getUsedSignals(top).contains(p));
    Assertions.assertTrue(design.getUsedSignals(f2).contains(x));
  }

  @Test
  void testDeepUseIsRoutedThroughAncestors() {
    Signal x = arena.signal(1, "x");
    Signal y = arena.signal(1, "y");
    Fragment leaf = new Fragment();
    leaf.addStatements("comb", y.assign(x));
    Fragment middle = new Fragment();
    middle.addSubfragment(leaf, "leaf");
    Fragment top = new Fragment();
    top.addSubfragment(middle, "middle");

    Design design = top.prepare(List.of(PortSpec.of(x)));
    Assertions.assertSame(top, design.getSignalLca().get(x));
    Assertions.assertTrue(design.getUsedSignals(middle).contains(x));
    Assertions.assertEquals("x", design.getSignalNames(middle).get(x));
    Assertions.assertEquals(List.of("top", "middle", "leaf"), design.getFragmentName(leaf));
    Assertions.assertSame(middle, design.getParent(leaf));
  }

  @Test
  void testSignalNameCollision() {
    Signal x1 = arena.signal(2, "x");
    Signal x2 = arena.signal(2, "x");
    Fragment top = new Fragment();
    top.addStatements("comb", x1.assign(x2));
    Design design = top.prepare(List.of());
    Assertions.assertEquals("x", design.getSignalNames(top).get(x1));
    Assertions.assertEquals("x$1", design.getSignalNames(top).get(x2));
  }

  @Test
  void testPortNames() {
    Signal x = arena.signal(2, "x");
    Signal y = arena.signal(2, "y");
    Fragment top = new Fragment();
    top.addStatements("comb", y.assign(x));
    Design design = top.prepare(List.of(PortSpec.input("y", x), PortSpec.of(y)));
    Assertions.assertEquals("y", design.getPorts().get(0).name());
    Assertions.assertEquals(PortDirection.INPUT, design.getPorts().get(0).direction());
    Assertions.assertEquals("y$1", design.getPorts().get(1).name());
    Assertions.assertNull(design.getPorts().get(1).direction());
  }

  @Test
  void testSubfragmentNames() {
    Signal x = arena.signal(1, "x");
    Fragment top = new Fragment();
    top.addStatements("comb", x.assign(0));
    Fragment anonymous = new Fragment();
    Fragment clashing = new Fragment();
    top.addSubfragment(anonymous, null);
    top.addSubfragment(clashing, "x");
    Design design = top.prepare(List.of());
    Assertions.assertEquals(List.of("top", "U$0"), design.getFragmentName(anonymous));
    Assertions.assertEquals(List.of("top", "x$U$1"), design.getFragmentName(clashing));
  }

  @Test
  void testInvalidPorts() {
    Signal x = arena.signal(2, "x");
    Signal y = arena.signal(2, "y");
    Assertions.assertThrows(HdlNameError.class, () -> new Fragment().prepare(List.of(PortSpec.of("p", x), PortSpec.of("p", y))));
    Assertions.assertThrows(ShapeError.class, () -> new Fragment().prepare(List.of(PortSpec.of(x.add(1)))));
  }

  @Test
  void testFrozenAfterPrepare() {
    Signal x = arena.signal(2, "x");
    Fragment top = new Fragment();
    Fragment sub = new Fragment();
    top.addSubfragment(sub, "sub");
    top.prepare(List.of());
    Assertions.assertTrue(top.isFrozen());
    Assertions.assertThrows(AlreadyElaboratedException.class, () -> sub.addStatements("comb", x.assign(1)));
    Assertions.assertThrows(AlreadyElaboratedException.class, () -> top.prepare(List.of()));
  }
}
