package hdlnet.ast;

import hdlnet.error.HdlSyntaxError;
import hdlnet.error.ShapeError;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ValueTest {
  private SignalArena arena;
  private Signal a;
  private Signal b;
  private Signal s;

  @BeforeEach
  void setUp() {
    arena = new SignalArena();
    a = arena.signal(4, "a");
    b = arena.signal(8, "b");
    s = arena.signal(Shape.signed(6), "s");
  }

  @Test
  void testArithmeticShapes() {
    Assertions.assertEquals(Shape.unsigned(9), a.add(b).shape());
    Assertions.assertEquals(Shape.signed(9), a.sub(b).shape());
    Assertions.assertEquals(Shape.signed(7), a.add(s).shape());
    Assertions.assertEquals(Shape.unsigned(12), a.mul(b).shape());
    Assertions.assertEquals(Shape.signed(10), a.mul(s).shape());
    Assertions.assertEquals(Shape.unsigned(4), a.floorDiv(b).shape());
    Assertions.assertEquals(Shape.signed(5), a.floorDiv(s).shape());
    Assertions.assertEquals(Shape.unsigned(8), a.mod(b).shape());
    Assertions.assertEquals(Shape.signed(5), a.neg().shape());
  }

  @Test
  void testLogicShapes() {
    Assertions.assertEquals(Shape.unsigned(4), a.invert().shape());
    Assertions.assertEquals(Shape.unsigned(8), a.bitAnd(b).shape());
    Assertions.assertEquals(Shape.signed(6), a.bitXor(s).shape());
    Assertions.assertEquals(Shape.unsigned(1), a.any().shape());
    Assertions.assertEquals(Shape.unsigned(1), a.lessThan(b).shape());
    Assertions.assertEquals(Shape.unsigned(6), s.asUnsigned().shape());
    Assertions.assertEquals(Shape.signed(4), a.asSigned().shape());
  }

  @Test
  void testShiftShapes() {
    Signal amount = arena.signal(2, "amount");
    Assertions.assertEquals(Shape.unsigned(7), a.shl(amount).shape());
    Assertions.assertEquals(Shape.unsigned(4), a.shr(amount).shape());
    Assertions.assertThrows(ShapeError.class, () -> a.shl(s));
    Assertions.assertEquals(Shape.unsigned(6), a.shiftLeft(2).shape());
    Assertions.assertEquals(Shape.unsigned(2), a.shiftRight(2).shape());
    Assertions.assertEquals(Shape.signed(1), s.shiftRight(10).shape());
    Assertions.assertEquals(Shape.unsigned(4), a.rotateLeft(5).shape());
  }

  @Test
  void testMuxShape() {
    Value mux = Value.mux(b, a, s);
    Assertions.assertEquals(Shape.signed(6), mux.shape());
    Assertions.assertEquals("b", ((Operator)mux.operands().get(0)).getOperator());
  }

  @Test
  void testSlicing() {
    Slice top = (Slice)b.slice(-3, 8);
    Assertions.assertEquals(5, top.getStart());
    Assertions.assertEquals(8, top.getStop());
    Slice last = (Slice)b.bit(-1);
    Assertions.assertEquals(7, last.getStart());
    Assertions.assertThrows(ShapeError.class, () -> b.bit(8));
    Assertions.assertEquals(Shape.unsigned(8), b.slice(0, 100).shape());
    Value even = b.slice(null, null, 2);
    Assertions.assertTrue(even instanceof Concat);
    Assertions.assertEquals(4, even.width());
    Assertions.assertEquals(4, b.slice(null, null, -2).width());
  }

  @Test
  void testBitSelect() {
    Assertions.assertTrue(b.bitSelect(2, 3) instanceof Slice);
    Value part = b.wordSelect(a, 2);
    Assertions.assertTrue(part instanceof Part);
    Assertions.assertEquals(2, ((Part)part).getStride());
    Assertions.assertEquals(2, part.width());
    Assertions.assertThrows(ShapeError.class, () -> b.bitSelect(s, 2));
  }

  @Test
  void testCatAndReplicate() {
    Value cat = Value.cat(a, b, List.of(a, a));
    Assertions.assertEquals(Shape.unsigned(20), cat.shape());
    Assertions.assertEquals(12, a.replicate(3).width());
    Assertions.assertEquals(0, a.replicate(0).width());
  }

  @Test
  void testMatches() {
    Value exact = a.matches("1010");
    Assertions.assertEquals("==", ((Operator)exact).getOperator());
    Value masked = a.matches("1-0-");
    Assertions.assertEquals("&", ((Operator)masked.operands().get(0)).getOperator());
    Value either = a.matches(1, 2);
    Assertions.assertEquals("r|", ((Operator)either).getOperator());
    Assertions.assertThrows(HdlSyntaxError.class, () -> a.matches("101"));
    Assertions.assertThrows(HdlSyntaxError.class, () -> a.matches("10x1"));
  }

  @Test
  void testDeadPatternIsConstFalse() {
    Value never = a.matches(16);
    Assertions.assertTrue(never instanceof Const);
    Assertions.assertEquals(0, ((Const)never).getValue().intValue());
  }

  @Test
  void testPatternNormalization() {
    Assertions.assertEquals(List.of("0101", "1--0"), Patterns.normalize(List.of(5, "1- -0"), Shape.unsigned(4), null));
    Assertions.assertEquals("1111", Patterns.normalize(-1, Shape.signed(4), null));
  }

  @Test
  void testAssignability() {
    Assertions.assertTrue(a.isAssignable());
    Assertions.assertTrue(Value.cat(a, b.slice(0, 2)).isAssignable());
    Assertions.assertTrue(a.asSigned().isAssignable());
    Assertions.assertFalse(a.add(1).isAssignable());
    Assertions.assertThrows(HdlSyntaxError.class, () -> a.add(1).assign(0));
    Assertions.assertThrows(HdlSyntaxError.class, () -> Const.of(1).assign(0));
  }

  @Test
  void testSignalSets() {
    Assign assign = Value.cat(a, b.bit(0)).assign(s.add(a));
    Assertions.assertEquals(List.of(a, b), List.copyOf(assign.lhsSignals()));
    Assertions.assertEquals(List.of(s, a), List.copyOf(assign.rhsSignals()));
  }

  @Test
  void testSignalIdentity() {
    Signal twin = arena.signal(4, "a");
    Assertions.assertNotEquals(a, twin);
    Assertions.assertEquals(a.getIndex() + 3, twin.getIndex());
    Assertions.assertEquals("sig$4", arena.newSignal(1).build().getName());
  }

  @Test
  void testSignalInit() {
    Assertions.assertEquals(3, arena.signal(4, "x", 3).getInit().intValue());
    Assertions.assertEquals(15, arena.signal(4, "y", -1).getInit().intValue());
    Assertions.assertEquals(-1, arena.signal(Shape.signed(4), "z", 15).getInit().intValue());
  }

  @Test
  void testSwitchValueShape() {
    SwitchValue sel = SwitchValue.on(a).when(b, 0, 1).when(s, "1---").otherwise(0).build();
    Assertions.assertEquals(Shape.signed(9), sel.shape());
    Assertions.assertEquals(List.of("0000", "0001"), sel.getCases().get(0).patterns());
    Assertions.assertNull(sel.getCases().get(2).patterns());
  }
}
