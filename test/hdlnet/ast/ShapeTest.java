package hdlnet.ast;

import hdlnet.error.ShapeError;
import java.math.BigInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ShapeTest {

  enum Color { RED, GREEN, BLUE }

  enum Level implements EnumEncoded {
    LOW(-2),
    HIGH(5);

    private final long encoding;
    Level(long encoding) { this.encoding = encoding; }
    @Override
    public long encoding() {
      return encoding;
    }
  }

  @Test
  void testCastWidth() {
    Assertions.assertEquals(Shape.unsigned(8), Shape.cast(8));
    Assertions.assertEquals(Shape.unsigned(0), Shape.cast(0L));
    Assertions.assertThrows(ShapeError.class, () -> Shape.cast(-1));
    Assertions.assertThrows(ShapeError.class, () -> Shape.cast("8"));
  }

  @Test
  void testSignedZeroWidth() {
    Assertions.assertThrows(ShapeError.class, () -> Shape.signed(0));
  }

  @Test
  void testCastRange() {
    Assertions.assertEquals(Shape.unsigned(4), Shape.cast(IntRange.of(0, 16)));
    Assertions.assertEquals(Shape.unsigned(5), Shape.cast(IntRange.of(0, 17)));
    Assertions.assertEquals(Shape.signed(4), Shape.cast(IntRange.of(-5, 4)));
    Assertions.assertEquals(Shape.signed(3), Shape.cast(IntRange.of(-4, 0)));
    Assertions.assertEquals(Shape.unsigned(0), Shape.cast(IntRange.of(3, 3)));
  }

  @Test
  void testCastEnum() {
    Assertions.assertEquals(Shape.unsigned(2), Shape.cast(Color.class));
    Assertions.assertEquals(Shape.signed(4), Shape.cast(Level.class));
  }

  @Test
  void testCastableLoop() {
    ShapeCastable loop = new ShapeCastable() {
      @Override
      public Object asShape() {
        return this;
      }
      @Override
      public Const constOf(Object init) {
        return Const.of(0, 1);
      }
    };
    Assertions.assertThrows(ShapeError.class, () -> Shape.cast(loop));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 7, 8, 33})
  void testRangeRoundTrip(int width) {
    IntRange unsignedRange = Shape.unsigned(width).toRange();
    Assertions.assertEquals(BigInteger.ZERO, unsignedRange.start());
    Assertions.assertEquals(Shape.unsigned(width), Shape.cast(unsignedRange));
    Assertions.assertEquals(Shape.signed(width), Shape.cast(Shape.signed(width).toRange()));
  }

  @Test
  void testBitsFor() {
    Assertions.assertEquals(1, Shape.bitsFor(0));
    Assertions.assertEquals(1, Shape.bitsFor(1));
    Assertions.assertEquals(3, Shape.bitsFor(5));
    Assertions.assertEquals(4, Shape.bitsFor(-5));
    Assertions.assertEquals(4, Shape.bitsFor(BigInteger.valueOf(5), true));
  }

  @Test
  void testUnify() {
    Assertions.assertEquals(Shape.unsigned(8), Shape.unify(Shape.unsigned(4), Shape.unsigned(8)));
    Assertions.assertEquals(Shape.signed(5), Shape.unify(Shape.unsigned(4), Shape.signed(3)));
    Assertions.assertEquals(Shape.signed(8), Shape.unify(Shape.unsigned(4), Shape.signed(8)));
  }

  @Test
  void testConstNormalization() {
    Assertions.assertEquals(BigInteger.valueOf(-1), Const.of(15, Shape.signed(4)).getValue());
    Assertions.assertEquals(BigInteger.valueOf(15), Const.of(-1, 4).getValue());
    Assertions.assertEquals(BigInteger.valueOf(2), Const.of(18, 4).getValue());
    Assertions.assertEquals(Shape.signed(1), Const.of(-1).shape());
    Assertions.assertEquals(Shape.unsigned(1), Const.of(0).shape());
    Assertions.assertEquals(Shape.unsigned(3), Const.of(5).shape());
  }

  @Test
  void testConstCastEnum() {
    Const blue = Const.cast(Color.BLUE);
    Assertions.assertEquals(Shape.unsigned(2), blue.shape());
    Assertions.assertEquals(BigInteger.TWO, blue.getValue());
    Assertions.assertEquals(BigInteger.valueOf(-2), Const.cast(Level.LOW).getValue());
  }
}
