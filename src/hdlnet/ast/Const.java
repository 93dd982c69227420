package hdlnet.ast;

import hdlnet.error.ShapeError;
import java.math.BigInteger;
import java.util.List;

/**
 * A constant. The stored value is normalized to the shape: truncated to the width and,
 * for signed shapes, sign-extended from the top bit.
 */
public final class Const extends Value {
  private final BigInteger value;
  private final Shape shape;

  public Const(BigInteger value, Shape shape) { this(value, shape, null); }

  Const(BigInteger value, Shape shape, SrcLoc srcLoc) {
    super(srcLoc);
    this.shape = shape;
    this.value = normalize(value, shape);
  }

  /** A constant of the minimal shape holding {@code value}; negative values are signed. */
  public Const(BigInteger value) {
    this(value, new Shape(Shape.bitsFor(value, false), value.signum() < 0));
  }

  public static Const of(long value) { return new Const(BigInteger.valueOf(value)); }
  public static Const of(long value, Shape shape) { return new Const(BigInteger.valueOf(value), shape); }
  public static Const of(long value, int width) { return new Const(BigInteger.valueOf(value), Shape.unsigned(width)); }

  static BigInteger normalize(BigInteger value, Shape shape) {
    int width = shape.getWidth();
    BigInteger mask = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    BigInteger truncated = value.and(mask);
    if (shape.isSigned() && truncated.testBit(width - 1))
      return truncated.subtract(BigInteger.ONE.shiftLeft(width));
    return truncated;
  }

  /** Converts integers, booleans, enum members and constant expressions to a constant. */
  public static Const cast(Object obj) {
    if (obj instanceof Const)
      return (Const)obj;
    if (obj instanceof Boolean)
      return of((Boolean)obj ? 1 : 0, 1);
    if (obj instanceof Integer || obj instanceof Long)
      return of(((Number)obj).longValue());
    if (obj instanceof BigInteger)
      return new Const((BigInteger)obj);
    if (obj instanceof Enum<?>) {
      Enum<?> member = (Enum<?>)obj;
      return of(Shape.enumEncoding(member), Shape.cast(member.getDeclaringClass()));
    }
    if (obj instanceof Value)
      return castConstExpr((Value)obj);
    throw new ShapeError("Object " + obj + " cannot be converted to a constant");
  }

  /** Like {@link #cast(Object)}, then normalized to {@code shape}. */
  public static Const cast(Object obj, Shape shape) {
    return new Const(cast(obj).value, shape);
  }

  /** Folds concatenations and slices of constants; anything else is not a constant expression. */
  private static Const castConstExpr(Value value) {
    if (value instanceof Concat) {
      BigInteger result = BigInteger.ZERO;
      int offset = 0;
      for (Value part : ((Concat)value).getParts()) {
        BigInteger bits = castConstExpr(part).value.and(BigInteger.ONE.shiftLeft(part.width()).subtract(BigInteger.ONE));
        result = result.or(bits.shiftLeft(offset));
        offset += part.width();
      }
      return new Const(result, Shape.unsigned(offset));
    }
    if (value instanceof Slice) {
      Slice slice = (Slice)value;
      BigInteger inner = castConstExpr(slice.getBase()).value;
      return new Const(inner.shiftRight(slice.getStart()), Shape.unsigned(slice.getStop() - slice.getStart()));
    }
    if (value instanceof Operator && ((Operator)value).getOperator().matches("[us]")) {
      Const inner = castConstExpr(value.operands().get(0));
      return new Const(inner.value, value.shape());
    }
    throw new ShapeError("Value " + value + " cannot be converted to a constant");
  }

  public BigInteger getValue() { return value; }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public List<Value> operands() {
    return List.of();
  }

  @Override
  public String toString() {
    return "(const " + shape.getWidth() + "'" + (shape.isSigned() ? "sd" : "d") + value + ")";
  }
}
