package hdlnet.ast;

import hdlnet.error.ShapeError;
import java.math.BigInteger;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;

/**
 * Bit width and signedness of a value.
 * Immutable; signed shapes are at least one bit wide.
 */
public final class Shape {
  private final int width;
  private final boolean signed;

  public Shape(int width, boolean signed) {
    if (width < 0)
      throw new ShapeError("Width must be a non-negative integer, not " + width);
    if (signed && width == 0)
      throw new ShapeError("Width of a signed value must be at least 1");
    this.width = width;
    this.signed = signed;
  }

  public static Shape unsigned(int width) { return new Shape(width, false); }
  public static Shape signed(int width) { return new Shape(width, true); }

  public int getWidth() { return width; }
  public boolean isSigned() { return signed; }

  /**
   * Casts a shape-like object to a shape.
   * Accepts shapes, integer widths, {@link IntRange}s, enum classes and {@link ShapeCastable}s.
   * Castable adapters are followed until they produce a plain shape.
   */
  public static Shape cast(Object obj) {
    Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    while (true) {
      if (obj instanceof Shape) {
        return (Shape)obj;
      } else if (obj instanceof Integer || obj instanceof Long) {
        long width = ((Number)obj).longValue();
        if (width < 0 || width > Integer.MAX_VALUE)
          throw new ShapeError("Width must be a non-negative integer, not " + width);
        return unsigned((int)width);
      } else if (obj instanceof IntRange) {
        return fromRange((IntRange)obj);
      } else if (obj instanceof Class<?> && ((Class<?>)obj).isEnum()) {
        return fromEnum((Class<?>)obj);
      } else if (obj instanceof ShapeCastable) {
        if (!seen.add(obj))
          throw new ShapeError("Shape-castable object " + obj + " casts to itself");
        obj = ((ShapeCastable)obj).asShape();
        if (obj == null)
          throw new ShapeError("Shape-castable object returned null from asShape()");
      } else {
        throw new ShapeError("Object " + obj + " cannot be converted to a shape");
      }
    }
  }

  private static Shape fromRange(IntRange range) {
    if (range.isEmpty())
      return unsigned(0);
    boolean signed = range.start().signum() < 0 || range.last().signum() < 0;
    if (range.start().signum() == 0 && range.last().signum() == 0)
      return unsigned(0);
    int width = Math.max(bitsFor(range.start(), signed), bitsFor(range.last(), signed));
    return new Shape(width, signed);
  }

  private static Shape fromEnum(Class<?> enumClass) {
    Object[] members = enumClass.getEnumConstants();
    if (members.length == 0)
      return unsigned(0);
    BigInteger min = null, max = null;
    for (Object member : members) {
      BigInteger value = BigInteger.valueOf(enumEncoding((Enum<?>)member));
      min = (min == null || value.compareTo(min) < 0) ? value : min;
      max = (max == null || value.compareTo(max) > 0) ? value : max;
    }
    return fromRange(new IntRange(min, max.add(BigInteger.ONE)));
  }

  static long enumEncoding(Enum<?> member) {
    if (member instanceof EnumEncoded)
      return ((EnumEncoded)member).encoding();
    return member.ordinal();
  }

  /**
   * Number of bits needed to represent {@code value}.
   * Negative values and {@code requireSignBit} add room for a sign bit; zero needs one bit.
   */
  public static int bitsFor(BigInteger value, boolean requireSignBit) {
    if (value.signum() > 0)
      return value.bitLength() + (requireSignBit ? 1 : 0);
    return value.not().bitLength() + 1;
  }

  public static int bitsFor(long value) { return bitsFor(BigInteger.valueOf(value), false); }

  /** The range of integers this shape can represent. */
  public IntRange toRange() {
    if (signed) {
      BigInteger half = BigInteger.ONE.shiftLeft(width - 1);
      return new IntRange(half.negate(), half);
    }
    return new IntRange(BigInteger.ZERO, BigInteger.ONE.shiftLeft(width));
  }

  /**
   * The smallest shape that can represent all values of all the given shapes.
   * An unsigned shape mixed with signed ones needs one extra bit.
   */
  public static Shape unify(Shape... shapes) {
    int unsignedWidth = 0, signedWidth = 0;
    for (Shape shape : shapes) {
      if (shape.signed)
        signedWidth = Math.max(signedWidth, shape.width);
      else
        unsignedWidth = Math.max(unsignedWidth, shape.width);
    }
    if (signedWidth == 0)
      return unsigned(unsignedWidth);
    return signed(Math.max(signedWidth, unsignedWidth + 1));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Shape))
      return false;
    Shape other = (Shape)obj;
    return width == other.width && signed == other.signed;
  }

  @Override
  public int hashCode() {
    return Objects.hash(width, signed);
  }

  @Override
  public String toString() {
    return (signed ? "signed(" : "unsigned(") + width + ")";
  }
}
