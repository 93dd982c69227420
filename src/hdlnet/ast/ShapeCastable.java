package hdlnet.ast;

/**
 * Extension point for user types that behave like a shape.
 * Implementations are checked when cast, not by duck typing.
 */
public interface ShapeCastable {
  /**
   * Returns something castable by {@link Shape#cast(Object)}: a {@link Shape}, an integer width,
   * an {@link IntRange}, an enum class or another {@link ShapeCastable}.
   */
  Object asShape();

  /** Converts an initial or constant value of this shape into a {@link Const}. */
  default Const constOf(Object init) {
    return Const.cast(init, Shape.cast(this));
  }

  /** Formats a value of this shape for {@link Print}; the default is the plain integer format. */
  default Format format(Value value, String spec) {
    return Format.of("{:" + spec + "}", value);
  }
}
