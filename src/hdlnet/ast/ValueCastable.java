package hdlnet.ast;

/** Extension point for user types that wrap a value, such as structured views over a signal. */
public interface ValueCastable {
  /** Returns a {@link Value} or another {@link ValueCastable}. */
  Object asValue();

  /** The shape of the wrapped value, castable by {@link Shape#cast(Object)}. */
  Object shape();
}
