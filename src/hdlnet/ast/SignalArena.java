package hdlnet.ast;

/**
 * Hands out signals for one elaboration session.
 * Each signal gets the next index of its arena; unnamed signals are called {@code sig$<index>}.
 */
public class SignalArena {
  private int nextIndex = 0;

  int allocate() { return nextIndex++; }

  /** Number of signals created so far. */
  public int size() { return nextIndex; }

  /** Starts building a signal of the given shape-castable shape. */
  public Signal.Builder newSignal(Object shape) { return new Signal.Builder(this, shape); }

  public Signal signal(Object shape, String name) { return newSignal(shape).name(name).build(); }

  public Signal signal(Object shape, String name, Object init) { return newSignal(shape).name(name).init(init).build(); }

  /** A new signal with the shape, initial value and reset policy of {@code other}. */
  public Signal like(Signal other, String name) {
    return newSignal(other.shape()).name(name).init(other.getInit()).resetLess(other.isResetLess()).build();
  }
}
