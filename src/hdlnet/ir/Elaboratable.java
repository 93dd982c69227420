package hdlnet.ir;

/** Anything that can be turned into a {@link Fragment}, possibly through several elaboration steps. */
public interface Elaboratable {
  /** Returns a {@link Fragment} or another {@link Elaboratable}. */
  Object elaborate();
}
