package hdlnet.ast;

import java.math.BigInteger;

/** A half-open integer range {@code [start, stop)}, castable to the smallest shape holding all of its elements. */
public record IntRange(BigInteger start, BigInteger stop) {
  public static IntRange of(long start, long stop) { return new IntRange(BigInteger.valueOf(start), BigInteger.valueOf(stop)); }

  public boolean isEmpty() { return start.compareTo(stop) >= 0; }
  /** The largest element. Undefined for an empty range. */
  public BigInteger last() { return stop.subtract(BigInteger.ONE); }

  @Override
  public String toString() {
    return "range(" + start + ", " + stop + ")";
  }
}
