package hdlnet.netlist;

/**
 * A single bit of the netlist.
 * <p>
 * Encoding: 0 and 1 are constants, negative numbers are late nets that must be looked up in the
 * netlist connections, and every other number is {@code (cell << 16) | bit}, an output bit of a cell.
 * Bits 0 and 1 of cell 0 are the constants, so top-level inputs start at bit 2.
 */
public record Net(long raw) implements Comparable<Net> {
  public static final Net ZERO = new Net(0);
  public static final Net ONE = new Net(1);

  public static Net fromCell(int cell, int bit) {
    if (cell < 0 || bit < 0 || bit >= (1 << 16))
      throw new IllegalArgumentException("Invalid cell output " + cell + "." + bit);
    if (cell == 0 && bit < 2)
      throw new IllegalArgumentException("Bits 0 and 1 of the top cell are reserved for constants");
    return new Net(((long)cell << 16) | bit);
  }

  public static Net fromConst(int value) {
    if (value != 0 && value != 1)
      throw new IllegalArgumentException("Constant net must be 0 or 1, not " + value);
    return value == 0 ? ZERO : ONE;
  }

  public static Net fromLate(long value) {
    if (value >= 0)
      throw new IllegalArgumentException("Late net must be negative, not " + value);
    return new Net(value);
  }

  public boolean isConst() { return raw == 0 || raw == 1; }
  public boolean isLate() { return raw < 0; }
  public boolean isCell() { return raw >= 2; }

  public int getConst() {
    if (!isConst())
      throw new IllegalStateException("Net " + this + " is not a constant");
    return (int)raw;
  }

  public int getCell() {
    if (!isCell())
      throw new IllegalStateException("Net " + this + " is not a cell output");
    return (int)(raw >> 16);
  }

  public int getBit() {
    if (!isCell())
      throw new IllegalStateException("Net " + this + " is not a cell output");
    return (int)(raw & 0xffff);
  }

  @Override
  public int compareTo(Net other) {
    return Long.compare(raw, other.raw);
  }

  @Override
  public String toString() {
    if (isLate())
      return "(late " + raw + ")";
    if (isConst())
      return Long.toString(raw);
    return getCell() + "." + getBit();
  }
}
