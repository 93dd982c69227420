package hdlnet.ast;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Prints a formatted message whenever the statement is active. */
public final class Print extends Statement {
  private final Format format;

  public Print(Format format, SrcLoc srcLoc) {
    super(srcLoc);
    this.format = format;
  }

  /** Prints the arguments separated by spaces, followed by a newline. */
  public static Print of(Object... args) {
    return new Print(Format.join(List.of(args), " ", "\n"), SrcLoc.capture());
  }

  public Format getFormat() { return format; }

  @Override
  public Set<Signal> lhsSignals() {
    return new LinkedHashSet<>();
  }

  @Override
  public Set<Signal> rhsSignals() {
    return format.rhsSignals();
  }

  @Override
  public String toString() {
    return "(print " + format + ")";
  }
}
