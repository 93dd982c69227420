package hdlnet.ast;

import java.util.LinkedHashSet;
import java.util.Set;

/** An assertion, assumption or cover point for formal verification and simulation. */
public final class Property extends Statement {
  public enum Kind {
    ASSERT("assert"),
    ASSUME("assume"),
    COVER("cover");

    private final String serialName;
    Kind(String serialName) { this.serialName = serialName; }
    public String getSerialName() { return serialName; }
  }

  private final Kind kind;
  private final Value test;
  private final Format message;

  public Property(Kind kind, Value test, Format message, SrcLoc srcLoc) {
    super(srcLoc);
    this.kind = kind;
    this.test = test;
    this.message = message;
  }

  public static Property assertion(Object test) { return new Property(Kind.ASSERT, Value.cast(test), null, SrcLoc.capture()); }
  public static Property assertion(Object test, Format message) { return new Property(Kind.ASSERT, Value.cast(test), message, SrcLoc.capture()); }
  public static Property assumption(Object test) { return new Property(Kind.ASSUME, Value.cast(test), null, SrcLoc.capture()); }
  public static Property cover(Object test) { return new Property(Kind.COVER, Value.cast(test), null, SrcLoc.capture()); }

  public Kind getKind() { return kind; }
  public Value getTest() { return test; }
  /** The failure message, or null. */
  public Format getMessage() { return message; }

  @Override
  public Set<Signal> lhsSignals() {
    return new LinkedHashSet<>();
  }

  @Override
  public Set<Signal> rhsSignals() {
    Set<Signal> result = new LinkedHashSet<>(test.rhsSignals());
    if (message != null)
      result.addAll(message.rhsSignals());
    return result;
  }

  @Override
  public String toString() {
    return "(" + kind.getSerialName() + " " + test + (message == null ? "" : " " + message) + ")";
  }
}
