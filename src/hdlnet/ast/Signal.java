package hdlnet.ast;

import hdlnet.error.ShapeError;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A named, stateful wire or register.
 * Signals are compared and hashed by identity (arena and index), never by name or shape.
 */
public final class Signal extends Value {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final SignalArena arena;
  private final int index;
  private String name;
  private final Shape shape;
  private final BigInteger init;
  private final boolean resetLess;
  private final Map<String, Object> attrs;

  private Signal(Builder builder, SrcLoc srcLoc) {
    super(srcLoc);
    this.arena = builder.arena;
    this.index = arena.allocate();
    this.shape = Shape.cast(builder.shape);
    this.name = builder.name != null ? builder.name : "sig$" + index;
    Const initConst;
    if (builder.init == null)
      initConst = Const.of(0, shape);
    else if (builder.shape instanceof ShapeCastable)
      initConst = ((ShapeCastable)builder.shape).constOf(builder.init);
    else
      initConst = Const.cast(builder.init);
    IntRange range = shape.toRange();
    if (initConst.getValue().compareTo(range.start()) < 0 || initConst.getValue().compareTo(range.stop()) >= 0)
      logger.warn("Initial value {} of signal {} will be truncated to the signal shape {}", initConst.getValue(), name, shape);
    this.init = Const.normalize(initConst.getValue(), shape);
    this.resetLess = builder.resetLess;
    this.attrs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attrs));
  }

  public static class Builder {
    private final SignalArena arena;
    private final Object shape;
    private String name;
    private Object init;
    private boolean resetLess;
    private final Map<String, Object> attrs = new LinkedHashMap<>();

    Builder(SignalArena arena, Object shape) {
      this.arena = arena;
      this.shape = shape;
    }

    public Builder name(String name) {
      if (name != null && name.isEmpty())
        throw new ShapeError("Signal name must not be empty");
      this.name = name;
      return this;
    }
    public Builder init(Object init) {
      this.init = init;
      return this;
    }
    public Builder resetLess(boolean resetLess) {
      this.resetLess = resetLess;
      return this;
    }
    public Builder attr(String key, Object value) {
      attrs.put(key, value);
      return this;
    }
    public Signal build() { return new Signal(this, SrcLoc.capture()); }
  }

  public String getName() { return name; }
  /** Used by domain renaming; the signal keeps its identity. */
  public void setName(String name) { this.name = name; }
  public int getIndex() { return index; }
  public SignalArena getArena() { return arena; }
  public BigInteger getInit() { return init; }
  public boolean isResetLess() { return resetLess; }
  public Map<String, Object> getAttrs() { return attrs; }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public List<Value> operands() {
    return List.of();
  }

  @Override
  public boolean isAssignable() {
    return true;
  }

  @Override
  protected void collectLhsSignals(Set<Signal> out) {
    out.add(this);
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj;
  }

  @Override
  public int hashCode() {
    return index;
  }

  @Override
  public String toString() {
    return "(sig " + name + ")";
  }
}
