package hdlnet.ast;

import hdlnet.error.HdlSyntaxError;
import hdlnet.error.ShapeError;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An immutable node of an expression DAG.
 * Nodes may be shared between expressions; anything caching per node has to key on identity.
 */
public abstract class Value {
  protected final SrcLoc srcLoc;

  protected Value(SrcLoc srcLoc) { this.srcLoc = srcLoc; }

  public abstract Shape shape();
  /** Direct child expressions, in operand order. */
  public abstract List<Value> operands();

  public int width() { return shape().getWidth(); }
  public SrcLoc getSrcLoc() { return srcLoc; }

  /**
   * Converts a value-like object to a value.
   * Accepts values, {@link ValueCastable}s, integers (as minimal constants), booleans and enum members.
   */
  public static Value cast(Object obj) {
    Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    while (obj instanceof ValueCastable) {
      if (!seen.add(obj))
        throw new ShapeError("Value-castable object " + obj + " casts to itself");
      obj = ((ValueCastable)obj).asValue();
    }
    if (obj instanceof Value)
      return (Value)obj;
    if (obj instanceof Integer || obj instanceof Long || obj instanceof BigInteger || obj instanceof Boolean || obj instanceof Enum<?>)
      return Const.cast(obj);
    throw new ShapeError("Object " + obj + " cannot be converted to a value");
  }

  //// Constructors for composite expressions ////

  /** Concatenation; the first part ends up in the least significant bits. */
  public static Value cat(Object... parts) {
    List<Value> values = new ArrayList<>();
    for (Object part : parts) {
      if (part instanceof Iterable<?>)
        ((Iterable<?>)part).forEach(item -> values.add(cast(item)));
      else
        values.add(cast(part));
    }
    return new Concat(values, SrcLoc.capture());
  }

  /** {@code sel ? onTrue : onFalse}; a multi-bit selector is reduced with {@link #bool()}. */
  public static Value mux(Object sel, Object onTrue, Object onFalse) {
    Value selValue = cast(sel);
    if (selValue.width() != 1)
      selValue = selValue.bool();
    return new Operator("m", List.of(selValue, cast(onTrue), cast(onFalse)), SrcLoc.capture());
  }

  private Value unary(String op) { return new Operator(op, List.of(this), SrcLoc.capture()); }
  private Value binary(String op, Object other) { return new Operator(op, List.of(this, cast(other)), SrcLoc.capture()); }

  public Value invert() { return unary("~"); }
  public Value neg() { return unary("-"); }
  public Value bool() { return unary("b"); }
  public Value any() { return unary("r|"); }
  public Value all() { return unary("r&"); }
  public Value xor() { return unary("r^"); }
  public Value asUnsigned() { return unary("u"); }
  public Value asSigned() {
    if (width() == 0)
      throw new ShapeError("Cannot reinterpret a zero-width value as signed", srcLoc);
    return unary("s");
  }

  public Value add(Object other) { return binary("+", other); }
  public Value sub(Object other) { return binary("-", other); }
  public Value mul(Object other) { return binary("*", other); }
  /** Division rounding towards negative infinity. */
  public Value floorDiv(Object other) { return binary("//", other); }
  /** Remainder with the sign of the divisor. */
  public Value mod(Object other) { return binary("%", other); }
  public Value bitAnd(Object other) { return binary("&", other); }
  public Value bitOr(Object other) { return binary("|", other); }
  public Value bitXor(Object other) { return binary("^", other); }
  public Value shl(Object amount) { return binary("<<", amount); }
  public Value shr(Object amount) { return binary(">>", amount); }
  public Value equalTo(Object other) { return binary("==", other); }
  public Value notEqualTo(Object other) { return binary("!=", other); }
  public Value lessThan(Object other) { return binary("<", other); }
  public Value lessEqual(Object other) { return binary("<=", other); }
  public Value greaterThan(Object other) { return binary(">", other); }
  public Value greaterEqual(Object other) { return binary(">=", other); }
  /** Logical implication of two boolean conditions. */
  public Value implies(Object premise) { return invert().bitOr(premise); }

  public Value abs() {
    if (!shape().isSigned())
      return this;
    return mux(greaterEqual(0), this, neg()).slice(0, width()).asUnsigned();
  }

  //// Bit selection ////

  public Value bit(int index) {
    int n = width();
    if (index < -n || index >= n)
      throw new ShapeError("Index " + index + " is out of bounds for a " + n + "-bit value", SrcLoc.capture());
    if (index < 0)
      index += n;
    return new Slice(this, index, index + 1, SrcLoc.capture());
  }

  /** Bits {@code [start, stop)}; negative indices count from the end and out-of-range bounds are clamped. */
  public Value slice(int start, int stop) { return slice(start, stop, 1); }

  /** Bits {@code start, start+step, ...} below {@code stop}; a null bound selects the respective end. */
  public Value slice(Integer start, Integer stop, int step) {
    if (step == 0)
      throw new ShapeError("Slice step cannot be zero");
    int n = width();
    int lower = step < 0 ? -1 : 0, upper = step < 0 ? n - 1 : n;
    int from = start == null ? (step < 0 ? upper : lower) : clampIndex(start, n, lower, upper);
    int to = stop == null ? (step < 0 ? lower : upper) : clampIndex(stop, n, lower, upper);
    SrcLoc loc = SrcLoc.capture();
    if (step != 1) {
      List<Value> bits = new ArrayList<>();
      for (int i = from; step > 0 ? i < to : i > to; i += step)
        bits.add(new Slice(this, i, i + 1, loc));
      return new Concat(bits, loc);
    }
    return new Slice(this, from, to, loc);
  }

  private static int clampIndex(int index, int n, int lower, int upper) {
    if (index < 0) {
      index += n;
      return Math.max(index, lower);
    }
    return Math.min(index, upper);
  }

  /** {@code width} bits starting at a variable bit offset. */
  public Value bitSelect(Object offset, int width) {
    Value offsetValue = cast(offset);
    if (offsetValue instanceof Const) {
      int start = ((Const)offsetValue).getValue().intValueExact();
      return slice(start, start + width);
    }
    return new Part(this, offsetValue, width, 1, SrcLoc.capture());
  }

  /** The {@code offset}-th word of {@code width} bits. */
  public Value wordSelect(Object offset, int width) {
    Value offsetValue = cast(offset);
    if (offsetValue instanceof Const) {
      int index = ((Const)offsetValue).getValue().intValueExact();
      return slice(index * width, (index + 1) * width);
    }
    return new Part(this, offsetValue, width, width, SrcLoc.capture());
  }

  public Value replicate(int count) {
    if (count < 0)
      throw new ShapeError("Replication count must be a non-negative integer, not " + count);
    return new Concat(Collections.nCopies(count, this), SrcLoc.capture());
  }

  public Value shiftLeft(int amount) {
    if (amount < 0)
      return shiftRight(-amount);
    Value shifted = new Concat(List.of(Const.of(0, Shape.unsigned(amount)), this), SrcLoc.capture());
    return shape().isSigned() ? shifted.asSigned() : shifted;
  }

  public Value shiftRight(int amount) {
    if (amount < 0)
      return shiftLeft(-amount);
    if (shape().isSigned()) {
      // Keep at least the sign bit.
      amount = Math.min(amount, width() - 1);
      return slice(amount, width()).asSigned();
    }
    return slice(amount, width());
  }

  public Value rotateLeft(int amount) {
    int n = width();
    if (n == 0)
      return this;
    amount = Math.floorMod(amount, n);
    return cat(slice(n - amount, n), slice(0, n - amount));
  }

  public Value rotateRight(int amount) {
    int n = width();
    if (n == 0)
      return this;
    amount = Math.floorMod(amount, n);
    return cat(slice(amount, n), slice(0, amount));
  }

  /**
   * One-bit value that is set if this value matches any of the patterns.
   * Patterns are bit strings of {@code 0}, {@code 1} and {@code -} or constants; see {@link Patterns}.
   */
  public Value matches(Object... patterns) {
    SrcLoc loc = SrcLoc.capture();
    List<Value> terms = new ArrayList<>();
    for (String pattern : Patterns.normalize(List.of(patterns), shape(), loc)) {
      BigInteger mask = pattern.isEmpty() ? BigInteger.ZERO : new BigInteger(pattern.replace('0', '1').replace('-', '0'), 2);
      BigInteger bits = pattern.isEmpty() ? BigInteger.ZERO : new BigInteger(pattern.replace('-', '0'), 2);
      Const expected = new Const(bits, Shape.unsigned(width()));
      if (pattern.indexOf('-') < 0)
        terms.add(asUnsigned().equalTo(expected));
      else
        terms.add(asUnsigned().bitAnd(new Const(mask, Shape.unsigned(width()))).equalTo(expected));
    }
    if (terms.isEmpty())
      return Const.of(0, Shape.unsigned(1));
    if (terms.size() == 1)
      return terms.get(0);
    return new Concat(terms, loc).any();
  }

  //// Assignment ////

  /** Whether this expression may appear on the left-hand side of an assignment. */
  public boolean isAssignable() { return false; }

  /** {@code this = rhs}. Fails for expressions that cannot be assigned to. */
  public Assign assign(Object rhs) {
    SrcLoc loc = SrcLoc.capture();
    if (!isAssignable())
      throw new HdlSyntaxError("Value " + this + " cannot be assigned to", loc);
    return new Assign(this, cast(rhs), loc);
  }

  /** Signals written when this expression is the target of an assignment. */
  public Set<Signal> lhsSignals() {
    Set<Signal> result = new LinkedHashSet<>();
    collectLhsSignals(result);
    return result;
  }

  protected void collectLhsSignals(Set<Signal> out) {}

  /** Signals read when evaluating this expression. */
  public Set<Signal> rhsSignals() {
    Set<Signal> result = new LinkedHashSet<>();
    Set<Value> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    List<Value> worklist = new ArrayList<>(List.of(this));
    while (!worklist.isEmpty()) {
      Value value = worklist.remove(worklist.size() - 1);
      if (!visited.add(value))
        continue;
      if (value instanceof Signal)
        result.add((Signal)value);
      List<Value> children = value.operands();
      for (int i = children.size() - 1; i >= 0; --i)
        worklist.add(children.get(i));
    }
    return result;
  }
}
