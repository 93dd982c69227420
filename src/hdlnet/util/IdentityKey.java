package hdlnet.util;

/**
 * Map key that compares the wrapped object by reference.
 * Expression nodes are shared between statements, so caches keyed by them must not merge equal-looking nodes.
 */
public final class IdentityKey<T> {
  private final T val;

  public IdentityKey(T val) { this.val = val; }

  public T get() { return val; }

  @Override
  public int hashCode() {
    return System.identityHashCode(val);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    @SuppressWarnings("rawtypes") IdentityKey other = (IdentityKey)obj;
    return val == other.val;
  }

  @Override
  public String toString() {
    return "IdentityKey(" + val + ")";
  }
}
