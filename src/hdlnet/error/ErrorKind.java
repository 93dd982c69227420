package hdlnet.error;

/** The kinds of fatal diagnostics raised while elaborating a design. */
public enum ErrorKind {
  /** Invalid width or signedness, signed shift amount, non-castable object. */
  SHAPE,
  /** Construct used outside its required context, malformed pattern, non-assignable target. */
  SYNTAX,
  /** Duplicate submodule, domain or port name, undefined FSM state. */
  NAME,
  /** Same bit driven from two domains or from two modules. */
  DRIVER_CONFLICT,
  /** Undefined domain without a fallback, reset requested from a reset-less domain. */
  DOMAIN,
  /** Structural mutation after elaboration. */
  ALREADY_ELABORATED,
  /** A net that depends on itself without a storage element in between. */
  COMBINATIONAL_CYCLE
}
