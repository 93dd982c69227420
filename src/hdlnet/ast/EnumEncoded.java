package hdlnet.ast;

/**
 * Implemented by enum types whose members carry an explicit hardware encoding.
 * Enums without it are encoded by ordinal.
 */
public interface EnumEncoded {
  long encoding();
}
