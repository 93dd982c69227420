package hdlnet.ast;

import hdlnet.error.HdlSyntaxError;
import hdlnet.error.ShapeError;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Normalizes match patterns to bit strings of {@code 0}, {@code 1} and {@code -}, most significant bit first.
 * <p>
 * String patterns may contain whitespace and must be as wide as the tested value.
 * Constant patterns are converted to binary; a constant the tested shape cannot represent
 * can never match and is dropped with a warning.
 */
public final class Patterns {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private Patterns() {}

  public static List<String> normalize(List<?> patterns, Shape shape, SrcLoc srcLoc) {
    List<String> result = new ArrayList<>();
    for (Object pattern : patterns) {
      String normalized = normalize(pattern, shape, srcLoc);
      if (normalized != null)
        result.add(normalized);
    }
    return result;
  }

  /** Returns the bit string for one pattern, or null if the pattern is dead. */
  public static String normalize(Object pattern, Shape shape, SrcLoc srcLoc) {
    int width = shape.getWidth();
    if (pattern instanceof String) {
      String stripped = ((String)pattern).replaceAll("\\s+", "");
      if (!stripped.matches("[01-]*"))
        throw new HdlSyntaxError("Pattern '" + pattern + "' must consist of 0, 1, and - (don't care) bits, and may include whitespace",
                                 srcLoc);
      if (stripped.length() != width)
        throw new HdlSyntaxError("Pattern '" + pattern + "' must have the same width as match value (which is " + width + ")", srcLoc);
      return stripped;
    }
    Const value;
    try {
      value = Const.cast(pattern);
    } catch (ShapeError e) {
      throw new ShapeError("Pattern must be a string or a constant-castable expression, not " + pattern, srcLoc);
    }
    IntRange range = shape.toRange();
    BigInteger bits = value.getValue();
    if (bits.compareTo(range.start()) < 0 || bits.compareTo(range.stop()) >= 0) {
      logger.warn("{}: Match pattern {} can never be true for a value of shape {}; the case is dead", srcLoc, bits, shape);
      return null;
    }
    if (width == 0)
      return "";
    String binary = bits.and(BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE)).toString(2);
    return "0".repeat(width - binary.length()) + binary;
  }

  /** Whether a normalized pattern matches the given bits of a {@code width}-bit value. */
  public static boolean matches(String pattern, BigInteger bits) {
    int width = pattern.length();
    for (int i = 0; i < width; ++i) {
      char c = pattern.charAt(width - 1 - i);
      if (c != '-' && (c == '1') != bits.testBit(i))
        return false;
    }
    return true;
  }
}
