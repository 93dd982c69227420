package hdlnet.ast;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Source location of the user code that created an expression, statement or fragment.
 * Captured by walking the stack up to the first frame that does not belong to the compiler itself.
 */
public record SrcLoc(String file, int line) {

  private static final Pattern LIBRARY_CLASS = Pattern.compile("hdlnet\\.(ast|dsl|error|ir|netlist)\\..*");
  private static final Pattern TEST_CLASS = Pattern.compile(".*Tests?(\\$.*)?");

  /** The location of the innermost caller outside the compiler packages, or null if there is none. */
  public static SrcLoc capture() {
    Optional<StackWalker.StackFrame> frame =
        StackWalker.getInstance().walk(frames -> frames.filter(f -> !isLibraryFrame(f.getClassName())).findFirst());
    return frame.map(f -> new SrcLoc(f.getFileName() == null ? "<unknown>" : f.getFileName(), f.getLineNumber())).orElse(null);
  }

  private static boolean isLibraryFrame(String className) {
    // Test classes share packages with the library but count as user code.
    return LIBRARY_CLASS.matcher(className).matches() && !TEST_CLASS.matcher(className).matches();
  }

  @Override
  public String toString() {
    return file + ":" + line;
  }
}
