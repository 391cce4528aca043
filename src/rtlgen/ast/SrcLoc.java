package rtlgen.ast;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Source location of a builder call in the user's description, used to annotate generated branch cases.
 */
public final class SrcLoc {
  public static final SrcLoc UNKNOWN = new SrcLoc("<unknown>", 0);

  // Classes whose frames are skipped when looking for the caller.
  private static final Set<Class<?>> skippedClasses = ConcurrentHashMap.newKeySet();
  static {
    skippedClasses.add(SrcLoc.class);
  }

  private static final StackWalker walker = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

  private final String file;
  private final int line;

  public SrcLoc(String file, int line) {
    this.file = file;
    this.line = line;
  }

  /**
   * Marks a class (and its nested classes) as part of the builder implementation, so that {@link #capture()} looks past its frames.
   * @param cls the class to skip
   */
  public static void addSkippedClass(Class<?> cls) { skippedClasses.add(cls); }

  /**
   * Captures the location of the innermost stack frame that is not part of a skipped class.
   * @return the location, or {@link #UNKNOWN}
   */
  public static SrcLoc capture() {
    return walker.walk(frames
                       -> frames.filter(frame -> !skippedClasses.contains(frame.getDeclaringClass().getNestHost()))
                              .findFirst()
                              .map(frame -> new SrcLoc(frame.getFileName(), frame.getLineNumber()))
                              .orElse(UNKNOWN));
  }

  public String getFile() { return file; }
  public int getLine() { return line; }

  @Override
  public int hashCode() {
    return Objects.hash(file, line);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    SrcLoc other = (SrcLoc)obj;
    return line == other.line && Objects.equals(file, other.file);
  }
  @Override
  public String toString() {
    return file + ":" + line;
  }
}
