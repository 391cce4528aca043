package rtlgen.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlgen.ast.StatementList;

/**
 * Stack of open control constructs. Frames are closed explicitly or when a statement is added at a shallower depth.
 */
class ControlStack {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final List<ControlFrame> frames = new ArrayList<>();

  int size() { return frames.size(); }
  boolean isEmpty() { return frames.isEmpty(); }

  void open(ControlFrame frame) {
    logger.trace("Opening {} at stack depth {}", frame, frames.size());
    frames.add(frame);
  }

  /**
   * Returns the top frame if it is of the requested kind.
   * @param cls the frame class
   * @return the top frame, or null if the stack is empty or the top frame is of a different kind
   */
  <T extends ControlFrame> T top(Class<T> cls) {
    if (frames.isEmpty())
      return null;
    ControlFrame topFrame = frames.get(frames.size() - 1);
    return cls.isInstance(topFrame) ? cls.cast(topFrame) : null;
  }

  /**
   * Returns the innermost frame of the requested kind.
   * @param cls the frame class
   * @return the frame closest to the top, or null
   */
  <T extends ControlFrame> T innermost(Class<T> cls) {
    for (int i = frames.size() - 1; i >= 0; --i) {
      if (cls.isInstance(frames.get(i)))
        return cls.cast(frames.get(i));
    }
    return null;
  }

  /**
   * Removes the top frame and lowers it into the given accumulator.
   * @param out the accumulator of the scope that encloses the frame
   * @param topComb the module-level combinational statements
   */
  void closeTop(Map<String, StatementList> out, StatementList topComb) {
    ControlFrame frame = frames.remove(frames.size() - 1);
    logger.trace("Closing {}", frame);
    frame.lower(out, topComb);
  }

  /**
   * Closes frames until at most depth frames remain.
   * @param depth the target stack size
   * @param out the accumulator of the current scope
   * @param topComb the module-level combinational statements
   */
  void closeTo(int depth, Map<String, StatementList> out, StatementList topComb) {
    while (frames.size() > depth)
      closeTop(out, topComb);
  }

  /**
   * Drops all frames above the given stack size without lowering them.
   * @param size the stack size to return to
   */
  void truncate(int size) {
    if (frames.size() <= size)
      return;
    logger.debug("Dropping {} unfinished frame(s) above stack depth {}", frames.size() - size, size);
    frames.subList(size, frames.size()).clear();
  }

  /**
   * Drops a frame and all frames above it without lowering them, after its construct failed.
   * @param frame the frame to drop
   */
  void discard(ControlFrame frame) {
    int idx = frames.lastIndexOf(frame);
    if (idx < 0)
      return;
    logger.debug("Discarding {} and {} nested frame(s)", frame, frames.size() - 1 - idx);
    frames.subList(idx, frames.size()).clear();
  }
}
