package rtlgen.ir;

/**
 * An object that can be turned into a {@link Fragment}, possibly through several elaboration steps.
 */
public interface Elaboratable {
  /**
   * Elaborates this object for a target platform.
   * @param platform an opaque description of the target platform, may be null
   * @return a Fragment, or another Elaboratable that is elaborated in turn
   */
  Elaboratable elaborate(Object platform);
}
