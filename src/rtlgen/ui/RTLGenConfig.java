package rtlgen.ui;

/**
 * Data-Class to hold tool options. Field names match the keys of the YAML configuration file.
 */
public class RTLGenConfig {

  /** Report signed If/Elif conditions. */
  public boolean warn_signed_conditions = true;
  /** Turn advisory diagnostics into errors. */
  public boolean diagnostics_as_errors = false;

  public String default_fsm_domain = "sync";
  public String default_fsm_name = "fsm";
}
