package rtlgen.ui;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import rtlgen.dsl.Diagnostic;
import rtlgen.dsl.FSM;
import rtlgen.frontend.FsmDescription;
import rtlgen.frontend.FsmDescriptionModule;
import rtlgen.frontend.FsmDescriptionReader;
import rtlgen.ir.Fragment;

public class RTLGenCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp("rtlgencmd - elaborate a YAML state machine description with the procedural RTL builder", options);
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args));
  }

  static Options createOptions() {
    Options options = new Options();
    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("FSM.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file describing the state machine (required)")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with tool options (warn_signed_conditions, diagnostics_as_errors, default_fsm_domain, "
                                + "default_fsm_name)")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  /**
   * Loads tool options from YAML. Keys not present keep their default value.
   * @param reader the YAML source
   * @return the configuration
   */
  public static RTLGenConfig loadConfig(Reader reader) {
    Yaml yaml = new Yaml(new Constructor(RTLGenConfig.class, new LoaderOptions()));
    RTLGenConfig cfg = yaml.load(reader);
    // An empty document yields null.
    return cfg == null ? new RTLGenConfig() : cfg;
  }

  /**
   * Runs the tool.
   * @param args the command line arguments
   * @return the process exit code
   */
  public static int run(String[] args) {
    Options options = createOptions();
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    Path inputFile;
    RTLGenConfig cfg = new RTLGenConfig();
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelp(options);
        return 0;
      }
      // -i is checked here so that -h works on its own
      if (!line.hasOption("i"))
        throw new MissingOptionException(List.of("i"));

      inputFile = Path.of(line.getOptionValue("i"));

      // set verbosity of printing
      Level logLvl = null;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      if (logLvl != null)
        Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

      if (line.hasOption("c")) {
        String configText = Files.readString(Path.of(line.getOptionValue("c")));
        cfg = loadConfig(new StringReader(configText));
      }
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp(options);
      return 2;
    } catch (IOException | RuntimeException e) {
      logger.error("Cannot read configuration: {}", e.getMessage());
      return 1;
    }

    //////////   build and elaborate the description   //////////
    FsmDescription desc;
    try {
      desc = new FsmDescriptionReader().read(inputFile);
    } catch (IOException e) {
      logger.error("FSM description {} could not be opened: {}", inputFile, e.getMessage());
      return 1;
    } catch (RuntimeException e) {
      logger.error("FSM description {} is malformed: {}", inputFile, e.getMessage());
      return 1;
    }

    FsmDescriptionModule module;
    Fragment fragment;
    try {
      module = new FsmDescriptionModule(desc, cfg);
      fragment = Fragment.get(module, null);
    } catch (RuntimeException e) {
      logger.error("Elaboration of {} failed: {}", inputFile, e.getMessage());
      logger.debug("Stack trace", e);
      return 1;
    }

    FSM fsm = module.getFSM();
    logger.info("FSM '{}' in domain '{}': state encoding {}", fsm.getName(), fsm.getDomain(), fsm.getEncoding());
    for (Diagnostic diag : module.getDiagnostics().getDiagnostics())
      logger.info("Diagnostic [{}]: {}", diag.getKind(), diag);
    logger.info("Elaborated fragment:\n{}", fragment);
    return 0;
  }
}
