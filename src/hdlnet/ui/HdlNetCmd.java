package hdlnet.ui;

import hdlnet.HdlNet;
import hdlnet.ast.SignalArena;
import hdlnet.error.HdlException;
import hdlnet.netlist.Netlist;
import java.io.FileInputStream;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class HdlNetCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("hdlnetcmd - build the netlist of a demo design", options);
    System.exit(-1);
  };

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stderr", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stderr")));
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    CommandLineParser parser = new DefaultParser();

    options.addOption(Option.builder("d")
                          .longOpt("design")
                          .argName("demo name")
                          .hasArg()
                          .required(true)
                          .desc("Design to build. Must be one of: " + DemoDesigns.names())
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file with tool options")
                          .build());
    options.addOption(Option.builder("f")
                          .longOpt("format")
                          .argName("sexpr|yaml")
                          .hasArg()
                          .required(false)
                          .desc("Output format; overrides the config file")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("file")
                          .hasArg()
                          .required(false)
                          .desc("File to write the netlist to; stdout by default")
                          .build());
    options.addOption(Option.builder("s").longOpt("storage").required(false).desc("Give undriven signals storage of their own").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    //////////   collect options   //////////
    String design = "";
    String outputFile = null;
    HdlNetConfig cfg = new HdlNetConfig();
    try {
      CommandLine line = parser.parse(options, args);

      if (line.hasOption("h")) {
        printHelpAndExit(options);
      }

      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

      design = line.getOptionValue("d");
      if (line.hasOption("c")) {
        try (InputStream in = new FileInputStream(line.getOptionValue("c"))) {
          cfg = HdlNetConfig.load(in, line.getOptionValue("c"));
        }
      }
      if (line.hasOption("f")) {
        cfg.output_format = line.getOptionValue("f");
        if (!cfg.output_format.equals("sexpr") && !cfg.output_format.equals("yaml")) {
          System.err.println("Unknown output format " + cfg.output_format);
          printHelpAndExit(options);
        }
      }
      if (line.hasOption("s"))
        cfg.undriven_as_storage = true;
      outputFile = line.getOptionValue("o");
    } catch (ParseException exp) {
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    } catch (IOException | IllegalArgumentException e) {
      System.err.println("Cannot read config: " + e.getMessage());
      System.exit(1);
    }

    //////////   build netlist   //////////
    boolean success = true;
    try {
      HdlNet hdlNet = new HdlNet(cfg);
      DemoDesigns.Demo demo = DemoDesigns.create(design, new SignalArena());
      Netlist netlist = hdlNet.buildNetlist(demo.top(), demo.ports());
      if (outputFile != null) {
        try (Writer writer = new FileWriter(outputFile, StandardCharsets.UTF_8)) {
          hdlNet.writeNetlist(netlist, writer);
        }
        logger.info("Wrote netlist of '{}' to {}", design, outputFile);
      } else {
        hdlNet.writeNetlist(netlist, new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
      }
    } catch (HdlException | IllegalArgumentException e) {
      logger.error(e.getMessage());
      success = false;
    } catch (IOException e) {
      logger.error("Cannot write netlist: {}", e.getMessage());
      success = false;
    }
    System.exit(success ? 0 : 1);
  }
}
