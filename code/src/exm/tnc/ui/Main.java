/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.tnc.ui;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.tnc.common.Logging;
import exm.tnc.common.Settings;
import exm.tnc.common.exceptions.InvalidOptionException;
import exm.tnc.common.exceptions.TNCFatal;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;

/**
 * Command line interface to the notation compiler.  Builds one of the
 * example kernels and prints it in concrete notation.  Compiler options
 * are passed as properties, either Java system properties or -D flags.
 * See Settings.java for handling of these options.
 */
public class Main {
  private static final String KERNEL_FLAG = "k";
  private static final String VERBOSE_FLAG = "v";
  private static final String OUTPUT_FLAG = "o";
  private static final String PROPERTY_FLAG = "D";

  private static final Charset ENCODING = StandardCharsets.UTF_8;

  public static void main(String[] args) {
    try {
      System.exit(run(args));
    } catch (TNCFatal ex) {
      System.exit(ex.exitCode);
    }
  }

  /**
   * Run the compiler with command line arguments
   * @return exit code
   * @throws TNCFatal
   */
  public static int run(String[] args) {
    Args tncArgs = processArgs(args);

    try {
      Settings.initTNCProperties();
      for (String key: tncArgs.properties.stringPropertyNames()) {
        Settings.set(key, tncArgs.properties.getProperty(key));
      }
      if (tncArgs.kernel != null) {
        Settings.set(Settings.KERNEL, tncArgs.kernel);
      }
      Settings.validateProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      throw new TNCFatal(ExitCode.ERROR_COMMAND.code());
    }

    Logger logger;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      throw new TNCFatal(ExitCode.ERROR_COMMAND.code());
    }

    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(buffer, true, ENCODING);
    TNCompiler tnc = new TNCompiler(logger);
    IndexStmt result = tnc.compile(Settings.get(Settings.KERNEL),
                                   tncArgs.verbose ? out : null);
    out.println(result);
    out.flush();

    writeOutput(buffer, tncArgs.outputFilename);
    return ExitCode.SUCCESS.code();
  }

  private static Options initOptions() {
    Options opts = new Options();

    opts.addOption(KERNEL_FLAG, "kernel", true,
                   "Kernel to compile, one of: " + Kernels.NAMES);
    opts.addOption(VERBOSE_FLAG, "verbose", false,
                   "Print statement after every pass");
    opts.addOption(OUTPUT_FLAG, "output", true, "Write output to file");

    Option property = new Option(PROPERTY_FLAG, true,
                                 "Set compiler option key=value");
    property.setArgs(2);
    property.setValueSeparator('=');
    opts.addOption(property);
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      throw new TNCFatal(ExitCode.ERROR_COMMAND.code());
    }

    if (cmd.getArgs().length > 0) {
      System.err.println("Unexpected arguments: " +
                         String.join(" ", cmd.getArgs()));
      usage(opts);
      throw new TNCFatal(ExitCode.ERROR_COMMAND.code());
    }

    String kernel = cmd.getOptionValue(KERNEL_FLAG);
    if (kernel != null) {
      if (!Kernels.NAMES.contains(kernel.toLowerCase())) {
        System.err.println("Unknown kernel: " + kernel);
        usage(opts);
        throw new TNCFatal(ExitCode.ERROR_COMMAND.code());
      }
      kernel = kernel.toLowerCase();
    }

    return new Args(kernel, cmd.hasOption(VERBOSE_FLAG),
                    cmd.getOptionValue(OUTPUT_FLAG),
                    cmd.getOptionProperties(PROPERTY_FLAG));
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("tnc", opts, true);
  }

  /**
   * Write to file if given, otherwise standard output
   */
  private static void writeOutput(ByteArrayOutputStream buffer,
                                  String outputFilename) {
    String text = buffer.toString(ENCODING);
    if (outputFilename == null) {
      System.out.print(text);
      System.out.flush();
      return;
    }
    try {
      FileUtils.writeStringToFile(new File(outputFilename), text, ENCODING);
    } catch (IOException e) {
      System.err.println("Error writing output file " + outputFilename
                         + ": " + e.getMessage());
      throw new TNCFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static class Args {
    public final String kernel;
    public final boolean verbose;
    public final String outputFilename;
    public final Properties properties;

    public Args(String kernel, boolean verbose, String outputFilename,
                Properties properties) {
      this.kernel = kernel;
      this.verbose = verbose;
      this.outputFilename = outputFilename;
      this.properties = properties;
    }
  }
}
