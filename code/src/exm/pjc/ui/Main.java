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
package exm.pjc.ui;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.pjc.common.Logging;
import exm.pjc.common.Settings;
import exm.pjc.common.exceptions.CodeGenerationError;
import exm.pjc.common.exceptions.InvalidOptionException;
import exm.pjc.common.exceptions.PJCFatal;
import exm.pjc.common.exceptions.UserException;
import exm.pjc.common.util.Misc;
import exm.pjc.common.util.Pair;
import exm.pjc.jsbackend.GenOptions;

/**
 * Command line interface to PJC compiler.  Some compiler options
 * are passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String OUTPUT_DIR_FLAG = "d";
  private static final String PRINT_FLAG = "p";
  private static final String IC_FLAG = "i";
  private static final String HELP_FLAG = "h";

  static final String SOURCE_EXT = ".py";
  static final String TARGET_EXT = ".js";

  /** Suffix added to names of timestamped output files */
  static final String FILE_TIMESTAMP_FORMAT = "yyyyMMdd_HHmmss";
  static final String HEADER_TIMESTAMP_FORMAT = "yyyy-MM-dd HH:mm:ss";

  public static void main(String[] args) {
    try {
      Settings.initPJCProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    Args pjcArgs = processArgs(args);

    Logger logger = null;
    GenOptions options = null;
    try {
      logger = setupLogging();
      options = GenOptions.fromSettings();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    logSettings(logger, options);

    PrintStream icOutput = setupICOutput();
    int exitCode;
    try {
      PJCompiler compiler = new PJCompiler(logger, options, icOutput);
      File input = new File(pjcArgs.inputFilename);
      Date now = new Date();
      if (input.isDirectory()) {
        exitCode = compileDirectory(logger, compiler, pjcArgs, input, now);
      } else {
        File output = selectOutputFile(pjcArgs.inputFilename,
                          pjcArgs.outputFilename, pjcArgs.outputDir, now);
        compileOne(logger, compiler, input, output, pjcArgs.print, now);
        exitCode = ExitCode.SUCCESS.code();
      }
    } catch (PJCFatal ex) {
      exitCode = ex.exitCode;
    } finally {
      if (icOutput != null) {
        icOutput.close();
      }
    }
    System.exit(exitCode);
  }

  private static Options initOptions() {
    Options opts = new Options();

    Option outDir = new Option(OUTPUT_DIR_FLAG, "outdir", true,
                    "Write timestamped output files to this directory");
    opts.addOption(outDir);

    opts.addOption(PRINT_FLAG, "print", false,
                   "Also print generated code to standard output");

    Option ic = new Option(IC_FLAG, "ic", true,
                    "Write intermediate code to this file");
    opts.addOption(ic);

    opts.addOption(HELP_FLAG, "help", false, "Print this message");
    return opts;
  }

  static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    if (cmd.hasOption(HELP_FLAG)) {
      usage(opts);
      System.exit(ExitCode.SUCCESS.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.err.println("Expected input file and optional output file, " +
              "but got " + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    String input = remainingArgs[0];
    String output = null;
    if (remainingArgs.length == 2) {
      output = remainingArgs[1];
    }
    Args result = new Args(input, output,
            cmd.getOptionValue(OUTPUT_DIR_FLAG), cmd.hasOption(PRINT_FLAG));
    if (cmd.hasOption(IC_FLAG)) {
      Settings.set(Settings.IC_OUTPUT_FILE, cmd.getOptionValue(IC_FLAG));
    }
    recordArgValues(result);
    return result;
  }

  /**
   * Store in properties for later logging
   * @param args
   */
  private static void recordArgValues(Args args) {
    Settings.set(Settings.INPUT_FILENAME, args.inputFilename);
    if (args.outputFilename != null) {
      Settings.set(Settings.OUTPUT_FILENAME, args.outputFilename);
    }
    if (args.outputDir != null) {
      Settings.addMetadata("Output directory", args.outputDir);
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  /**
   * Record version, settings and metadata in the compiler log
   */
  private static void logSettings(Logger logger, GenOptions options) {
    if (!logger.isDebugEnabled()) {
      return;
    }
    logger.debug("PJC version " + Settings.get(Settings.PJC_VERSION));
    for (String key: Settings.getKeys()) {
      logger.debug(String.format("%-30s: %s", key, Settings.get(key)));
    }
    for (Pair<String, String> kv: Settings.getMetadata()) {
      logger.debug(String.format("%-30s: %s", kv.val1, kv.val2));
    }
    logger.debug("Code generation options: " + options);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("pjc [options] <input> [<output>]", opts);
    System.out.println("<input> may be a source file or a directory of " +
                       SOURCE_EXT + " files");
  }

  /**
   * Choose output file for a single input file
   * @param input input path
   * @param output explicit output path, or null
   * @param outputDir directory for a timestamped output name, or null
   * @param now compilation time
   */
  static File selectOutputFile(String input, String output,
                               String outputDir, Date now) {
    if (output != null) {
      return new File(output);
    } else if (outputDir != null) {
      return timestampedOutput(new File(outputDir), input, now);
    }
    return new File(StringUtils.removeEnd(input, SOURCE_EXT) + TARGET_EXT);
  }

  /**
   * @return e.g. dir/prog_20240101_120000.js for prog.py
   */
  static File timestampedOutput(File dir, String input, Date now) {
    String base = StringUtils.removeEnd(FilenameUtils.getName(input),
                                        SOURCE_EXT);
    return new File(dir, base + "_" +
                         Misc.timestamp(FILE_TIMESTAMP_FORMAT, now) +
                         TARGET_EXT);
  }

  /**
   * Comment block placed before generated code
   */
  static String header(String inputPath, Date now) {
    StringBuilder sb = new StringBuilder();
    sb.append("// Generated JavaScript from ")
      .append(FilenameUtils.getName(inputPath)).append('\n');
    sb.append("// Transpiled on: ")
      .append(Misc.timestamp(HEADER_TIMESTAMP_FORMAT, now)).append('\n');
    sb.append("// Description: Transpiled from ")
      .append(inputPath).append('\n');
    sb.append('\n');
    return sb.toString();
  }

  /**
   * @return source files in directory, sorted by name
   */
  static List<File> sourceFiles(File dir) {
    List<File> result = new ArrayList<File>();
    File[] entries = dir.listFiles();
    if (entries != null) {
      for (File f: entries) {
        if (f.isFile() && f.getName().endsWith(SOURCE_EXT)) {
          result.add(f);
        }
      }
    }
    Collections.sort(result);
    return result;
  }

  private static int compileDirectory(Logger logger, PJCompiler compiler,
                        Args args, File dir, Date now) {
    if (args.outputFilename != null) {
      System.err.println("pjc error: an output file cannot be given for " +
                         "directory input " + dir.getPath());
      return ExitCode.ERROR_COMMAND.code();
    }
    String outDirName = args.outputDir != null ? args.outputDir :
                                      Settings.get(Settings.OUTPUT_DIR);
    File outDir = new File(outDirName);
    List<File> inputs = sourceFiles(dir);
    if (inputs.isEmpty()) {
      logger.warn("No " + SOURCE_EXT + " files found in " + dir.getPath());
    }

    int failures = 0;
    for (File input: inputs) {
      File output = timestampedOutput(outDir, input.getPath(), now);
      try {
        compileOne(logger, compiler, input, output, args.print, now);
        System.out.println(input.getName() + " -> " + output.getName());
      } catch (PJCFatal ex) {
        failures++;
      }
    }
    logger.debug("Compiled " + (inputs.size() - failures) + " of " +
                 inputs.size() + " files in " + dir.getPath());
    return failures > 0 ? ExitCode.ERROR_USER.code() :
                          ExitCode.SUCCESS.code();
  }

  /**
   * Compile one file.  The output file is only written if compilation
   * succeeds.
   * @throws PJCFatal with the exit code on any failure
   */
  static void compileOne(Logger logger, PJCompiler compiler, File input,
                         File output, boolean print, Date now) {
    String code;
    try {
      code = compiler.compileFile(input);
    } catch (UserException e) {
      System.err.println("pjc error: " + e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(Misc.stackTrace(e));
      throw new PJCFatal(ExitCode.ERROR_USER.code());
    } catch (IOException e) {
      System.err.println("pjc error: could not read " + input.getPath() +
                         ": " + e.getMessage());
      throw new PJCFatal(ExitCode.ERROR_IO.code());
    } catch (CodeGenerationError e) {
      System.err.println("pjc error: " + e.getMessage());
      logger.debug(Misc.stackTrace(e));
      throw new PJCFatal(ExitCode.ERROR_INTERNAL.code());
    } catch (RuntimeException e) {
      PJCompiler.reportInternalError(e);
      throw new PJCFatal(ExitCode.ERROR_INTERNAL.code());
    }

    String text = code;
    try {
      if (Settings.getBoolean(Settings.OUTPUT_HEADER)) {
        text = header(input.getPath(), now) + code;
      }
    } catch (InvalidOptionException e) {
      System.err.println("Error setting up options: " + e.getMessage());
      throw new PJCFatal(ExitCode.ERROR_COMMAND.code());
    }

    try {
      FileUtils.writeStringToFile(output, text, StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println("pjc error: could not write " + output.getPath() +
                         ": " + e.getMessage());
      throw new PJCFatal(ExitCode.ERROR_IO.code());
    }
    logger.debug("Wrote " + output.getPath());

    if (print) {
      System.out.println(code);
    }
  }

  private static PrintStream setupICOutput() {
    String icFileName = Settings.get(Settings.IC_OUTPUT_FILE);
    if (icFileName == null || icFileName.equals("")) {
      return null;
    }
    PrintStream output = null;
    try
    {
      @SuppressWarnings("resource")
      FileOutputStream stream = new FileOutputStream(icFileName);
      BufferedOutputStream buffer = new BufferedOutputStream(stream);
      output = new PrintStream(buffer, false, "UTF-8");
    }
    catch (IOException e)
    {
      System.err.println("Error opening IC output file " + icFileName
                      + ": " + e.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
    }
    return output;
  }

  static class Args {
    public final String inputFilename;
    /** Explicit output file, or null */
    public final String outputFilename;
    /** Directory for timestamped output, or null */
    public final String outputDir;
    public final boolean print;

    public Args(String inputFilename, String outputFilename,
                String outputDir, boolean print) {
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.outputDir = outputDir;
      this.print = print;
    }
  }
}
