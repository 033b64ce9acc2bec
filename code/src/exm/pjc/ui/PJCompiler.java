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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.pjc.common.exceptions.UserException;
import exm.pjc.common.util.Misc;
import exm.pjc.frontend.Lexer;
import exm.pjc.frontend.Parser;
import exm.pjc.frontend.Token;
import exm.pjc.ic.tree.ICTree.Program;
import exm.pjc.jsbackend.GenOptions;
import exm.pjc.jsbackend.JsGenerator;

/**
 * This is the main entry point to the compiler.  Runs the lexer, parser
 * and code generator over one source program.
 *
 * Instances hold no state between compilations, so independent programs
 * may be compiled concurrently with separate or shared instances, as long
 * as no IC output stream is shared.
 */
public class PJCompiler {

  private final Logger logger;
  private final GenOptions options;
  /** Where to dump the IC tree, or null */
  private final PrintStream icOutput;

  public PJCompiler(Logger logger) {
    this(logger, GenOptions.defaults(), null);
  }

  public PJCompiler(Logger logger, GenOptions options, PrintStream icOutput) {
    this.logger = logger;
    this.options = options;
    this.icOutput = icOutput;
  }

  /**
   * Lex and parse a program
   * @param file name for messages, or null
   * @param source complete program text
   * @throws UserException on the first lexical or syntax error
   */
  public Program parse(String file, String source) throws UserException {
    long start = System.nanoTime();
    List<Token> tokens = new Lexer(file, source).tokenize();
    logger.debug("Lexing done in " + elapsed(start));

    start = System.nanoTime();
    Program program = new Parser(file, tokens).parse();
    logger.debug("Parsing done in " + elapsed(start));

    if (icOutput != null) {
      program.log(icOutput, "IC for " + (file != null ? file : "<input>"));
    }
    return program;
  }

  /**
   * Compile a program to JavaScript.  Nothing is returned unless all
   * stages succeed.
   * @param file name for messages, or null
   * @param source complete program text
   * @return generated code, without trailing newline
   * @throws UserException on the first lexical or syntax error
   */
  public String compileString(String file, String source)
      throws UserException {
    Program program = parse(file, source);
    long start = System.nanoTime();
    String code = new JsGenerator(logger, options).generate(program);
    logger.debug("Code generation done in " + elapsed(start));
    return code;
  }

  /**
   * Read a UTF-8 source file and compile it
   * @throws IOException if the file can't be read
   */
  public String compileFile(File input) throws UserException, IOException {
    logger.debug("Compiling " + input.getPath());
    String source = FileUtils.readFileToString(input,
                                               StandardCharsets.UTF_8);
    return compileString(input.getPath(), source);
  }

  private static String elapsed(long startNanos) {
    return Misc.elapsedMillis(startNanos) + "ms";
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("PJC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
