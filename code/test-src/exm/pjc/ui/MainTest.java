package exm.pjc.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Calendar;
import java.util.Date;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.pjc.common.Settings;
import exm.pjc.common.exceptions.PJCFatal;

public class MainTest {

  private static final Logger logger = Logger.getLogger(MainTest.class);

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private static Date date(int y, int mon, int d, int h, int min, int s) {
    Calendar c = Calendar.getInstance();
    c.clear();
    c.set(y, mon - 1, d, h, min, s);
    return c.getTime();
  }

  private static final Date NOW = date(2024, 3, 5, 14, 7, 9);

  @After
  public void resetSettings() {
    Settings.reset(Settings.OUTPUT_HEADER);
  }

  @Test
  public void testDefaultOutputFile() {
    assertEquals(new File("dir/prog.js"),
                 Main.selectOutputFile("dir/prog.py", null, null, NOW));
    assertEquals(new File("script.js"),
                 Main.selectOutputFile("script", null, null, NOW));
  }

  @Test
  public void testExplicitOutputFile() {
    assertEquals(new File("out/x.js"),
        Main.selectOutputFile("prog.py", "out/x.js", "ignored", NOW));
  }

  @Test
  public void testTimestampedOutputFile() {
    assertEquals(new File("outputs", "prog_20240305_140709.js"),
        Main.selectOutputFile("src/prog.py", null, "outputs", NOW));
    assertEquals(new File("o", "a.b_20240305_140709.js"),
        Main.timestampedOutput(new File("o"), "a.b.py", NOW));
  }

  @Test
  public void testHeader() {
    assertEquals("// Generated JavaScript from prog.py\n" +
                 "// Transpiled on: 2024-03-05 14:07:09\n" +
                 "// Description: Transpiled from src/prog.py\n\n",
                 Main.header("src/prog.py", NOW));
  }

  @Test
  public void testSourceFiles() throws Exception {
    File dir = tmp.newFolder("src");
    FileUtils.touch(new File(dir, "b.py"));
    FileUtils.touch(new File(dir, "a.py"));
    FileUtils.touch(new File(dir, "notes.txt"));
    new File(dir, "pkg.py").mkdir();

    List<File> files = Main.sourceFiles(dir);
    assertEquals(2, files.size());
    assertEquals("a.py", files.get(0).getName());
    assertEquals("b.py", files.get(1).getName());
  }

  @Test
  public void testSourceFilesMissingDir() {
    assertTrue(Main.sourceFiles(new File(tmp.getRoot(), "none")).isEmpty());
  }

  @Test
  public void testCompileOneWithHeader() throws Exception {
    File input = tmp.newFile("prog.py");
    FileUtils.writeStringToFile(input, "x = 2 ** 8\nprint(x)\n",
                                StandardCharsets.UTF_8);
    File output = new File(tmp.getRoot(), "out/prog.js");

    Main.compileOne(logger, new PJCompiler(logger), input, output,
                    false, NOW);

    String text = FileUtils.readFileToString(output, StandardCharsets.UTF_8);
    assertEquals(Main.header(input.getPath(), NOW) +
                 "let x = Math.pow(2, 8);\nconsole.log(x);", text);
  }

  @Test
  public void testCompileOneWithoutHeader() throws Exception {
    Settings.set(Settings.OUTPUT_HEADER, "false");
    File input = tmp.newFile("prog.py");
    FileUtils.writeStringToFile(input, "x = 1\n", StandardCharsets.UTF_8);
    File output = new File(tmp.getRoot(), "prog.js");

    Main.compileOne(logger, new PJCompiler(logger), input, output,
                    false, NOW);
    assertEquals("let x = 1;",
        FileUtils.readFileToString(output, StandardCharsets.UTF_8));
  }

  @Test
  public void testNoOutputOnError() throws Exception {
    File input = tmp.newFile("bad.py");
    FileUtils.writeStringToFile(input, "x = 1\ny = $\n",
                                StandardCharsets.UTF_8);
    File output = new File(tmp.getRoot(), "bad.js");
    try {
      Main.compileOne(logger, new PJCompiler(logger), input, output,
                      false, NOW);
      fail("expected failure");
    } catch (PJCFatal e) {
      assertEquals(ExitCode.ERROR_USER.code(), e.exitCode);
    }
    assertFalse(output.exists());
  }

  @Test
  public void testUnreadableInput() {
    File input = new File(tmp.getRoot(), "missing.py");
    File output = new File(tmp.getRoot(), "missing.js");
    try {
      Main.compileOne(logger, new PJCompiler(logger), input, output,
                      false, NOW);
      fail("expected failure");
    } catch (PJCFatal e) {
      assertEquals(ExitCode.ERROR_IO.code(), e.exitCode);
    }
    assertFalse(output.exists());
  }
}
