package exm.tnc.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.tnc.common.Settings;
import exm.tnc.common.exceptions.TNCFatal;

public class MainTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @After
  public void resetSettings() {
    for (String key: Settings.getKeys()) {
      Settings.reset(key);
    }
  }

  private String runToFile(String... args) throws IOException {
    File output = new File(folder.getRoot(), "out.txt");
    String[] allArgs = new String[args.length + 2];
    System.arraycopy(args, 0, allArgs, 0, args.length);
    allArgs[args.length] = "-o";
    allArgs[args.length + 1] = output.getPath();
    assertEquals(ExitCode.SUCCESS.code(), Main.run(allArgs));
    return FileUtils.readFileToString(output, StandardCharsets.UTF_8);
  }

  private static void expectExit(ExitCode code, String... args) {
    try {
      Main.run(args);
      fail("Expected exit with " + code);
    } catch (TNCFatal ex) {
      assertEquals(code.code(), ex.exitCode);
    }
  }

  @Test
  public void testKernel() throws IOException {
    assertEquals("forall(i, forall(j, forall(k, " +
                 "A(i,j) += B(i,k) * C(k,j))))",
                 runToFile("-k", "matmul").trim());
  }

  @Test
  public void testKernelNameCase() throws IOException {
    assertEquals(runToFile("-k", "matmul"), runToFile("-k", "MatMul"));
    assertEquals("matmul", Settings.get(Settings.KERNEL));
  }

  @Test
  public void testDefaultKernel() throws IOException {
    assertEquals(runToFile("-k", "matmul"), runToFile());
  }

  @Test
  public void testVerbose() throws IOException {
    String text = runToFile("--kernel", "add", "-v");
    assertTrue(text, text.contains("Input: A(i,j) = B(i,j) + C(i,j)"));
    assertTrue(text, text.trim().endsWith(
                        "forall(i, forall(j, A(i,j) = B(i,j) + C(i,j)))"));
  }

  @Test
  public void testProperty() throws IOException {
    String text = runToFile("-k", "residual", "-D",
                            "tnc.temporary-prefix=acc_");
    assertTrue(text, text.contains("acc_j += A(i,j) * x(j)"));
  }

  @Test
  public void testSplitDisabled() throws IOException {
    String text = runToFile("-k", "mttkrp", "-D",
                            "tnc.opt.split-operators=false");
    assertEquals("forall(i, forall(j, forall(k, forall(l, " +
                 "A(i,j) += B(i,k,l) * D(l,j) * C(k,j)))))", text.trim());
  }

  @Test
  public void testUnknownKernel() {
    expectExit(ExitCode.ERROR_COMMAND, "-k", "conv");
  }

  @Test
  public void testExtraArguments() {
    expectExit(ExitCode.ERROR_COMMAND, "-k", "matmul", "input.tn");
  }

  @Test
  public void testBadOption() {
    expectExit(ExitCode.ERROR_COMMAND, "-D", "tnc.opt.simplify=maybe");
  }

  @Test
  public void testBadOutput() {
    File dir = new File(folder.getRoot(), "missing");
    assertTrue(dir.mkdir());
    // A directory can't be written as a file
    expectExit(ExitCode.ERROR_IO, "-o", dir.getPath());
  }
}
