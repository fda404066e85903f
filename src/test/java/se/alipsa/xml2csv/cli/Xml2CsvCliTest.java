package se.alipsa.xml2csv.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.simple.SimpleLogger;
import picocli.CommandLine;

/**
 * Runs the command line interface against copies of the sample documents.
 */
class Xml2CsvCliTest {

  private static final Path SAMPLES = Paths.get("src/test/resources/samples").toAbsolutePath().normalize();

  @TempDir
  Path tempDir;

  private StringWriter outBuffer;
  private StringWriter errBuffer;

  @BeforeEach
  void setUp() throws IOException {
    outBuffer = new StringWriter();
    errBuffer = new StringWriter();
    for (String name : List.of("orders.xml", "nested.xml", "file-a.xml", "file-b.xml", "malformed.xml")) {
      Files.copy(SAMPLES.resolve(name), tempDir.resolve(name));
    }
  }

  @AfterEach
  void tearDown() {
    System.clearProperty(SimpleLogger.DEFAULT_LOG_LEVEL_KEY);
  }

  private int run(String... args) {
    CommandLine cmd = new CommandLine(new Xml2CsvCli());
    cmd.setOut(new PrintWriter(outBuffer, true));
    cmd.setErr(new PrintWriter(errBuffer, true));
    return cmd.execute(args);
  }

  private String input(String name) {
    return tempDir.resolve(name).toString();
  }

  @Test
  void shouldWriteCsvNextToEachInput() throws IOException {
    int exitCode = run(input("orders.xml"), input("nested.xml"));

    assertEquals(0, exitCode);
    assertEquals(List.of("fa1,fa2,fa3,fb1,fb2,fb3", "va1,va2,va3,vb11,vb12,vb13", "va1,va2,va3,vb21,vb22,vb23"),
        Files.readAllLines(tempDir.resolve("orders.csv")));
    assertEquals("fa1,fa2,fa3,fb1,fb2,fb3,fc1,fc2", Files.readAllLines(tempDir.resolve("nested.csv")).get(0));
    assertTrue(outBuffer.toString().contains("Wrote: " + tempDir.resolve("orders.csv")));
    assertTrue(errBuffer.toString().isEmpty());
  }

  @Test
  void shouldWriteIntoOutputDirectoryWithDelimiter() throws IOException {
    Path outDir = tempDir.resolve("csv");

    int exitCode = run("--output-dir", outDir.toString(), "--delimiter", ";", input("orders.xml"));

    assertEquals(0, exitCode);
    assertEquals("fa1;fa2;fa3;fb1;fb2;fb3", Files.readAllLines(outDir.resolve("orders.csv")).get(0));
  }

  @Test
  void shouldMergeInputsIntoSingleFile() throws IOException {
    Path merged = tempDir.resolve("merged-out.csv");

    int exitCode = run("--merge-into", merged.toString(), input("file-a.xml"), input("file-b.xml"));

    assertEquals(0, exitCode);
    assertEquals(List.of("x,y,z", "1,2,", "3,4,", ",5,6", ",7,8"), Files.readAllLines(merged));
    assertTrue(outBuffer.toString().contains("Wrote merged CSV: " + merged));
  }

  @Test
  void shouldUseDefaultFileNameWhenMergingIntoDirectory() {
    int exitCode = run("--merge-into", tempDir.toString(), input("file-a.xml"), input("file-b.xml"));

    assertEquals(0, exitCode);
    assertTrue(Files.exists(tempDir.resolve("merged.csv")));
  }

  @Test
  void shouldWarnAboutUnknownSelectedColumns() throws IOException {
    int exitCode = run("--columns", "fb1,nonexistent,fa1", input("orders.xml"));

    assertEquals(0, exitCode);
    assertEquals(List.of("fb1,fa1", "vb11,va1", "vb21,va1"), Files.readAllLines(tempDir.resolve("orders.csv")));
    assertTrue(errBuffer.toString().contains("Warning: column 'nonexistent' not found"));
  }

  @Test
  void shouldListColumnsWithoutWritingFiles() {
    int exitCode = run("--list-columns", input("nested.xml"));

    assertEquals(0, exitCode);
    assertEquals(List.of("fa1", "fa2", "fa3", "fb1", "fb2", "fb3", "fc1", "fc2"),
        outBuffer.toString().lines().toList());
    assertFalse(Files.exists(tempDir.resolve("nested.csv")));
  }

  @Test
  void shouldListMergedColumns() {
    int exitCode = run("--list-columns", "--merge-into", tempDir.resolve("m.csv").toString(), input("file-a.xml"),
        input("file-b.xml"));

    assertEquals(0, exitCode);
    assertEquals(List.of("x", "y", "z"), outBuffer.toString().lines().toList());
    assertFalse(Files.exists(tempDir.resolve("m.csv")));
  }

  @Test
  void shouldContinueAfterMissingAndMalformedInputs() {
    int exitCode = run(input("missing.xml"), input("malformed.xml"), input("orders.xml"));

    assertEquals(1, exitCode);
    String err = errBuffer.toString();
    assertTrue(err.contains("Skipping non-existent file: " + tempDir.resolve("missing.xml")));
    assertTrue(err.contains("Failed to convert " + tempDir.resolve("malformed.xml")));
    assertFalse(Files.exists(tempDir.resolve("malformed.csv")));
    assertTrue(Files.exists(tempDir.resolve("orders.csv")));
  }

  @Test
  void shouldWriteRequestedEncoding() throws IOException {
    Path doc = tempDir.resolve("city.xml");
    Files.writeString(doc, "<?xml version='1.0' encoding='UTF-8'?><c><n>Malmö</n><n>Göteborg</n></c>",
        StandardCharsets.UTF_8);

    int exitCode = run("--encoding", "ISO-8859-1", doc.toString());

    assertEquals(0, exitCode);
    assertEquals(List.of("n", "Malmö", "Göteborg"),
        Files.readAllLines(tempDir.resolve("city.csv"), StandardCharsets.ISO_8859_1));
  }

  @Test
  void shouldRejectInvalidOptions() {
    assertEquals(2, run("--delimiter", ";;", input("orders.xml")));
    assertEquals(2, run("--encoding", "no-such-charset", input("orders.xml")));
    assertEquals(2, run());
    assertFalse(Files.exists(tempDir.resolve("orders.csv")));
  }

  @Test
  void shouldRaiseLogLevelOnlyWhenVerbose() {
    assertEquals(0, run("--list-columns", input("orders.xml")));
    assertEquals("error", System.getProperty(SimpleLogger.DEFAULT_LOG_LEVEL_KEY));

    assertEquals(0, run("-v", "--list-columns", input("orders.xml")));
    assertEquals("debug", System.getProperty(SimpleLogger.DEFAULT_LOG_LEVEL_KEY));

    assertEquals(0, run("--verbose", "--list-columns", input("orders.xml")));
    assertEquals("debug", System.getProperty(SimpleLogger.DEFAULT_LOG_LEVEL_KEY));
  }

  @Test
  void shouldPrintVersion() {
    assertEquals(0, run("--version"));
    assertTrue(outBuffer.toString().startsWith("xml2csv "));
  }
}
