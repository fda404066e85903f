package se.alipsa.xml2csv.io;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OutputLocationsTest {

  @TempDir
  Path tempDir;

  @Test
  void shouldPlaceCsvNextToInputByDefault() {
    Path input = tempDir.resolve("data").resolve("orders.xml");

    assertEquals(tempDir.resolve("data").resolve("orders.csv"), OutputLocations.perFile(input, null));
  }

  @Test
  void shouldPlaceCsvInOutputDirectory() {
    Path input = tempDir.resolve("data").resolve("report.v2.xml");
    Path outDir = tempDir.resolve("out");

    assertEquals(outDir.resolve("report.v2.csv"), OutputLocations.perFile(input, outDir));
  }

  @Test
  void shouldUseMergedCsvInsideExistingDirectory() {
    assertEquals(tempDir.resolve(OutputLocations.MERGED_FILE_NAME), OutputLocations.merged(tempDir));
    assertEquals(tempDir.resolve("all.csv"), OutputLocations.merged(tempDir.resolve("all.csv")));
  }
}
