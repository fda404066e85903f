package se.alipsa.xml2csv.io;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Decides where converted CSV files are placed.
 */
public final class OutputLocations {

  /** File name used when a merge target is an existing directory. */
  public static final String MERGED_FILE_NAME = "merged.csv";

  private OutputLocations() {
  }

  /**
   * Resolve the CSV file for a single input: the input's base name with a
   * {@code .csv} extension, in the output directory or next to the input.
   *
   * @param input
   *          the XML input file
   * @param outputDir
   *          the output directory, or {@code null} to write next to the input
   * @return the CSV file path
   */
  public static Path perFile(Path input, Path outputDir) {
    Objects.requireNonNull(input, "input");
    Path absolute = input.toAbsolutePath().normalize();
    Path dir = outputDir != null ? outputDir.toAbsolutePath().normalize() : absolute.getParent();
    return dir.resolve(baseName(absolute) + ".csv");
  }

  /**
   * Resolve the merged CSV file.
   *
   * @param mergeInto
   *          the requested target, a file or an existing directory
   * @return the CSV file path
   */
  public static Path merged(Path mergeInto) {
    Objects.requireNonNull(mergeInto, "mergeInto");
    Path target = mergeInto.toAbsolutePath().normalize();
    if (Files.isDirectory(target)) {
      return target.resolve(MERGED_FILE_NAME);
    }
    return target;
  }

  private static String baseName(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
