package se.alipsa.xml2csv.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of converting one input document: either a {@link Table} or the
 * failure that prevented conversion.
 *
 * @param source
 *          the input the result belongs to
 * @param table
 *          the converted table, {@code null} on failure
 * @param failure
 *          the failure cause, {@code null} on success
 */
public record ConversionResult(Path source, Table table, Exception failure) {

  /**
   * Validate that exactly one of table and failure is present.
   *
   * @param source
   *          the input the result belongs to
   * @param table
   *          the converted table
   * @param failure
   *          the failure cause
   */
  public ConversionResult {
    Objects.requireNonNull(source, "source");
    if ((table == null) == (failure == null)) {
      throw new IllegalArgumentException("Exactly one of table and failure must be set");
    }
  }

  public static ConversionResult success(Path source, Table table) {
    return new ConversionResult(source, table, null);
  }

  public static ConversionResult failure(Path source, Exception failure) {
    return new ConversionResult(source, null, failure);
  }

  public boolean isSuccess() {
    return table != null;
  }
}
