package se.alipsa.xml2csv.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of merging several input documents into one table.
 *
 * @param table
 *          the combined header and the rows of all merged documents
 * @param merged
 *          the inputs that contributed rows, in input order
 * @param failures
 *          the inputs that could not be converted
 */
public record MergeResult(Table table, List<Path> merged, List<ConversionResult> failures) {

  /**
   * Validate and defensively copy the components.
   *
   * @param table
   *          the combined table
   * @param merged
   *          the merged inputs
   * @param failures
   *          the failed inputs
   */
  public MergeResult {
    Objects.requireNonNull(table, "table");
    merged = List.copyOf(merged);
    failures = List.copyOf(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
