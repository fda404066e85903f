package se.alipsa.xml2csv.model;

import java.util.List;
import java.util.Objects;

/**
 * A table restricted to a requested set of columns.
 *
 * @param table
 *          the table with the selected header
 * @param missing
 *          requested column names that the source table did not have
 */
public record SelectedTable(Table table, List<String> missing) {

  /**
   * Validate and defensively copy the components.
   *
   * @param table
   *          the projected table
   * @param missing
   *          the missing names
   */
  public SelectedTable {
    Objects.requireNonNull(table, "table");
    missing = List.copyOf(missing);
  }
}
