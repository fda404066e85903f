package se.alipsa.xml2csv.model;

import java.util.List;

/**
 * The tabular form of one or more documents: an ordered header of unique column
 * names and the rows in emission order.
 *
 * @param header
 *          the ordered column names
 * @param rows
 *          the rows, each mapping a subset of the header to values
 */
public record Table(List<String> header, List<Row> rows) {

  /**
   * Defensively copy the components.
   *
   * @param header
   *          the ordered column names
   * @param rows
   *          the rows
   */
  public Table {
    header = List.copyOf(header);
    rows = List.copyOf(rows);
  }

  /**
   * Create a table sharing the rows of this one but exposing another header.
   *
   * @param columns
   *          the header of the projected table
   * @return the projected table
   */
  public Table withHeader(List<String> columns) {
    return new Table(columns, rows);
  }
}
