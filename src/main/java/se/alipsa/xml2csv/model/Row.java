package se.alipsa.xml2csv.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One output record: an ordered mapping of column name to value. Columns that
 * are part of the header but missing from the row are blank.
 */
public final class Row {

  private final Map<String, String> values;

  private Row(Map<String, String> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Create a builder for a new row.
   *
   * @return an empty builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Get the value of a column.
   *
   * @param column
   *          the column name
   * @return the value, or {@code null} when the row has no value for the column
   */
  public String get(String column) {
    return values.get(column);
  }

  /**
   * Get the column names assigned in this row, in assignment order.
   *
   * @return the assigned column names
   */
  public Set<String> columns() {
    return values.keySet();
  }

  /**
   * Project the row onto a header.
   *
   * @param header
   *          the columns to produce values for
   * @return the values in header order, blank for unassigned columns
   */
  public List<String> valuesFor(List<String> header) {
    List<String> projected = new ArrayList<>(header.size());
    for (String column : header) {
      projected.add(values.getOrDefault(column, ""));
    }
    return projected;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Row other)) {
      return false;
    }
    return values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }

  /**
   * Incrementally assembles a {@link Row}. A later value for the same column
   * replaces the earlier one but keeps its position.
   */
  public static final class Builder {

    private final Map<String, String> values = new LinkedHashMap<>();

    private Builder() {
    }

    /**
     * Assign a column value.
     *
     * @param column
     *          the column name
     * @param value
     *          the value
     * @return this builder
     */
    public Builder put(String column, String value) {
      values.put(Objects.requireNonNull(column, "column"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Row build() {
      return new Row(values);
    }
  }
}
