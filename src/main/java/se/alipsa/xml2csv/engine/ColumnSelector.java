package se.alipsa.xml2csv.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filters and reorders a header to a requested list of columns.
 */
public final class ColumnSelector {

  private static final Logger log = LoggerFactory.getLogger(ColumnSelector.class);

  private ColumnSelector() {
  }

  /**
   * Select columns from a header.
   *
   * @param header
   *          the available columns
   * @param requested
   *          the wanted columns in output order; blank entries are ignored and
   *          duplicates are kept once
   * @return the selected columns in requested order and the requested names that
   *         are not in the header
   */
  public static Selection select(List<String> header, List<String> requested) {
    Objects.requireNonNull(header, "header");
    Objects.requireNonNull(requested, "requested");
    Set<String> available = new HashSet<>(header);
    Set<String> wanted = new LinkedHashSet<>();
    for (String name : requested) {
      if (name != null && !name.isBlank()) {
        wanted.add(name);
      }
    }
    List<String> columns = new ArrayList<>();
    List<String> missing = new ArrayList<>();
    for (String name : wanted) {
      if (available.contains(name)) {
        columns.add(name);
      } else {
        log.warn("Requested column '{}' not found", name);
        missing.add(name);
      }
    }
    return new Selection(columns, missing);
  }

  /**
   * Result of a column selection.
   *
   * @param columns
   *          the selected columns in requested order
   * @param missing
   *          requested names absent from the header
   */
  public record Selection(List<String> columns, List<String> missing) {

    /**
     * Defensively copy the components.
     *
     * @param columns
     *          the selected columns
     * @param missing
     *          the missing names
     */
    public Selection {
      columns = List.copyOf(columns);
      missing = List.copyOf(missing);
    }

    public boolean hasMissing() {
      return !missing.isEmpty();
    }
  }
}
