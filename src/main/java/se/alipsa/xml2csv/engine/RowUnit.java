package se.alipsa.xml2csv.engine;

import java.util.List;
import java.util.Objects;
import se.alipsa.xml2csv.model.Node;

/**
 * The repeating structure that defines the rows of a document.
 *
 * @param container
 *          the node whose direct children hold the repeating group, or the root
 *          when the document has no repetition
 * @param rowTag
 *          the repeated child tag, {@code null} when nothing repeats
 * @param rowElements
 *          the occurrences of the row tag in document order, or the root alone
 *          when nothing repeats
 */
public record RowUnit(Node container, String rowTag, List<Node> rowElements) {

  /**
   * Validate the components.
   *
   * @param container
   *          the container node
   * @param rowTag
   *          the repeated tag
   * @param rowElements
   *          the row elements
   */
  public RowUnit {
    Objects.requireNonNull(container, "container");
    rowElements = List.copyOf(rowElements);
  }

  /**
   * Check whether a repeating group was found.
   *
   * @return {@code false} when the whole document is a single row
   */
  public boolean hasRowTag() {
    return rowTag != null;
  }
}
