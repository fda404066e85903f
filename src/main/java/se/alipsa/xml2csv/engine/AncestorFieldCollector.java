package se.alipsa.xml2csv.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import se.alipsa.xml2csv.model.Field;
import se.alipsa.xml2csv.model.FieldPath;
import se.alipsa.xml2csv.model.Node;

/**
 * Extracts the scalar fields of a container that are replicated into every row
 * produced for it.
 *
 * <p>
 * Only direct scalar leaf children are collected. Nested structure of the
 * container other than the row group is not expanded.
 * </p>
 */
public final class AncestorFieldCollector {

  private AncestorFieldCollector() {
  }

  /**
   * Collect the ancestor fields of a container.
   *
   * @param container
   *          the node holding the repeating group
   * @param rowTag
   *          the repeated tag to exclude, may be {@code null}
   * @param options
   *          decides whether blank leaves contribute
   * @return the fields in document order, each with path {@code [container, leaf]}
   */
  public static List<Field> collect(Node container, String rowTag, ConversionOptions options) {
    Objects.requireNonNull(container, "container");
    Objects.requireNonNull(options, "options");
    FieldPath base = FieldPath.of(container.tag());
    List<Field> fields = new ArrayList<>();
    for (Node child : container.children()) {
      if (!child.isScalarLeaf() || child.tag().equals(rowTag)) {
        continue;
      }
      String value = options.scalarValue(child);
      if (value != null) {
        fields.add(new Field(base.child(child.tag()), value));
      }
    }
    return fields;
  }
}
