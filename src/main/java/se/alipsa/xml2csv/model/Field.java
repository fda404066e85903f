package se.alipsa.xml2csv.model;

import java.util.Objects;

/**
 * A scalar value discovered in a document together with the path that leads to
 * it.
 *
 * @param path
 *          the path of the scalar leaf
 * @param value
 *          the leaf value, never {@code null}
 */
public record Field(FieldPath path, String value) {

  /**
   * Validate the components.
   *
   * @param path
   *          the path of the scalar leaf
   * @param value
   *          the leaf value
   */
  public Field {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(value, "value");
  }
}
