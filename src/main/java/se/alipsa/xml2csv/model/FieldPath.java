package se.alipsa.xml2csv.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The sequence of tags leading from a row element (or container) down to a
 * scalar leaf. Repetition indexes are not part of the path, so every occurrence
 * of a repeated structure yields the same path.
 *
 * @param tags
 *          the tags from the outermost element to the leaf, never empty
 */
public record FieldPath(List<String> tags) {

  /**
   * Validate and defensively copy the tags.
   *
   * @param tags
   *          the path tags
   */
  public FieldPath {
    if (tags == null || tags.isEmpty()) {
      throw new IllegalArgumentException("A field path needs at least one tag");
    }
    tags = List.copyOf(tags);
  }

  /**
   * Create a path from the supplied tags.
   *
   * @param tags
   *          the path tags
   * @return the path
   */
  public static FieldPath of(String... tags) {
    return new FieldPath(List.of(tags));
  }

  /**
   * Extend this path by one tag.
   *
   * @param tag
   *          the child tag
   * @return a new path ending with {@code tag}
   */
  public FieldPath child(String tag) {
    List<String> extended = new ArrayList<>(tags.size() + 1);
    extended.addAll(tags);
    extended.add(tag);
    return new FieldPath(extended);
  }

  /**
   * Get the leaf tag, used as the default column name.
   *
   * @return the last tag of the path
   */
  public String leaf() {
    return tags.get(tags.size() - 1);
  }

  /**
   * Join the tags with dots, e.g. {@code b.c.fc1}.
   *
   * @return the dotted form of the path
   */
  public String dotted() {
    return String.join(".", tags);
  }

  @Override
  public String toString() {
    return dotted();
  }
}
