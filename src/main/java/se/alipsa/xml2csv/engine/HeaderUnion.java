package se.alipsa.xml2csv.engine;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Append-only, order preserving set of column names. A name is placed where it
 * is first registered; later registrations are no-ops.
 */
public final class HeaderUnion {

  private final Set<String> names = new LinkedHashSet<>();

  /**
   * Register a column name.
   *
   * @param name
   *          the column name
   * @return {@code true} if the name was appended to the header
   */
  public boolean register(String name) {
    return names.add(Objects.requireNonNull(name, "name"));
  }

  /**
   * Get a snapshot of the header.
   *
   * @return the column names in first-seen order
   */
  public List<String> header() {
    return List.copyOf(names);
  }
}
