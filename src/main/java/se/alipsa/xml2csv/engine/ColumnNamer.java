package se.alipsa.xml2csv.engine;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import se.alipsa.xml2csv.model.FieldPath;

/**
 * Assigns a unique, stable column name to every distinct field path.
 *
 * <p>
 * A path is named after its leaf tag. When a different path already owns that
 * name, the dotted path is used instead, and when the dotted form is taken as
 * well a numeric suffix is appended ({@code _2}, {@code _3}, ...). Names that
 * were handed out earlier never change and the same path always gets the same
 * name.
 * </p>
 */
public final class ColumnNamer {

  private final Map<FieldPath, String> namesByPath = new HashMap<>();
  private final Set<String> claimed = new HashSet<>();

  /**
   * Resolve the column name of a path, claiming a new name the first time the
   * path is seen.
   *
   * @param path
   *          the field path
   * @return the column name
   */
  public String nameFor(FieldPath path) {
    Objects.requireNonNull(path, "path");
    String assigned = namesByPath.get(path);
    if (assigned != null) {
      return assigned;
    }
    String name = path.leaf();
    if (claimed.contains(name)) {
      name = path.dotted();
      if (claimed.contains(name)) {
        String base = name;
        int suffix = 2;
        while (claimed.contains(base + "_" + suffix)) {
          suffix++;
        }
        name = base + "_" + suffix;
      }
    }
    namesByPath.put(path, name);
    claimed.add(name);
    return name;
  }
}
