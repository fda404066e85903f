package se.alipsa.xml2csv.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import se.alipsa.xml2csv.model.Node;

/**
 * Locates the row defining repeating group of a document.
 *
 * <p>
 * The tree is walked in document order (pre-order, left to right) and the first
 * node having two or more direct children with the same tag becomes the
 * container. When several tags repeat under that node, the tag whose first
 * occurrence comes earliest is chosen.
 * </p>
 */
public final class RowUnitDetector {

  private RowUnitDetector() {
  }

  /**
   * Detect the row unit of a document.
   *
   * @param root
   *          the document root
   * @return the container and row tag, or the root without row tag when no node
   *         has repeated children
   */
  public static RowUnit detect(Node root) {
    Objects.requireNonNull(root, "root");
    Deque<Node> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Node node = stack.pop();
      Map<String, List<Node>> groups = node.childrenByTag();
      for (Map.Entry<String, List<Node>> group : groups.entrySet()) {
        if (group.getValue().size() >= 2) {
          return new RowUnit(node, group.getKey(), group.getValue());
        }
      }
      List<Node> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return new RowUnit(root, null, List.of(root));
  }
}
