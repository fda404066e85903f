package se.alipsa.xml2csv.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable element of a parsed document tree. A node has a tag, an optional
 * text value and an ordered list of child nodes. A node without children is a
 * scalar leaf and its text (possibly empty) is its value.
 */
public final class Node {

  private final String tag;
  private final String text;
  private final List<Node> children;

  /**
   * Create a node.
   *
   * @param tag
   *          the element tag, must not be {@code null}
   * @param text
   *          the text value, may be {@code null} when absent
   * @param children
   *          ordered child nodes, may be {@code null} for a leaf
   */
  public Node(String tag, String text, List<Node> children) {
    this.tag = Objects.requireNonNull(tag, "tag");
    this.text = text;
    this.children = children == null || children.isEmpty() ? List.of()
        : Collections.unmodifiableList(new ArrayList<>(children));
  }

  /**
   * Create a scalar leaf.
   *
   * @param tag
   *          the element tag
   * @param text
   *          the leaf value
   * @return a node without children
   */
  public static Node leaf(String tag, String text) {
    return new Node(tag, text, List.of());
  }

  /**
   * Create an element holding the supplied children.
   *
   * @param tag
   *          the element tag
   * @param children
   *          the children in document order
   * @return a node with the given children and no text
   */
  public static Node element(String tag, Node... children) {
    return new Node(tag, null, Arrays.asList(children));
  }

  public String tag() {
    return tag;
  }

  /**
   * Get the text value of this node.
   *
   * @return the text, or {@code null} when the node carries none
   */
  public String text() {
    return text;
  }

  public List<Node> children() {
    return children;
  }

  /**
   * Check whether this node is a scalar leaf.
   *
   * @return {@code true} when the node has no children
   */
  public boolean isScalarLeaf() {
    return children.isEmpty();
  }

  /**
   * Group the direct children by tag. Groups are ordered by the first occurrence
   * of their tag and each group keeps its members in document order.
   *
   * @return a new insertion ordered map of tag to child nodes
   */
  public Map<String, List<Node>> childrenByTag() {
    Map<String, List<Node>> groups = new LinkedHashMap<>();
    for (Node child : children) {
      groups.computeIfAbsent(child.tag(), t -> new ArrayList<>()).add(child);
    }
    return groups;
  }

  @Override
  public String toString() {
    return "Node{" + tag + (isScalarLeaf() ? "=" + text : ", children=" + children.size()) + "}";
  }
}
