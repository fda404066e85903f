package se.alipsa.xml2csv.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import se.alipsa.xml2csv.model.Field;
import se.alipsa.xml2csv.model.FieldPath;
import se.alipsa.xml2csv.model.Node;

/**
 * Expands one occurrence of the row element into one or more row fragments.
 *
 * <p>
 * Every node yields a list of fragments, each an ordered list of fields whose
 * paths start at the row element. A node combines the groups of its children:
 * a scalar leaf contributes a fixed field, a nested single contributes its own
 * fragments and a repeating group contributes the fragments of all its members.
 * The fragments of the node are the cartesian product over these groups, the
 * first group varying slowest. The groups are taken in the order chosen by
 * {@link GroupOrder}. A group that is absent for an occurrence simply
 * does not take part, so every node yields at least one fragment.
 * </p>
 *
 * <p>
 * The tree is processed bottom-up with an explicit stack so arbitrarily deep
 * documents do not exhaust the call stack.
 * </p>
 */
public final class RowFlattener {

  private static final Comparator<Dimension> KIND_ORDER = Comparator.comparingInt(d -> d.group().rank());

  /**
   * How the child groups of a node are ordered before they are combined.
   */
  public enum GroupOrder {
    /** Direct scalar fields, then nested singles, then repeating groups. */
    BY_KIND,
    /** Order of each tag's first occurrence. */
    DOCUMENT
  }

  private RowFlattener() {
  }

  /**
   * Flatten a single row element.
   *
   * @param element
   *          the occurrence of the row tag
   * @param options
   *          decides whether blank leaves contribute
   * @param order
   *          the order of the child groups within each fragment
   * @return the row fragments, never empty
   */
  public static List<List<Field>> flatten(Node element, ConversionOptions options, GroupOrder order) {
    Objects.requireNonNull(element, "element");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(order, "order");
    Frame root = new Frame(element, null);
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (frame.children == null) {
        frame.children = new ArrayList<>(frame.node.children().size());
        for (Node child : frame.node.children()) {
          frame.children.add(new Frame(child, frame));
        }
        for (int i = frame.children.size() - 1; i >= 0; i--) {
          stack.push(frame.children.get(i));
        }
        continue;
      }
      stack.pop();
      frame.fragments = combine(frame, options, order);
      frame.children = List.of();
    }
    return root.fragments;
  }

  private static List<List<Field>> combine(Frame frame, ConversionOptions options, GroupOrder order) {
    if (frame.node.isScalarLeaf()) {
      List<Field> fragment = new ArrayList<>(1);
      String value = options.scalarValue(frame.node);
      if (value != null) {
        fragment.add(new Field(frame.path(), value));
      }
      List<List<Field>> single = new ArrayList<>(1);
      single.add(fragment);
      return single;
    }
    Map<String, List<Frame>> byTag = new LinkedHashMap<>();
    for (Frame child : frame.children) {
      byTag.computeIfAbsent(child.node.tag(), t -> new ArrayList<>()).add(child);
    }
    List<Dimension> dimensions = new ArrayList<>(byTag.size());
    for (List<Frame> members : byTag.values()) {
      List<Node> nodes = new ArrayList<>(members.size());
      for (Frame member : members) {
        nodes.add(member.node);
      }
      dimensions.add(new Dimension(ChildGroup.classify(nodes), members));
    }
    if (order == GroupOrder.BY_KIND) {
      dimensions.sort(KIND_ORDER);
    }

    List<List<Field>> product = new ArrayList<>();
    product.add(new ArrayList<>());
    for (Dimension dimension : dimensions) {
      if (!dimension.group().expands()) {
        product = cartesian(product, dimension.members().get(0).fragments);
        continue;
      }
      List<List<Field>> alternatives = new ArrayList<>();
      for (Frame member : dimension.members()) {
        alternatives.addAll(member.fragments);
      }
      product = cartesian(product, alternatives);
    }
    return product;
  }

  private static List<List<Field>> cartesian(List<List<Field>> prefixes, List<List<Field>> alternatives) {
    if (alternatives.size() == 1) {
      List<Field> only = alternatives.get(0);
      for (List<Field> prefix : prefixes) {
        prefix.addAll(only);
      }
      return prefixes;
    }
    List<List<Field>> combined = new ArrayList<>(prefixes.size() * alternatives.size());
    for (List<Field> prefix : prefixes) {
      for (List<Field> alternative : alternatives) {
        List<Field> fragment = new ArrayList<>(prefix.size() + alternative.size());
        fragment.addAll(prefix);
        fragment.addAll(alternative);
        combined.add(fragment);
      }
    }
    return combined;
  }

  /**
   * A classified child group paired with the frames of its members.
   */
  private record Dimension(ChildGroup group, List<Frame> members) {
  }

  private static final class Frame {

    private final Node node;
    private final Frame parent;
    private List<Frame> children;
    private List<List<Field>> fragments;

    Frame(Node node, Frame parent) {
      this.node = node;
      this.parent = parent;
    }

    /** Tags from the row element down to this node; only leaves need one. */
    FieldPath path() {
      Deque<String> tags = new ArrayDeque<>();
      for (Frame f = this; f != null; f = f.parent) {
        tags.push(f.node.tag());
      }
      return new FieldPath(new ArrayList<>(tags));
    }
  }
}
