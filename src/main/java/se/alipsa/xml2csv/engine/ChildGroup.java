package se.alipsa.xml2csv.engine;

import java.util.List;
import se.alipsa.xml2csv.model.Node;

/**
 * The children of a node that share one tag, classified by how they take part in
 * row expansion.
 */
sealed interface ChildGroup permits ChildGroup.ScalarField, ChildGroup.NestedSingle, ChildGroup.RepeatingGroup {

  /**
   * Classify the members of a tag group.
   *
   * @param members
   *          the children sharing a tag, in document order, never empty
   * @return the classified group
   */
  static ChildGroup classify(List<Node> members) {
    if (members.size() >= 2) {
      return new RepeatingGroup(List.copyOf(members));
    }
    Node single = members.get(0);
    return single.isScalarLeaf() ? new ScalarField(single) : new NestedSingle(single);
  }

  /**
   * Position of the group's fields within a row fragment when groups are ordered
   * by kind; direct fields first, then nested singles, then repeating groups.
   *
   * @return the ordering rank
   */
  int rank();

  /**
   * Whether each member is an alternative of its own, multiplying the fragments
   * of the parent.
   *
   * @return true for a repeating group
   */
  default boolean expands() {
    return false;
  }

  /**
   * A single scalar leaf; one field fixed in every fragment.
   *
   * @param leaf
   *          the leaf node
   */
  record ScalarField(Node leaf) implements ChildGroup {

    @Override
    public int rank() {
      return 0;
    }
  }

  /**
   * A single non-leaf child whose fields extend the parent's.
   *
   * @param node
   *          the nested element
   */
  record NestedSingle(Node node) implements ChildGroup {

    @Override
    public int rank() {
      return 1;
    }
  }

  /**
   * Two or more children with the same tag; an expansion dimension.
   *
   * @param nodes
   *          the occurrences in document order
   */
  record RepeatingGroup(List<Node> nodes) implements ChildGroup {

    @Override
    public int rank() {
      return 2;
    }

    @Override
    public boolean expands() {
      return true;
    }
  }
}
