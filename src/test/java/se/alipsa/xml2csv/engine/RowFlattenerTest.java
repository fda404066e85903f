package se.alipsa.xml2csv.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static se.alipsa.xml2csv.model.Node.element;
import static se.alipsa.xml2csv.model.Node.leaf;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import se.alipsa.xml2csv.model.Field;
import se.alipsa.xml2csv.model.FieldPath;
import se.alipsa.xml2csv.model.Node;

class RowFlattenerTest {

  private static final ConversionOptions DEFAULTS = ConversionOptions.defaults();
  private static final RowFlattener.GroupOrder BY_KIND = RowFlattener.GroupOrder.BY_KIND;

  @Test
  void shouldProduceSingleFragmentWithoutRepetition() {
    Node b = element("b", leaf("fb1", "1"), leaf("fb2", "2"), element("c", leaf("fc1", "3")));

    List<List<Field>> fragments = RowFlattener.flatten(b, DEFAULTS, BY_KIND);

    assertEquals(1, fragments.size());
    assertEquals(List.of(
        new Field(FieldPath.of("b", "fb1"), "1"),
        new Field(FieldPath.of("b", "fb2"), "2"),
        new Field(FieldPath.of("b", "c", "fc1"), "3")), fragments.get(0));
  }

  @Test
  void shouldExpandCartesianProductAcrossRepeatingGroups() {
    Node order = element("order",
        leaf("id", "7"),
        element("line", leaf("sku", "A")),
        element("line", leaf("sku", "B")),
        element("tag", leaf("t", "x")),
        element("tag", leaf("t", "y")),
        element("tag", leaf("t", "z")));

    List<List<Field>> fragments = RowFlattener.flatten(order, DEFAULTS, BY_KIND);

    assertEquals(6, fragments.size());
    assertEquals(List.of("7|A|x", "7|A|y", "7|A|z", "7|B|x", "7|B|y", "7|B|z"), values(fragments));
  }

  @Test
  void shouldPlaceDirectFieldsBeforeNestedAndRepeatingFields() {
    Node b = element("b",
        element("item", leaf("n", "1")),
        element("item", leaf("n", "2")),
        element("info", leaf("note", "i")),
        leaf("last", "l"));

    List<List<Field>> fragments = RowFlattener.flatten(b, DEFAULTS, BY_KIND);

    assertEquals(List.of("l|i|1", "l|i|2"), values(fragments));
  }

  @Test
  void shouldKeepChildGroupsInDocumentOrderWhenRequested() {
    Node b = element("b",
        element("item", leaf("n", "1")),
        element("item", leaf("n", "2")),
        element("info", leaf("note", "i")),
        leaf("last", "l"));

    List<List<Field>> fragments = RowFlattener.flatten(b, DEFAULTS, RowFlattener.GroupOrder.DOCUMENT);

    assertEquals(List.of("1|i|l", "2|i|l"), values(fragments));
    assertEquals(FieldPath.of("b", "last"), fragments.get(0).get(2).path());
  }

  @Test
  void shouldExpandRepeatingGroupsInsideNestedSingles() {
    Node b = element("b", leaf("id", "1"), element("details", element("d", leaf("v", "a")), element("d",
        leaf("v", "b"))));

    List<List<Field>> fragments = RowFlattener.flatten(b, DEFAULTS, BY_KIND);

    assertEquals(2, fragments.size());
    assertEquals(FieldPath.of("b", "details", "d", "v"), fragments.get(1).get(1).path());
  }

  @Test
  void shouldExpandNestedRepetitionPerMember() {
    Node b = element("b",
        element("g", leaf("k", "1"), leaf("v", "x"), leaf("v", "y")),
        element("g", leaf("k", "2")));

    List<List<Field>> fragments = RowFlattener.flatten(b, DEFAULTS, BY_KIND);

    assertEquals(List.of("1|x", "1|y", "2"), values(fragments));
  }

  @Test
  void shouldTreatRepeatedLeavesAsDimension() {
    Node b = element("b", leaf("name", "n"), leaf("alias", "x"), leaf("alias", "y"));

    List<List<Field>> fragments = RowFlattener.flatten(b, DEFAULTS, BY_KIND);

    assertEquals(List.of("n|x", "n|y"), values(fragments));
    assertEquals(FieldPath.of("b", "alias"), fragments.get(0).get(1).path());
  }

  @Test
  void shouldKeepOccurrenceWhenGroupIsAbsent() {
    Node b = element("b", leaf("id", "2"));

    List<List<Field>> fragments = RowFlattener.flatten(b, DEFAULTS, BY_KIND);

    assertEquals(List.of("2"), values(fragments));
  }

  @Test
  void shouldYieldEmptyFragmentForEmptyElement() {
    List<List<Field>> fragments = RowFlattener.flatten(element("b", leaf("blank", "")), DEFAULTS, BY_KIND);

    assertEquals(1, fragments.size());
    assertTrue(fragments.get(0).isEmpty());
  }

  @Test
  void shouldFlattenSharedNodeInstancesIndependently() {
    Node shared = element("line", leaf("sku", "S"));
    Node b = element("b", shared, shared);

    assertEquals(List.of("S", "S"), values(RowFlattener.flatten(b, DEFAULTS, BY_KIND)));
  }

  @Test
  void shouldHandleVeryDeepElements() {
    Node node = leaf("value", "deep");
    for (int i = 0; i < 10_000; i++) {
      node = element("n", node);
    }

    List<List<Field>> fragments = RowFlattener.flatten(node, DEFAULTS, BY_KIND);

    assertEquals(1, fragments.size());
    Field field = fragments.get(0).get(0);
    assertEquals("deep", field.value());
    assertEquals(10_001, field.path().tags().size());
  }

  private static List<String> values(List<List<Field>> fragments) {
    List<String> result = new ArrayList<>();
    for (List<Field> fragment : fragments) {
      result.add(fragment.stream().map(Field::value).collect(Collectors.joining("|")));
    }
    return result;
  }
}
