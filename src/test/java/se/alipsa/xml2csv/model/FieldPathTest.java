package se.alipsa.xml2csv.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class FieldPathTest {

  @Test
  void shouldExposeLeafAndDottedForm() {
    FieldPath path = FieldPath.of("b", "c").child("fc1");

    assertEquals("fc1", path.leaf());
    assertEquals("b.c.fc1", path.dotted());
    assertEquals(FieldPath.of("b", "c", "fc1"), path);
  }

  @Test
  void shouldRejectEmptyPaths() {
    assertThrows(IllegalArgumentException.class, () -> new FieldPath(List.of()));
  }
}
