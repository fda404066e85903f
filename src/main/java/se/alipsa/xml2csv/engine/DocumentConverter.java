package se.alipsa.xml2csv.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.xml2csv.model.Field;
import se.alipsa.xml2csv.model.Node;
import se.alipsa.xml2csv.model.Row;
import se.alipsa.xml2csv.model.Table;

/**
 * Turns a document tree into rows: detects the row unit, collects the ancestor
 * fields of its container and flattens every row element, naming columns and
 * growing the header of the supplied context as fields are discovered.
 *
 * <p>
 * Row elements under a container place their direct fields before nested ones.
 * A document without repetition is a single row whose columns follow document
 * order.
 * </p>
 */
public final class DocumentConverter {

  private static final Logger log = LoggerFactory.getLogger(DocumentConverter.class);

  private DocumentConverter() {
  }

  /**
   * Convert a document.
   *
   * @param root
   *          the document root
   * @param context
   *          the naming and header state to use and update
   * @return the rows of the document in document order
   */
  public static List<Row> convert(Node root, ConversionContext context) {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(context, "context");
    RowUnit unit = RowUnitDetector.detect(root);
    List<Field> ancestors;
    RowFlattener.GroupOrder order;
    if (unit.hasRowTag()) {
      log.debug("Row tag '{}' under container '{}' with {} occurrences", unit.rowTag(), unit.container().tag(),
          unit.rowElements().size());
      ancestors = AncestorFieldCollector.collect(unit.container(), unit.rowTag(), context.options());
      order = RowFlattener.GroupOrder.BY_KIND;
    } else {
      log.debug("No repeating element below '{}', converting the document to a single row", root.tag());
      ancestors = List.of();
      order = RowFlattener.GroupOrder.DOCUMENT;
    }

    List<Row> rows = new ArrayList<>();
    for (Node element : unit.rowElements()) {
      for (List<Field> fragment : RowFlattener.flatten(element, context.options(), order)) {
        Row.Builder row = Row.builder();
        assign(row, ancestors, context);
        assign(row, fragment, context);
        rows.add(row.build());
      }
    }
    log.debug("Converted '{}' into {} rows", root.tag(), rows.size());
    return rows;
  }

  /**
   * Convert a document with its own context.
   *
   * @param root
   *          the document root
   * @param options
   *          the conversion options
   * @return the header and rows of the document
   */
  public static Table toTable(Node root, ConversionOptions options) {
    ConversionContext context = new ConversionContext(options);
    List<Row> rows = convert(root, context);
    return new Table(context.header().header(), rows);
  }

  private static void assign(Row.Builder row, List<Field> fields, ConversionContext context) {
    for (Field field : fields) {
      String column = context.namer().nameFor(field.path());
      context.header().register(column);
      row.put(column, field.value());
    }
  }
}
