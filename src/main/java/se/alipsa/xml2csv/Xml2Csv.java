package se.alipsa.xml2csv;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.xml2csv.engine.ColumnSelector;
import se.alipsa.xml2csv.engine.ConversionContext;
import se.alipsa.xml2csv.engine.ConversionOptions;
import se.alipsa.xml2csv.engine.DocumentConverter;
import se.alipsa.xml2csv.io.XmlTreeReader;
import se.alipsa.xml2csv.model.ConversionResult;
import se.alipsa.xml2csv.model.MergeResult;
import se.alipsa.xml2csv.model.Node;
import se.alipsa.xml2csv.model.Row;
import se.alipsa.xml2csv.model.SelectedTable;
import se.alipsa.xml2csv.model.Table;

/**
 * Converts XML files to tables, either one table per file or a single merged
 * table. A file that is missing or cannot be parsed is reported as a failed
 * {@link ConversionResult} and never stops the remaining files. Example usage:
 *
 * <pre>
 * <code>
 *   Xml2Csv xml2Csv = new Xml2Csv();
 *   ConversionResult result = xml2Csv.convert(Paths.get("orders.xml"));
 *   if (result.isSuccess()) {
 *     new CsvTableWriter(CsvOptions.defaults()).write(result.table(), Paths.get("orders.csv"));
 *   }
 * </code>
 * </pre>
 */
public class Xml2Csv {

  private static final Logger log = LoggerFactory.getLogger(Xml2Csv.class);

  private final ConversionOptions options;
  private final XmlTreeReader reader;

  /**
   * Create a converter with default options.
   */
  public Xml2Csv() {
    this(ConversionOptions.defaults());
  }

  /**
   * Create a converter.
   *
   * @param options
   *          the conversion options
   */
  public Xml2Csv(ConversionOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.reader = new XmlTreeReader();
  }

  /**
   * Convert a single file with its own column naming.
   *
   * @param input
   *          the XML file
   * @return the table of the file or the failure that prevented conversion
   */
  public ConversionResult convert(Path input) {
    Objects.requireNonNull(input, "input");
    try {
      Node root = load(input);
      Table table = DocumentConverter.toTable(root, options);
      log.info("Converted {} into {} rows and {} columns", input, table.rows().size(), table.header().size());
      return ConversionResult.success(input, table);
    } catch (NoSuchFileException e) {
      log.warn("Skipping non-existent file: {}", input);
      return ConversionResult.failure(input, e);
    } catch (ConversionException e) {
      log.warn("Failed to convert {}: {}", input, e.getMessage());
      return ConversionResult.failure(input, e);
    }
  }

  /**
   * Convert each file independently.
   *
   * @param inputs
   *          the XML files
   * @return one result per input, in input order
   */
  public List<ConversionResult> convertAll(List<Path> inputs) {
    Objects.requireNonNull(inputs, "inputs");
    List<ConversionResult> results = new ArrayList<>(inputs.size());
    for (Path input : inputs) {
      results.add(convert(input));
    }
    return results;
  }

  /**
   * Convert all files into one table sharing a single column naming and header.
   * The header is the union of the file headers in first encountered order.
   *
   * @param inputs
   *          the XML files
   * @return the merged table together with the files that failed
   */
  public MergeResult merge(List<Path> inputs) {
    Objects.requireNonNull(inputs, "inputs");
    ConversionContext context = new ConversionContext(options);
    List<Row> rows = new ArrayList<>();
    List<Path> merged = new ArrayList<>();
    List<ConversionResult> failures = new ArrayList<>();
    for (Path input : inputs) {
      Node root;
      try {
        root = load(input);
      } catch (NoSuchFileException e) {
        log.warn("Skipping non-existent file: {}", input);
        failures.add(ConversionResult.failure(input, e));
        continue;
      } catch (ConversionException e) {
        log.warn("Failed to parse {}: {}", input, e.getMessage());
        failures.add(ConversionResult.failure(input, e));
        continue;
      }
      List<Row> converted = DocumentConverter.convert(root, context);
      log.info("Merged {} rows from {}", converted.size(), input);
      rows.addAll(converted);
      merged.add(input);
    }
    return new MergeResult(new Table(context.header().header(), rows), merged, failures);
  }

  /**
   * List the columns of a single file without keeping its rows.
   *
   * @param input
   *          the XML file
   * @return the header of the file
   * @throws ConversionException
   *           if the file is missing or cannot be parsed
   */
  public List<String> listColumns(Path input) throws ConversionException {
    ConversionResult result = convert(input);
    if (!result.isSuccess()) {
      Exception failure = result.failure();
      if (failure instanceof ConversionException conversionException) {
        throw conversionException;
      }
      throw new ConversionException("File not found: " + input, failure);
    }
    return result.table().header();
  }

  /**
   * List the merged columns of several files. Files that fail are skipped.
   *
   * @param inputs
   *          the XML files
   * @return the union header
   */
  public List<String> listMergedColumns(List<Path> inputs) {
    return merge(inputs).table().header();
  }

  /**
   * Restrict a table to the requested columns, in requested order.
   *
   * @param table
   *          the source table
   * @param requested
   *          the wanted column names
   * @return the projected table and the requested names that were not found
   */
  public static SelectedTable select(Table table, List<String> requested) {
    Objects.requireNonNull(table, "table");
    ColumnSelector.Selection selection = ColumnSelector.select(table.header(), requested);
    return new SelectedTable(table.withHeader(selection.columns()), selection.missing());
  }

  private Node load(Path input) throws ConversionException, NoSuchFileException {
    if (!Files.exists(input)) {
      throw new NoSuchFileException(input.toString());
    }
    return reader.read(input);
  }
}
