package se.alipsa.xml2csv.io;

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import se.alipsa.xml2csv.model.Row;
import se.alipsa.xml2csv.model.Table;

/**
 * Writes a {@link Table} as CSV: the header line followed by one line per row,
 * with blank values for columns a row does not assign.
 */
public final class CsvTableWriter {

  private final CsvOptions options;

  /**
   * Create a writer.
   *
   * @param options
   *          delimiter and encoding to use
   */
  public CsvTableWriter(CsvOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  /**
   * Write a table to a file, replacing any existing content.
   *
   * @param table
   *          the table to write
   * @param target
   *          the output file
   * @throws IOException
   *           if the file cannot be written
   */
  public void write(Table table, Path target) throws IOException {
    Objects.requireNonNull(target, "target");
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(target, options.charset())) {
      write(table, writer);
    }
  }

  /**
   * Write a table to a character stream. The stream is flushed but not closed.
   *
   * @param table
   *          the table to write
   * @param writer
   *          the destination
   * @throws IOException
   *           if writing fails
   */
  public void write(Table table, Writer writer) throws IOException {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(writer, "writer");
    List<String> header = table.header();
    ICSVWriter csv = new CSVWriter(writer, options.delimiter(), ICSVWriter.DEFAULT_QUOTE_CHARACTER,
        ICSVWriter.DEFAULT_ESCAPE_CHARACTER, ICSVWriter.RFC4180_LINE_END);
    csv.writeNext(header.toArray(new String[0]), false);
    for (Row row : table.rows()) {
      csv.writeNext(row.valuesFor(header).toArray(new String[0]), false);
    }
    csv.flush();
    if (csv.checkError()) {
      throw new IOException("Failed to write CSV output");
    }
  }
}
