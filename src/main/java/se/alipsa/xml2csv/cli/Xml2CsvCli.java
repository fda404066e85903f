package se.alipsa.xml2csv.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;
import se.alipsa.xml2csv.Xml2Csv;
import se.alipsa.xml2csv.engine.ConversionOptions;
import se.alipsa.xml2csv.io.CsvOptions;
import se.alipsa.xml2csv.io.CsvTableWriter;
import se.alipsa.xml2csv.io.OutputLocations;
import se.alipsa.xml2csv.model.ConversionResult;
import se.alipsa.xml2csv.model.MergeResult;
import se.alipsa.xml2csv.model.SelectedTable;
import se.alipsa.xml2csv.model.Table;

/**
 * Entry point for the xml2csv command line interface.
 */
@Command(
    name = "xml2csv",
    mixinStandardHelpOptions = true,
    versionProvider = Xml2CsvCli.VersionProvider.class,
    description = "Convert XML file(s) to CSV by flattening repeating child elements")
public class Xml2CsvCli implements Callable<Integer> {

  private static final String UNKNOWN_VERSION = "DEV";

  @Spec
  private CommandSpec spec;

  @Parameters(paramLabel = "<input>", arity = "1..*", description = "One or more XML files to convert")
  private List<Path> inputs;

  @Option(names = "--merge-into", paramLabel = "<path>",
      description = "Combine the rows of all inputs into this single CSV file (or merged.csv in this directory)")
  private Path mergeInto;

  @Option(names = "--output-dir", paramLabel = "<dir>",
      description = "Directory for the CSV files (default: the directory of each input)")
  private Path outputDir;

  @Option(names = "--encoding", paramLabel = "<charset>", defaultValue = "utf-8",
      description = "Encoding of the written CSV (default: ${DEFAULT-VALUE})")
  private String encoding;

  @Option(names = "--delimiter", paramLabel = "<char>", defaultValue = ",",
      description = "CSV delimiter (default: ${DEFAULT-VALUE})")
  private String delimiter;

  @Option(names = "--columns", paramLabel = "<name>", split = ",",
      description = "Only write these columns, in this order")
  private List<String> columns;

  @Option(names = "--list-columns", description = "Print the column names instead of writing CSV")
  private boolean listColumns;

  @Option(names = "--keep-empty", description = "Create columns for elements with empty text")
  private boolean keepEmpty;

  @Option(names = {"-v", "--verbose"}, description = "Log conversion details")
  private boolean verbose;

  /**
   * Start the CLI.
   *
   * @param args
   *          the command line arguments
   */
  public static void main(String[] args) {
    System.exit(new CommandLine(new Xml2CsvCli()).execute(args));
  }

  @Override
  public Integer call() {
    configureLogging();
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();
    CsvOptions csvOptions = new CsvOptions(parseDelimiter(), parseCharset());
    Xml2Csv xml2Csv = new Xml2Csv(new ConversionOptions(keepEmpty));
    CsvTableWriter writer = new CsvTableWriter(csvOptions);
    boolean ok = mergeInto != null ? runMerged(xml2Csv, writer, out, err) : runPerFile(xml2Csv, writer, out, err);
    out.flush();
    err.flush();
    return ok ? CommandLine.ExitCode.OK : CommandLine.ExitCode.SOFTWARE;
  }

  private boolean runMerged(Xml2Csv xml2Csv, CsvTableWriter writer, PrintWriter out, PrintWriter err) {
    MergeResult result = xml2Csv.merge(inputs);
    for (ConversionResult failure : result.failures()) {
      reportFailure(failure, err);
    }
    Table table = applySelection(result.table(), err);
    if (listColumns) {
      table.header().forEach(out::println);
      return !result.hasFailures();
    }
    Path target = OutputLocations.merged(mergeInto);
    try {
      writer.write(table, target);
    } catch (IOException e) {
      err.println("Failed to write " + target + ": " + e.getMessage());
      return false;
    }
    out.println("Wrote merged CSV: " + target);
    return !result.hasFailures();
  }

  private boolean runPerFile(Xml2Csv xml2Csv, CsvTableWriter writer, PrintWriter out, PrintWriter err) {
    boolean ok = true;
    for (Path input : inputs) {
      ConversionResult result = xml2Csv.convert(input);
      if (!result.isSuccess()) {
        reportFailure(result, err);
        ok = false;
        continue;
      }
      Table table = applySelection(result.table(), err);
      if (listColumns) {
        if (inputs.size() > 1) {
          out.println(input + ":");
          table.header().forEach(c -> out.println("  " + c));
        } else {
          table.header().forEach(out::println);
        }
        continue;
      }
      Path target = OutputLocations.perFile(input, outputDir);
      try {
        writer.write(table, target);
        out.println("Wrote: " + target);
      } catch (IOException e) {
        err.println("Failed to write " + target + ": " + e.getMessage());
        ok = false;
      }
    }
    return ok;
  }

  private Table applySelection(Table table, PrintWriter err) {
    if (columns == null || columns.isEmpty()) {
      return table;
    }
    SelectedTable selected = Xml2Csv.select(table, columns.stream().map(String::trim).toList());
    for (String name : selected.missing()) {
      err.println("Warning: column '" + name + "' not found");
    }
    return selected.table();
  }

  private void reportFailure(ConversionResult result, PrintWriter err) {
    if (result.failure() instanceof NoSuchFileException) {
      err.println("Skipping non-existent file: " + result.source());
    } else {
      err.println("Failed to convert " + result.source() + ": " + result.failure().getMessage());
    }
  }

  private char parseDelimiter() {
    String value = "\\t".equals(delimiter) ? "\t" : delimiter;
    if (value == null || value.length() != 1 || value.charAt(0) == '"' || value.charAt(0) == '\n'
        || value.charAt(0) == '\r') {
      throw new ParameterException(spec.commandLine(),
          "Invalid value for option '--delimiter': expected a single character but was '" + delimiter + "'");
    }
    return value.charAt(0);
  }

  private Charset parseCharset() {
    try {
      return Charset.forName(encoding);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
      throw new ParameterException(spec.commandLine(),
          "Invalid value for option '--encoding': unsupported charset '" + encoding + "'", e);
    }
  }

  /** Console messages already report failures; log output is only wanted with --verbose. */
  private void configureLogging() {
    System.setProperty(org.slf4j.simple.SimpleLogger.DEFAULT_LOG_LEVEL_KEY, verbose ? "debug" : "error");
  }

  /**
   * Resolve the CLI version from the package manifest.
   *
   * @return the implementation version, or {@value #UNKNOWN_VERSION} when not
   *         available
   */
  public static String cliVersion() {
    Package pkg = Xml2CsvCli.class.getPackage();
    if (pkg != null) {
      String implementationVersion = pkg.getImplementationVersion();
      if (implementationVersion != null && !implementationVersion.isBlank()) {
        return implementationVersion;
      }
    }
    String sysVersion = System.getProperty("xml2csv.version");
    if (sysVersion != null && !sysVersion.isBlank()) {
      return sysVersion;
    }
    return UNKNOWN_VERSION;
  }

  /**
   * Supplies the {@code --version} text.
   */
  public static final class VersionProvider implements CommandLine.IVersionProvider {

    @Override
    public String[] getVersion() {
      return new String[]{
          "xml2csv " + cliVersion()
      };
    }
  }
}
