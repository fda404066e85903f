package se.alipsa.xml2csv.io;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Settings for writing CSV files.
 *
 * @param delimiter
 *          the field separator
 * @param charset
 *          the text encoding of the written file
 */
public record CsvOptions(char delimiter, Charset charset) {

  /**
   * Validate the components.
   *
   * @param delimiter
   *          the field separator
   * @param charset
   *          the text encoding
   */
  public CsvOptions {
    Objects.requireNonNull(charset, "charset");
    if (delimiter == '"' || delimiter == '\n' || delimiter == '\r') {
      throw new IllegalArgumentException("Invalid delimiter: " + delimiter);
    }
  }

  /**
   * Get the default settings.
   *
   * @return comma separated UTF-8 output
   */
  public static CsvOptions defaults() {
    return new CsvOptions(',', StandardCharsets.UTF_8);
  }
}
