package se.alipsa.xml2csv.engine;

import java.util.Properties;
import se.alipsa.xml2csv.model.Node;

/**
 * Options that refine how scalar leaves become fields.
 *
 * @param keepEmptyValues
 *          when {@code true} a leaf with blank text still contributes an empty
 *          value (and thus its column); by default such leaves are skipped
 */
public record ConversionOptions(boolean keepEmptyValues) {

  /** Property key for {@link #keepEmptyValues()}. */
  public static final String KEEP_EMPTY_VALUES = "keepEmptyValues";

  /**
   * Get the default options.
   *
   * @return options that skip blank leaves
   */
  public static ConversionOptions defaults() {
    return new ConversionOptions(false);
  }

  /**
   * Read options from properties, falling back to the defaults for absent keys.
   *
   * @param props
   *          the properties, may be {@code null}
   * @return the options
   */
  public static ConversionOptions fromProperties(Properties props) {
    if (props == null) {
      return defaults();
    }
    return new ConversionOptions(Boolean.parseBoolean(props.getProperty(KEEP_EMPTY_VALUES, "false")));
  }

  /**
   * Resolve the value a scalar leaf contributes.
   *
   * @param leaf
   *          a node without children
   * @return the trimmed text, or {@code null} when the leaf contributes nothing
   */
  String scalarValue(Node leaf) {
    String text = leaf.text() == null ? "" : leaf.text().trim();
    if (text.isEmpty() && !keepEmptyValues) {
      return null;
    }
    return text;
  }
}
