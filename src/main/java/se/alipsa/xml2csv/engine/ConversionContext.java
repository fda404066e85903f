package se.alipsa.xml2csv.engine;

import java.util.Objects;

/**
 * State threaded through the conversion of one or more documents: the column
 * namer, the header union and the options. A fresh context gives independent
 * naming per document; reusing one context across documents merges them into a
 * single header.
 */
public final class ConversionContext {

  private final ConversionOptions options;
  private final ColumnNamer namer = new ColumnNamer();
  private final HeaderUnion header = new HeaderUnion();

  /**
   * Create a context.
   *
   * @param options
   *          the conversion options
   */
  public ConversionContext(ConversionOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  /**
   * Create a context with default options.
   *
   * @return a new context
   */
  public static ConversionContext create() {
    return new ConversionContext(ConversionOptions.defaults());
  }

  public ConversionOptions options() {
    return options;
  }

  public ColumnNamer namer() {
    return namer;
  }

  public HeaderUnion header() {
    return header;
  }
}
