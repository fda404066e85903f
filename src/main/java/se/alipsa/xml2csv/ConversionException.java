package se.alipsa.xml2csv;

/**
 * Signals that an input document could not be converted, typically because it
 * could not be read or is not well formed.
 */
public class ConversionException extends Exception {

  private static final long serialVersionUID = 1L;

  /**
   * Create an exception with a message.
   *
   * @param message
   *          the detail message
   */
  public ConversionException(String message) {
    super(message);
  }

  /**
   * Create an exception with a message and cause.
   *
   * @param message
   *          the detail message
   * @param cause
   *          the underlying failure
   */
  public ConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
