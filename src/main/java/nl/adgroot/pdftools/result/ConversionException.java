package nl.adgroot.pdftools.result;

public class ConversionException extends RuntimeException {

  private final ErrorKind kind;

  public ConversionException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ConversionException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public static ConversionException invalidArgument(String message) {
    return new ConversionException(ErrorKind.INVALID_ARGUMENT, message);
  }

  public static ConversionException notFound(String message) {
    return new ConversionException(ErrorKind.NOT_FOUND, message);
  }
}
