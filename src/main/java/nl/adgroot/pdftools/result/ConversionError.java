package nl.adgroot.pdftools.result;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;

import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.jetbrains.annotations.NotNull;

/**
 * Why a conversion failed. The cause is kept for diagnostics but callers are expected to branch on
 * {@link #kind()} only.
 */
public record ConversionError(ErrorKind kind, String message, Throwable cause) {

  /**
   * Maps any throwable escaping a conversion onto one of the error kinds.
   *
   * <ul>
   *   <li>{@link ConversionException}: its own kind</li>
   *   <li>{@link NoSuchFileException}, {@link FileNotFoundException}: NOT_FOUND</li>
   *   <li>{@link InvalidPasswordException}: LIBRARY_FAILURE</li>
   *   <li>other {@link IOException}: IO_FAILURE</li>
   *   <li>everything else: LIBRARY_FAILURE</li>
   * </ul>
   */
  public static ConversionError classify(Throwable t) {
    String message = (t.getMessage() == null || t.getMessage().isBlank())
        ? t.getClass().getSimpleName()
        : t.getMessage();

    if (t instanceof ConversionException ce) {
      return new ConversionError(ce.getKind(), message, t);
    }
    if (t instanceof NoSuchFileException || t instanceof FileNotFoundException) {
      return new ConversionError(ErrorKind.NOT_FOUND, message, t);
    }
    if (t instanceof InvalidPasswordException) {
      return new ConversionError(ErrorKind.LIBRARY_FAILURE, message, t);
    }
    if (t instanceof IOException) {
      return new ConversionError(ErrorKind.IO_FAILURE, message, t);
    }
    return new ConversionError(ErrorKind.LIBRARY_FAILURE, message, t);
  }

  @NotNull
  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
