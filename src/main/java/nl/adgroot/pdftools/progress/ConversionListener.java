package nl.adgroot.pdftools.progress;

import java.nio.file.Path;
import java.util.List;

import nl.adgroot.pdftools.result.ConversionResult;

/**
 * Progress callbacks fired by the imposition and merge engines. All methods are optional; the
 * engines call them on the converting thread, in order. Every call into an engine fires
 * {@link #started} once and ends with exactly one {@link #finished}, also when the arguments are
 * rejected before any input is read.
 */
public interface ConversionListener {

  ConversionListener NONE = new ConversionListener() {};

  default void started(String operation, List<Path> inputs, Path output) {}

  default void sourceOpened(Path source, int pageCount) {}

  /** Imposition only: sheet {@code index} (1-based) of {@code total} has been laid out. */
  default void sheetWritten(int index, int total) {}

  /** Merge only: {@code count} pages of {@code source} were appended to the output. */
  default void pagesAppended(Path source, int count) {}

  /** Non-fatal problem; the conversion continues. */
  default void warning(String message, Throwable cause) {}

  default void finished(ConversionResult result) {}
}
