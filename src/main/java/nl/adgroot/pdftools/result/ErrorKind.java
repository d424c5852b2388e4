package nl.adgroot.pdftools.result;

public enum ErrorKind {
  /** Bad page size, margins too large, non-directory where a directory is required, too few inputs. */
  INVALID_ARGUMENT,
  /** Missing input file or directory. */
  NOT_FOUND,
  /** Unreadable input or unwritable destination. */
  IO_FAILURE,
  /** Malformed or unsupported source PDF, or any other failure inside PDFBox. */
  LIBRARY_FAILURE
}
