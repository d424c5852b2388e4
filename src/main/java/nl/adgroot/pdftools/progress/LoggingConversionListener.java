package nl.adgroot.pdftools.progress;

import java.nio.file.Path;
import java.util.List;

import nl.adgroot.pdftools.result.ConversionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingConversionListener implements ConversionListener {

  private static final Logger log = LoggerFactory.getLogger(LoggingConversionListener.class);

  @Override
  public void started(String operation, List<Path> inputs, Path output) {
    log.info("{}: {} input file(s) -> {}", operation, inputs.size(), output);
    for (int i = 0; i < inputs.size(); i++) {
      log.info("  {}. {}", i + 1, inputs.get(i).getFileName());
    }
  }

  @Override
  public void sourceOpened(Path source, int pageCount) {
    log.info("Processing: {} ({} pages)", source.getFileName(), pageCount);
  }

  @Override
  public void sheetWritten(int index, int total) {
    log.debug("Sheet {}/{} laid out", index, total);
  }

  @Override
  public void pagesAppended(Path source, int count) {
    log.info("  Added {} pages from {}", count, source.getFileName());
  }

  @Override
  public void finished(ConversionResult result) {
    // failures are logged, with their trace, by the engine itself
    if (result.isSuccess()) {
      log.info("Saved: {}", result.output());
      log.info("Total pages in output: {}", result.pageCount());
    }
  }
}
