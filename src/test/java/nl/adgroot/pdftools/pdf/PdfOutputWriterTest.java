package nl.adgroot.pdftools.pdf;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfOutputWriterTest {

  @TempDir
  Path tmp;

  private final PdfOutputWriter writer = new PdfOutputWriter();

  @Test
  void save_createsMissingParentDirectories_andLeavesNoTempFiles() throws Exception {
    Path out = tmp.resolve("nested/deeper/out.pdf");

    try (PDDocument doc = new PDDocument()) {
      doc.addPage(new PDPage());
      doc.addPage(new PDPage());
      writer.save(doc, out);
    }

    try (PDDocument saved = Loader.loadPDF(out.toFile())) {
      assertEquals(2, saved.getNumberOfPages());
    }
    assertEquals(List.of(out), listDir(out.getParent()));
  }

  @Test
  void save_failure_keepsExistingDestinationAndCleansUp() throws Exception {
    Path out = tmp.resolve("out.pdf");
    Files.writeString(out, "previous");

    PDDocument closed = new PDDocument();
    closed.addPage(new PDPage());
    closed.close();

    assertThrows(IOException.class, () -> writer.save(closed, out));

    assertEquals("previous", Files.readString(out));
    assertEquals(List.of(out), listDir(tmp));
  }

  @Test
  void save_outputGetsSamePermissionsAsAnyNewFile() throws Exception {
    assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
    Path reference = Files.writeString(tmp.resolve("reference.txt"), "x");
    Path out = tmp.resolve("out.pdf");

    try (PDDocument doc = new PDDocument()) {
      doc.addPage(new PDPage());
      writer.save(doc, out);
    }

    assertEquals(Files.getPosixFilePermissions(reference), Files.getPosixFilePermissions(out));
  }

  @Test
  void outputNames_replaceLastExtension() {
    assertEquals(Path.of("dir", "report_2pp.pdf"), OutputNames.withSuffix(Path.of("dir", "report.pdf"), "_2pp"));
    assertEquals(Path.of("a.b_merged.pdf"), OutputNames.withSuffix(Path.of("a.b.PDF"), "_merged"));
    assertEquals(Path.of("noext_2pp.pdf"), OutputNames.withSuffix(Path.of("noext"), "_2pp"));
  }

  private static List<Path> listDir(Path dir) throws IOException {
    try (Stream<Path> s = Files.list(dir)) {
      return s.sorted().toList();
    }
  }
}
