package nl.adgroot.pdftools.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import nl.adgroot.pdftools.TestPdfs;
import nl.adgroot.pdftools.config.AppConfig;
import nl.adgroot.pdftools.impose.TwoUpImposer;
import nl.adgroot.pdftools.progress.ConversionListener;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImposeCommandTest {

  @TempDir
  Path tmp;

  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
  private final ImposeCommand command = new ImposeCommand(new AppConfig(), new TwoUpImposer(ConversionListener.NONE));

  @Test
  void noArguments_printsUsage_andExitsZero() {
    assertEquals(0, command.run(new String[0], out));
    assertTrue(output().contains("Usage:"));
  }

  @Test
  void inputOnly_writesDefaultOutputName() throws Exception {
    Path src = TestPdfs.write(tmp, "doc.pdf", "P0", "P1", "P2");

    assertEquals(0, command.run(new String[] {src.toString()}, out));

    Path expected = tmp.resolve("doc_2pp.pdf");
    assertTrue(Files.exists(expected));
    try (PDDocument doc = Loader.loadPDF(expected.toFile())) {
      assertEquals(2, doc.getNumberOfPages());
    }
    assertTrue(output().contains("Conversion completed successfully!"));
  }

  @Test
  void explicitOutputAndLetterFormat() throws Exception {
    Path src = TestPdfs.write(tmp, "doc.pdf", "P0");
    Path dest = tmp.resolve("sheet.pdf");

    assertEquals(0, command.run(new String[] {src.toString(), dest.toString(), "Letter"}, out));

    try (PDDocument doc = Loader.loadPDF(dest.toFile())) {
      assertEquals(792f, doc.getPage(0).getMediaBox().getWidth(), 0.01f);
      assertEquals(612f, doc.getPage(0).getMediaBox().getHeight(), 0.01f);
    }
  }

  @Test
  void missingInput_exitsNonZero() {
    assertEquals(1, command.run(new String[] {tmp.resolve("nope.pdf").toString()}, out));
    assertTrue(output().contains("not found"));
  }

  @Test
  void unknownFormat_exitsNonZero_andWritesNothing() throws Exception {
    Path src = TestPdfs.write(tmp, "doc.pdf", "P0");
    Path dest = tmp.resolve("sheet.pdf");

    assertEquals(1, command.run(new String[] {src.toString(), dest.toString(), "A3"}, out));
    assertFalse(Files.exists(dest));
    assertTrue(output().contains("Conversion failed!"));
  }

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }
}
