package nl.adgroot.pdftools.merge;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import nl.adgroot.pdftools.result.ConversionException;
import nl.adgroot.pdftools.result.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MergeInputResolverTest {

  @TempDir
  Path tmp;

  @Test
  void selectPdfs_filtersCaseInsensitively_andSortsByFileName() {
    Path dir = Path.of("docs");
    List<Path> listing = List.of(
        dir.resolve("b.pdf"),
        dir.resolve("notes.txt"),
        dir.resolve("a.pdf"),
        dir.resolve("c.PDF"),
        dir.resolve("archive.pdf.zip")
    );

    List<Path> selected = MergeInputResolver.selectPdfs(listing);

    assertEquals(List.of(dir.resolve("a.pdf"), dir.resolve("b.pdf"), dir.resolve("c.PDF")), selected);
  }

  @Test
  void listPdfs_readsDirectory_andSkipsSubdirectories() throws Exception {
    Files.writeString(tmp.resolve("b.pdf"), "");
    Files.writeString(tmp.resolve("a.pdf"), "");
    Files.writeString(tmp.resolve("readme.md"), "");
    Files.createDirectory(tmp.resolve("nested.pdf"));

    List<Path> pdfs = MergeInputResolver.listPdfs(tmp);

    assertEquals(List.of(tmp.resolve("a.pdf"), tmp.resolve("b.pdf")), pdfs);
  }

  @Test
  void listPdfs_regularFile_isInvalidArgument() throws Exception {
    Path file = Files.writeString(tmp.resolve("single.pdf"), "");

    ConversionException ex = assertThrows(ConversionException.class, () -> MergeInputResolver.listPdfs(file));
    assertEquals(ErrorKind.INVALID_ARGUMENT, ex.getKind());
  }

  @Test
  void listPdfs_missingDirectory_isNotFound() {
    ConversionException ex = assertThrows(ConversionException.class,
        () -> MergeInputResolver.listPdfs(tmp.resolve("nope")));
    assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
  }

  @Test
  void requireEnoughInputs_needsTwo() {
    assertThrows(ConversionException.class, () -> MergeInputResolver.requireEnoughInputs(List.of()));
    assertThrows(ConversionException.class,
        () -> MergeInputResolver.requireEnoughInputs(List.of(Path.of("a.pdf"))));
    assertDoesNotThrow(() -> MergeInputResolver.requireEnoughInputs(List.of(Path.of("a.pdf"), Path.of("b.pdf"))));
  }
}
