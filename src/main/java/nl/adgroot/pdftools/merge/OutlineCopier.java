package nl.adgroot.pdftools.merge;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.destination.PDPageFitDestination;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineNode;

/**
 * Carries a source document's outline over to the merged document.
 *
 * <p>The outline is first captured as plain {@link BookmarkNode}s against the source's remaining
 * pages, then rebuilt in the destination once those pages have been appended. Items whose target
 * page is not part of the output keep a place only when one of their children survives.
 */
public class OutlineCopier {

  /** Bookmarks of {@code source}, resolved against its current page tree. Empty without an outline. */
  public List<BookmarkNode> capture(PDDocument source) throws IOException {
    PDDocumentOutline outline = source.getDocumentCatalog().getDocumentOutline();
    if (outline == null) {
      return List.of();
    }
    return captureChildren(source, outline);
  }

  private List<BookmarkNode> captureChildren(PDDocument source, PDOutlineNode parent) throws IOException {
    List<BookmarkNode> nodes = new ArrayList<>();
    for (PDOutlineItem item : parent.children()) {
      List<BookmarkNode> children = captureChildren(source, item);
      int pageIndex = resolvePageIndex(source, item);

      if (pageIndex < 0 && children.isEmpty()) {
        continue;
      }
      nodes.add(new BookmarkNode(item.getTitle(), pageIndex, children));
    }
    return nodes;
  }

  private static int resolvePageIndex(PDDocument source, PDOutlineItem item) throws IOException {
    PDPage page = item.findDestinationPage(source);
    if (page == null) {
      return -1;
    }
    return source.getPages().indexOf(page);
  }

  /**
   * Appends {@code bookmarks} under the destination's outline root, creating the root when the
   * destination has none yet.
   *
   * @param pageOffset index in {@code destination} of the first page appended from the source the
   *                   bookmarks were captured from
   * @return number of outline items added
   */
  public int append(PDDocument destination, List<BookmarkNode> bookmarks, int pageOffset) {
    if (bookmarks.isEmpty()) {
      return 0;
    }
    PDDocumentOutline root = destination.getDocumentCatalog().getDocumentOutline();
    if (root == null) {
      root = new PDDocumentOutline();
      destination.getDocumentCatalog().setDocumentOutline(root);
    }
    return appendChildren(destination, root, bookmarks, pageOffset);
  }

  private int appendChildren(PDDocument destination, PDOutlineNode parent, List<BookmarkNode> nodes, int pageOffset) {
    int added = 0;
    for (BookmarkNode node : nodes) {
      PDOutlineItem item = new PDOutlineItem();
      item.setTitle(node.title());

      if (node.hasTarget()) {
        PDPageFitDestination dest = new PDPageFitDestination();
        dest.setPage(destination.getPage(pageOffset + node.pageIndex()));
        item.setDestination(dest);
      }

      parent.addLast(item);
      added++;
      added += appendChildren(destination, item, node.children(), pageOffset);
    }
    return added;
  }
}
