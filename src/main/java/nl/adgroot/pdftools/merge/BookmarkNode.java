package nl.adgroot.pdftools.merge;

import java.util.List;

import org.jetbrains.annotations.NotNull;

/**
 * Detached copy of one outline item.
 *
 * @param title      bookmark text
 * @param pageIndex  target page, counted within the pages selected from its source; -1 when the
 *                   bookmark has no target among them
 * @param children   nested bookmarks, in outline order
 */
public record BookmarkNode(String title, int pageIndex, List<BookmarkNode> children) {

  public BookmarkNode {
    children = children == null ? List.of() : List.copyOf(children);
  }

  public boolean hasTarget() {
    return pageIndex >= 0;
  }

  /** Number of bookmarks in this subtree, this one included. */
  public int size() {
    int n = 1;
    for (BookmarkNode child : children) {
      n += child.size();
    }
    return n;
  }

  @NotNull
  @Override
  public String toString() {
    return title + " -> " + pageIndex + (children.isEmpty() ? "" : " " + children);
  }
}
