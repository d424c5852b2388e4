package nl.adgroot.pdftools.merge;

import org.jetbrains.annotations.NotNull;

/**
 * Zero-based, half-open page interval {@code [start, end)}. Applied to every source of a merge after
 * clamping to that source's page count.
 */
public record PageRange(int start, int end) {

  /**
   * start is clamped to {@code [0, pageCount-1]}, end to {@code [start, pageCount]}. An empty
   * document always yields the empty range {@code [0, 0)}.
   */
  public PageRange clamp(int pageCount) {
    int s = Math.max(0, Math.min(start, pageCount - 1));
    int e = Math.max(s, Math.min(end, pageCount));
    return new PageRange(s, e);
  }

  public int size() {
    return Math.max(0, end - start);
  }

  public boolean contains(int index) {
    return index >= start && index < end;
  }

  public static PageRange all(int pageCount) {
    return new PageRange(0, pageCount);
  }

  @NotNull
  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
