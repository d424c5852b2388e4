package nl.adgroot.pdftools.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {

  public ImposeConfig impose = new ImposeConfig();
  public MergeConfig merge = new MergeConfig();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ImposeConfig {
    // "A4" or "Letter"
    public String format = "A4";

    // margin around each placed page, in points
    public float marginPt = 12f;

    // enlarge pages smaller than the half-sheet
    public boolean scaleUp = false;

    public String outputSuffix = "_2pp";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class MergeConfig {
    public boolean preserveBookmarks = true;

    public String outputSuffix = "_merged";
  }
}
