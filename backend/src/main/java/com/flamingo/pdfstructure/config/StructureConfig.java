package com.flamingo.pdfstructure.config;

import com.flamingo.pdfstructure.exception.InvalidConfigurationException;
import com.flamingo.pdfstructure.service.diagnostics.DiagnosticCategory;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the structural pipeline. */
@Configuration
@ConfigurationProperties(prefix = "structure")
@Getter
@Setter
public class StructureConfig {

  static final double WEIGHT_SUM_TOLERANCE = 1e-6;

  private Lines lines = new Lines();
  private Blocks blocks = new Blocks();
  private Captions captions = new Captions();
  private Slugs slugs = new Slugs();
  private Numbering numbering = new Numbering();
  private Extraction extraction = new Extraction();

  /** Reported in the manifest's {@code generated_with}; never part of the structural hash. */
  private String toolVersion = "0.1.0";

  @Getter
  @Setter
  public static class Lines {
    /** Maximum vertical distance between span centres on the same line, in PDF units. */
    private double verticalTolerance = 3.0;
  }

  @Getter
  @Setter
  public static class Blocks {
    /** Marker x-positions closer than this (PDF units) share a list nesting level. */
    private double listIndentTolerance = 6;

    private int codeMinLines = 2;

    /** Leading indentation, in character columns, that marks a line as code. */
    private int codeIndentThreshold = 4;

    private double tableConfidenceMin = 0.5;

    /** Horizontal gap between spans that separates table columns, in PDF units. */
    private double tableColumnGap = 10.0;

    /** Column starts closer than this are considered aligned across rows. */
    private double tableAlignmentTolerance = 5.0;

    /** Lines set at least this many times the median font size qualify as heading candidates. */
    private double headingFontRatio = 1.15;
  }

  @Getter
  @Setter
  public static class Captions {
    /** Maximum edge-to-edge distance between a figure and a caption candidate. */
    private double maxDistance = 150;

    private double weightDistance = 0.4;
    private double weightPosition = 0.3;
    private double weightPattern = 0.3;

    /** Extension used for figure file names. */
    private String imageFormat = "png";
  }

  @Getter
  @Setter
  public static class Slugs {
    private int prefixWidth = 2;
  }

  @Getter
  @Setter
  public static class Numbering {
    private boolean validateGaps = true;
    private boolean allowChapterResets = false;
    private int maxDepth = 6;
    private boolean appendixRequiresPageBreak = false;

    /** Diagnostic categories that abort a conversion instead of being reported. */
    private Set<DiagnosticCategory> strictCategories = EnumSet.noneOf(DiagnosticCategory.class);
  }

  @Getter
  @Setter
  public static class Extraction {
    /** 1-based page numbers removed before spans reach the pipeline. */
    private List<Integer> excludePages = new ArrayList<>();
  }

  /**
   * Rejects settings the pipeline cannot run with.
   *
   * @throws InvalidConfigurationException on the first invalid value
   */
  @PostConstruct
  public void validate() {
    requirePositive("structure.lines.vertical-tolerance", lines.getVerticalTolerance());
    requirePositive("structure.blocks.list-indent-tolerance", blocks.getListIndentTolerance());
    requireAtLeast("structure.blocks.code-min-lines", blocks.getCodeMinLines(), 1);
    requireAtLeast("structure.blocks.code-indent-threshold", blocks.getCodeIndentThreshold(), 1);
    requireUnit("structure.blocks.table-confidence-min", blocks.getTableConfidenceMin());
    requirePositive("structure.blocks.table-column-gap", blocks.getTableColumnGap());
    requirePositive(
        "structure.blocks.table-alignment-tolerance", blocks.getTableAlignmentTolerance());
    requirePositive("structure.captions.max-distance", captions.getMaxDistance());
    requireAtLeast("structure.slugs.prefix-width", slugs.getPrefixWidth(), 1);
    requireAtLeast("structure.numbering.max-depth", numbering.getMaxDepth(), 1);

    requireUnit("structure.captions.weight-distance", captions.getWeightDistance());
    requireUnit("structure.captions.weight-position", captions.getWeightPosition());
    requireUnit("structure.captions.weight-pattern", captions.getWeightPattern());
    double sum =
        captions.getWeightDistance() + captions.getWeightPosition() + captions.getWeightPattern();
    if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
      throw new InvalidConfigurationException(
          InvalidConfigurationException.WEIGHT_SUM_INVALID,
          "structure.captions",
          "Caption weights must sum to 1.0 but sum to " + sum);
    }
  }

  private static void requirePositive(String property, double value) {
    if (!(value > 0)) {
      throw invalid(property, value, "must be positive");
    }
  }

  private static void requireAtLeast(String property, int value, int minimum) {
    if (value < minimum) {
      throw invalid(property, value, "must be at least " + minimum);
    }
  }

  private static void requireUnit(String property, double value) {
    if (!(value >= 0.0 && value <= 1.0)) {
      throw invalid(property, value, "must be within [0, 1]");
    }
  }

  private static InvalidConfigurationException invalid(
      String property, Object value, String reason) {
    return new InvalidConfigurationException(
        InvalidConfigurationException.INVALID_VALUE,
        property,
        property + " " + reason + " (was " + value + ")");
  }
}
