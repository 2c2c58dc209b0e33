package com.flamingo.pdfstructure.service.manifest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;

/**
 * Document manifest. Field order is part of the format.
 *
 * @param schemaVersion manifest schema version
 * @param sections sections in pre-order
 * @param figures figures in id order
 * @param footnotes footnotes in id order
 * @param assets extra output files; not hashed
 * @param crossReferences resolved references; not hashed
 * @param structuralHash {@code sha256:<hex>} over sections, figures and non-empty footnotes
 * @param generatedWith producing tool; not hashed
 */
@JsonPropertyOrder({
  "schema_version",
  "sections",
  "figures",
  "footnotes",
  "assets",
  "cross_references",
  "structural_hash",
  "generated_with"
})
public record Manifest(
    @JsonProperty("schema_version") String schemaVersion,
    List<SectionProjection> sections,
    List<FigureProjection> figures,
    List<FootnoteProjection> footnotes,
    List<Map<String, Object>> assets,
    @JsonProperty("cross_references") List<Map<String, Object>> crossReferences,
    @JsonProperty("structural_hash") String structuralHash,
    @JsonProperty("generated_with") GeneratedWith generatedWith) {

  public static final String SCHEMA_VERSION = "1.0.0";

  /**
   * @param tool tool name
   * @param version tool version
   */
  public record GeneratedWith(String tool, String version) {}
}
