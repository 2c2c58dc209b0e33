package com.flamingo.pdfstructure.service.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.annotations.VisibleForTesting;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Computes the structural hash of a manifest.
 *
 * <p>The hashed projection holds sections, figures and, when non-empty, footnotes. Tool version,
 * assets and cross references are left out, so the hash survives tool upgrades. Rows are sorted
 * (sections by order index, figures and footnotes by the number in their id) and serialised as
 * compact UTF-8 JSON with keys sorted at every level before SHA-256 is applied.
 */
@Component
public class StructuralHasher {

  static final String PREFIX = "sha256:";

  private static final ObjectMapper CANONICAL =
      JsonMapper.builder().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS).build();
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  public String hash(
      List<SectionProjection> sections,
      List<FigureProjection> figures,
      List<FootnoteProjection> footnotes) {
    Map<String, Object> projection = new LinkedHashMap<>();
    projection.put(
        "sections",
        sections.stream()
            .sorted(Comparator.comparingInt(SectionProjection::orderIndex))
            .map(this::toMap)
            .toList());
    projection.put(
        "figures",
        figures.stream()
            .sorted(Comparator.comparingInt(f -> idNumber(f.id())))
            .map(this::toMap)
            .toList());
    if (footnotes != null && !footnotes.isEmpty()) {
      projection.put(
          "footnotes",
          footnotes.stream()
              .sorted(Comparator.comparingInt(f -> idNumber(f.id())))
              .map(this::toMap)
              .toList());
    }
    return PREFIX + sha256Hex(canonicalJson(projection));
  }

  /** Compact JSON with map keys sorted at every level. */
  @VisibleForTesting
  String canonicalJson(Map<String, Object> projection) {
    try {
      return CANONICAL.writeValueAsString(projection);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Structural projection is not serialisable", e);
    }
  }

  static String sha256Hex(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /** Number after the last underscore of an id such as {@code fig_012}. */
  static int idNumber(String id) {
    int underscore = id.lastIndexOf('_');
    return Integer.parseInt(id.substring(underscore + 1));
  }

  private Map<String, Object> toMap(Object row) {
    return CANONICAL.convertValue(row, MAP_TYPE);
  }
}
