package com.flamingo.pdfstructure.service.manifest;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StructuralHasher Tests")
class StructuralHasherTest {

  private final StructuralHasher hasher = new StructuralHasher();

  @Test
  @DisplayName("should sort keys at every level and emit compact JSON")
  void shouldProduceCanonicalJson() {
    Map<String, Object> value = Map.of("b", 1, "a", List.of(Map.of("d", 2, "c", 3)));

    assertThat(hasher.canonicalJson(value)).isEqualTo("{\"a\":[{\"c\":3,\"d\":2}],\"b\":1}");
  }

  @Test
  @DisplayName("should hash UTF-8 bytes with SHA-256")
  void shouldHashWithSha256() {
    assertThat(StructuralHasher.sha256Hex("abc"))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
  }

  @Test
  @DisplayName("should sort rows before hashing")
  void shouldSortRows() {
    SectionProjection first =
        new SectionProjection("sec_0000", "00-a", null, 1, 1, "A", List.of(1, 1));
    SectionProjection second =
        new SectionProjection("sec_0001", "01-b", "sec_0000", 2, 2, "B", List.of(1, 2));

    assertThat(hasher.hash(List.of(second, first), List.of(), List.of()))
        .isEqualTo(hasher.hash(List.of(first, second), List.of(), null));
  }

  @Test
  @DisplayName("should hash footnotes independently of input order")
  void shouldSortFootnotes() {
    FootnoteProjection first = new FootnoteProjection("fn_000", "1", "First note.", 3);
    FootnoteProjection second = new FootnoteProjection("fn_001", "2", "Second note.", 4);

    assertThat(hasher.hash(List.of(), List.of(), List.of(second, first)))
        .isEqualTo(hasher.hash(List.of(), List.of(), List.of(first, second)))
        .isNotEqualTo(hasher.hash(List.of(), List.of(), List.of(first)));
  }

  @Test
  @DisplayName("should read the number after the last underscore")
  void shouldParseIdNumber() {
    assertThat(StructuralHasher.idNumber("fig_012")).isEqualTo(12);
    assertThat(StructuralHasher.idNumber("fn_000")).isZero();
  }
}
