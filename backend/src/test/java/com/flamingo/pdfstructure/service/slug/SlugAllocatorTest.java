package com.flamingo.pdfstructure.service.slug;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SlugAllocator Tests")
class SlugAllocatorTest {

  private SlugAllocator allocator;

  @BeforeEach
  void setUp() {
    allocator = new SlugAllocator(2);
  }

  @Test
  @DisplayName("should count collisions on the base slug, not the prefixed one")
  void shouldResolveCollisionsOnBaseSlug() {
    assertThat(allocator.allocate("Section 1", 0)).isEqualTo("00-section-1");
    assertThat(allocator.allocate("Section 2", 1)).isEqualTo("01-section-2");
    assertThat(allocator.allocate("Section", 2)).isEqualTo("02-section");
    assertThat(allocator.allocate("Section", 3)).isEqualTo("03-section-2");
  }

  @Test
  @DisplayName("should suffix the Nth repeat of an unprefixed slug with -N")
  void shouldSuffixRepeats_whenUnprefixed() {
    assertThat(allocator.allocate("Summary")).isEqualTo("summary");
    assertThat(allocator.allocate("Summary")).isEqualTo("summary-2");
    assertThat(allocator.allocate("summary")).isEqualTo("summary-3");
  }

  @Test
  @DisplayName("should skip suffixes already taken by literal titles")
  void shouldSkipTakenSuffix() {
    assertThat(allocator.allocate("Notes 2")).isEqualTo("notes-2");
    assertThat(allocator.allocate("Notes")).isEqualTo("notes");
    assertThat(allocator.allocate("Notes")).isEqualTo("notes-3");
  }

  @Test
  @DisplayName("should name untitled headings")
  void shouldUseFallback_whenSlugEmpty() {
    assertThat(allocator.allocate("***", 4)).isEqualTo("04-untitled");
  }

  @Test
  @DisplayName("should pad prefixes to the configured width")
  void shouldPadPrefix() {
    assertThat(new SlugAllocator(4).allocate("Intro", 7)).isEqualTo("0007-intro");
  }

  @Test
  @DisplayName("should keep an existing numeric prefix when building file stems")
  void shouldKeepExistingPrefix_inFileStem() {
    assertThat(allocator.fileStem("03-results", 9)).isEqualTo("03-results");
    assertThat(allocator.fileStem("results", 9)).isEqualTo("09-results");
  }

  @Test
  @DisplayName("should reject a prefix width below one")
  void shouldRejectInvalidWidth() {
    assertThatThrownBy(() -> new SlugAllocator(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
