package com.flamingo.pdfstructure.service.slug;

import com.flamingo.pdfstructure.exception.SlugCollisionException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Allocates deterministic, collision-free section slugs.
 *
 * <p>Collisions are counted on the base text slug, before any numeric prefix is applied: the Nth
 * repeat of the same base gets the suffix {@code -N}. So {@code "Section 1"}, {@code "Section 2"},
 * {@code "Section"}, {@code "Section"} at prefixes 0..3 yield {@code 00-section-1}, {@code
 * 01-section-2}, {@code 02-section}, {@code 03-section-2}.
 *
 * <p>Holds document-scoped counters: use one instance per conversion, in document order.
 */
public class SlugAllocator {

  static final int MAX_ATTEMPTS = 1000;
  static final String EMPTY_SLUG = "untitled";

  private static final Pattern NUMERIC_PREFIX = Pattern.compile("^\\d+-");

  private final int prefixWidth;
  private final Map<String, Integer> occurrences = new HashMap<>();
  private final Set<String> allocated = new HashSet<>();

  public SlugAllocator(int prefixWidth) {
    if (prefixWidth < 1) {
      throw new IllegalArgumentException("Prefix width must be >= 1, got " + prefixWidth);
    }
    this.prefixWidth = prefixWidth;
  }

  /**
   * Allocates the slug for a heading.
   *
   * @param text heading text
   * @param prefixIndex numeric prefix, or {@code null} for an unprefixed slug
   * @throws SlugCollisionException when no unique suffix can be found
   */
  public String allocate(String text, Integer prefixIndex) {
    String base = Slugs.slugify(text);
    if (base.isEmpty()) {
      base = EMPTY_SLUG;
    }
    int occurrence = occurrences.merge(base, 1, Integer::sum);
    for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
      String candidate = withPrefix(occurrence == 1 ? base : base + "-" + occurrence, prefixIndex);
      if (allocated.add(candidate)) {
        occurrences.put(base, occurrence);
        return candidate;
      }
      occurrence++;
    }
    throw new SlugCollisionException(base, MAX_ATTEMPTS);
  }

  /** Allocates an unprefixed slug. */
  public String allocate(String text) {
    return allocate(text, null);
  }

  /**
   * File stem for a section written at {@code position}: a slug that already carries a numeric-dash
   * prefix is used as-is, anything else is prefixed with the position.
   */
  public String fileStem(String slug, int position) {
    String value = slug == null || slug.isBlank() ? EMPTY_SLUG : slug;
    if (NUMERIC_PREFIX.matcher(value).find()) {
      return value;
    }
    return withPrefix(value, position);
  }

  private String withPrefix(String slug, Integer prefixIndex) {
    if (prefixIndex == null) {
      return slug;
    }
    return String.format("%0" + prefixWidth + "d-%s", prefixIndex, slug);
  }
}
