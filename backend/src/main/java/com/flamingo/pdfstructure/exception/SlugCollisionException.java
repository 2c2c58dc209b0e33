package com.flamingo.pdfstructure.exception;

/** Thrown when no collision-free slug can be allocated for a heading. */
public class SlugCollisionException extends StructureException {

  private final String baseSlug;

  public SlugCollisionException(String baseSlug, int attempts) {
    super(
        Category.PARSE,
        "unresolvable_slug_collision",
        "Unable to allocate a unique slug for '" + baseSlug + "' after " + attempts + " attempts");
    this.baseSlug = baseSlug;
  }

  public String getBaseSlug() {
    return baseSlug;
  }
}
