package com.flamingo.pdfstructure.model;

/**
 * An illustration located on a page.
 *
 * @param imagePath where the image data can be found
 * @param caption bound caption text, {@code null} when none was bound
 * @param alt alternative text
 * @param page 1-based page number
 * @param bbox position on the page
 */
public record Figure(String imagePath, String caption, String alt, int page, BoundingBox bbox) {

  public Figure withCaption(String newCaption) {
    return new Figure(imagePath, newCaption, alt, page, bbox);
  }
}
