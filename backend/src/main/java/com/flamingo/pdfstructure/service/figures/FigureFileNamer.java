package com.flamingo.pdfstructure.service.figures;

import com.flamingo.pdfstructure.service.slug.Slugs;
import java.util.HashSet;
import java.util.Set;

/**
 * Names figure files {@code fig_NNN[_caption-slug].ext}, appending {@code -2}, {@code -3}, ... to
 * the stem when a name is already taken.
 *
 * <p>Remembers every name it handed out, so one instance serves one document.
 */
public class FigureFileNamer {

  private final String extension;
  private final Set<String> used = new HashSet<>();

  public FigureFileNamer(String extension) {
    this.extension = extension;
  }

  public String name(String figureId, String caption) {
    String stem = figureId;
    if (caption != null && !caption.isBlank()) {
      String captionSlug = Slugs.slugify(caption.strip());
      if (!captionSlug.isEmpty()) {
        stem = stem + "_" + captionSlug;
      }
    }
    String filename = stem + "." + extension;
    int counter = 2;
    while (!used.add(filename)) {
      filename = stem + "-" + counter + "." + extension;
      counter++;
    }
    return filename;
  }
}
