package com.flamingo.pdfstructure.service.slug;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/** Text-to-URL-slug transform shared by section and figure naming. */
public final class Slugs {

  private static final Pattern QUOTES = Pattern.compile("['\"‘’“”]");
  private static final Pattern DIACRITICS = Pattern.compile("\\p{InCombiningDiacriticalMarks}+");
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
  private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");

  private Slugs() {}

  /**
   * Lower-cases the text, removes quotes and diacritics and joins the remaining alphanumeric runs
   * with single dashes, e.g. {@code "Don't Panic: Überblick"} becomes {@code
   * "dont-panic-uberblick"}.
   */
  public static String slugify(String text) {
    if (text == null || text.isBlank()) {
      return "";
    }
    String base = QUOTES.matcher(text.strip().toLowerCase(Locale.ROOT)).replaceAll("");
    String decomposed = Normalizer.normalize(base, Normalizer.Form.NFD);
    String ascii = DIACRITICS.matcher(decomposed).replaceAll("");
    String dashed = NON_ALPHANUMERIC.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("-");
    return EDGE_DASHES.matcher(dashed).replaceAll("");
  }
}
