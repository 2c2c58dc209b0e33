package com.flamingo.pdfstructure.service.diagnostics;

/** Kinds of numbering anomalies reported while headings are processed. */
public enum DiagnosticCategory {
  DUPLICATE_CHAPTER_NUMBER,
  CHAPTER_NUMBER_RESET,
  APPENDIX_BEFORE_FIRST_CHAPTER,
  APPENDIX_MISSING_PAGE_BREAK,
  APPENDIX_DUPLICATE_LETTER,
  APPENDIX_OUT_OF_ORDER,
  SECTION_GAP,
  SECTION_PATH_TRUNCATED,
  NUMBER_OUT_OF_RANGE
}
