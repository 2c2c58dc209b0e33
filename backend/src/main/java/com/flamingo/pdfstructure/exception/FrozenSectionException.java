package com.flamingo.pdfstructure.exception;

/** Thrown on any attempt to mutate a section node after it has been frozen. */
public class FrozenSectionException extends StructureException {

  public FrozenSectionException(String title, String operation) {
    super(
        Category.PARSE,
        "frozen_section_mutation",
        "Cannot " + operation + " on frozen section '" + title + "'");
  }
}
