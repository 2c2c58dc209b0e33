package com.flamingo.pdfstructure.exception;

/** Thrown when structure settings are rejected before any document is processed. */
public class InvalidConfigurationException extends StructureException {

  public static final String INVALID_VALUE = "config_invalid_value";
  public static final String WEIGHT_SUM_INVALID = "config_weight_sum_invalid";

  private final String property;

  public InvalidConfigurationException(String errorCode, String property, String message) {
    super(Category.CONFIG, errorCode, message);
    this.property = property;
  }

  public String getProperty() {
    return property;
  }
}
