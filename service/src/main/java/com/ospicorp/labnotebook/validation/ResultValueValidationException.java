package com.ospicorp.labnotebook.validation;

/**
 * Base class of the result value failures. The message is meant for the client as is.
 */
public abstract class ResultValueValidationException extends RuntimeException {
  private final String field;
  private final int errorCode;

  protected ResultValueValidationException(String message, String field, int errorCode) {
    super(message);
    this.field = field;
    this.errorCode = errorCode;
  }

  public String field() {
    return field;
  }

  public int errorCode() {
    return errorCode;
  }

  static String describe(Object value) {
    return value instanceof String text ? text : String.valueOf(value);
  }
}
