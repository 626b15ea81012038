package com.ospicorp.labnotebook.web;

/**
 * A query parameter with a value outside its supported set. Rendered as a 400 with
 * {@code error}, {@code parameter}, {@code errorCode} and a {@code moreInfo} link.
 */
public class InvalidParameterException extends RuntimeException {
  public static final String ERROR_DOCS_BASE = "https://docs.lab-notebook.dev/errors/";

  private final String parameter;
  private final int errorCode;

  public InvalidParameterException(String parameter, String message, int errorCode) {
    super(message);
    this.parameter = parameter;
    this.errorCode = errorCode;
  }

  public String parameter() {
    return parameter;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return ERROR_DOCS_BASE + errorCode;
  }
}
