package com.ospicorp.labnotebook.validation;

public class UnknownFieldException extends ResultValueValidationException {
  public static final int ERROR_CODE = 2001;

  public UnknownFieldException(String key) {
    super("Result field '" + key + "' is not defined for this project.", key, ERROR_CODE);
  }
}
