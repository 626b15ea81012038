package com.ospicorp.labnotebook.validation;

import java.util.List;

public class InvalidOptionException extends ResultValueValidationException {
  public static final int ERROR_CODE = 2003;

  private final List<String> allowed;

  public InvalidOptionException(FieldDefinition field, String value) {
    super("'" + field.label() + "' must be one of " + field.options() + " (value: " + value + ").",
        field.key(), ERROR_CODE);
    this.allowed = field.options();
  }

  public List<String> allowed() {
    return allowed;
  }
}
