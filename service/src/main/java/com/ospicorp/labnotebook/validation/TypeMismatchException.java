package com.ospicorp.labnotebook.validation;

public class TypeMismatchException extends ResultValueValidationException {
  public static final int ERROR_CODE = 2002;

  public TypeMismatchException(FieldDefinition field, Object value, String expected) {
    super("'" + field.label() + "' must be " + expected + " (value: " + describe(value) + ").",
        field.key(), ERROR_CODE);
  }
}
