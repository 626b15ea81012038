package com.ospicorp.labnotebook.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Closed set of result field types. Stored and exchanged in lower case.
 */
public enum ValueType {
  QUANTITATIVE("quantitative"),
  QUALITATIVE("qualitative"),
  CATEGORICAL("categorical");

  private final String code;

  ValueType(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  @JsonCreator
  public static ValueType fromCode(String code) {
    if (code != null) {
      String normalized = code.trim().toLowerCase(Locale.ROOT);
      for (ValueType type : values()) {
        if (type.code.equals(normalized)) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException(
        "Unsupported value_type " + code + ". Supported values: quantitative,qualitative,categorical.");
  }
}
