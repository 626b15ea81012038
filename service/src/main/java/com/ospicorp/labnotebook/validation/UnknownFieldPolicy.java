package com.ospicorp.labnotebook.validation;

import java.util.Locale;

/**
 * What the validator does with a result value whose key is not in the project schema.
 */
public enum UnknownFieldPolicy {
  /** Leave the entry out of the normalized map. */
  IGNORE,
  /** Fail with {@link UnknownFieldException}. */
  REJECT;

  public static UnknownFieldPolicy fromProperty(String value) {
    if (value == null || value.isBlank()) {
      return IGNORE;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "Invalid eln.validation.unknown-fields value " + value + ". Supported values: ignore,reject.", ex);
    }
  }
}
