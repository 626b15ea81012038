package com.ospicorp.labnotebook.validation;

import java.util.List;
import java.util.Objects;

/**
 * One result field of a project schema, as seen by the validator.
 *
 * <p>Options are only kept for categorical fields; any other type always carries an empty list.
 * Null option entries are dropped.
 */
public record FieldDefinition(String key, String label, ValueType valueType, List<String> options) {

  public FieldDefinition {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(valueType, "valueType");
    if (label == null || label.isBlank()) {
      label = key;
    }
    options = valueType == ValueType.CATEGORICAL && options != null
        ? options.stream().filter(Objects::nonNull).toList()
        : List.of();
  }

  public static FieldDefinition quantitative(String key, String label) {
    return new FieldDefinition(key, label, ValueType.QUANTITATIVE, null);
  }

  public static FieldDefinition qualitative(String key, String label) {
    return new FieldDefinition(key, label, ValueType.QUALITATIVE, null);
  }

  public static FieldDefinition categorical(String key, String label, List<String> options) {
    return new FieldDefinition(key, label, ValueType.CATEGORICAL, options);
  }
}
