package com.ospicorp.labnotebook.validation;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Key to field lookup for the result schema of one project. Built per call, never cached.
 */
public final class SchemaIndex {
  private static final SchemaIndex EMPTY = new SchemaIndex(Map.of());

  private final Map<String, FieldDefinition> fields;

  private SchemaIndex(Map<String, FieldDefinition> fields) {
    this.fields = fields;
  }

  public static SchemaIndex of(Collection<FieldDefinition> definitions) {
    if (definitions == null || definitions.isEmpty()) {
      return EMPTY;
    }
    Map<String, FieldDefinition> byKey = new HashMap<>(definitions.size() * 2);
    for (FieldDefinition definition : definitions) {
      byKey.put(definition.key(), definition);
    }
    return new SchemaIndex(Map.copyOf(byKey));
  }

  public static SchemaIndex empty() {
    return EMPTY;
  }

  public Optional<FieldDefinition> find(String key) {
    if (key == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(fields.get(key));
  }

  public boolean contains(String key) {
    return key != null && fields.containsKey(key);
  }

  public int size() {
    return fields.size();
  }

  public boolean isEmpty() {
    return fields.isEmpty();
  }
}
