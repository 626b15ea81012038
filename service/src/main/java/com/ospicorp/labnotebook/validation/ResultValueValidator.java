package com.ospicorp.labnotebook.validation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Checks a submitted result value map against a project's {@link SchemaIndex} and returns a
 * normalized copy.
 *
 * <p>Entries are checked in the map's iteration order and the first failure is thrown. Null and
 * empty-string values count as "not provided" and are copied through unchanged. Quantitative
 * values come back as {@code Double} or {@code List<Double>}. The input map is never modified.
 */
@Component
public class ResultValueValidator {
  private static final Logger log = LoggerFactory.getLogger(ResultValueValidator.class);

  private final UnknownFieldPolicy unknownFieldPolicy;

  @Autowired
  public ResultValueValidator(@Value("${eln.validation.unknown-fields:ignore}") String unknownFields) {
    this(UnknownFieldPolicy.fromProperty(unknownFields));
  }

  public ResultValueValidator(UnknownFieldPolicy unknownFieldPolicy) {
    this.unknownFieldPolicy = unknownFieldPolicy;
  }

  public UnknownFieldPolicy unknownFieldPolicy() {
    return unknownFieldPolicy;
  }

  public Map<String, Object> validate(SchemaIndex index, Map<String, Object> values) {
    Map<String, Object> normalized = new LinkedHashMap<>();
    if (values == null || values.isEmpty()) {
      return normalized;
    }
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      String key = entry.getKey();
      Object value = entry.getValue();

      Optional<FieldDefinition> field = index.find(key);
      if (field.isEmpty()) {
        if (unknownFieldPolicy == UnknownFieldPolicy.REJECT) {
          throw new UnknownFieldException(key);
        }
        log.debug("Ignoring result value for undefined field {}", key);
        continue;
      }

      if (isNotProvided(value)) {
        normalized.put(key, value);
        continue;
      }
      normalized.put(key, normalize(field.get(), value));
    }
    return normalized;
  }

  private Object normalize(FieldDefinition field, Object value) {
    return switch (field.valueType()) {
      case QUANTITATIVE -> normalizeQuantitative(field, value);
      case CATEGORICAL -> checkCategorical(field, value);
      case QUALITATIVE -> checkQualitative(field, value);
    };
  }

  private static Object normalizeQuantitative(FieldDefinition field, Object value) {
    if (value instanceof List<?> list) {
      List<Double> numbers = new ArrayList<>(list.size());
      for (Object element : list) {
        OptionalDouble number = NumericValues.parse(element);
        if (number.isEmpty()) {
          throw new TypeMismatchException(field, value, "a list of numeric values");
        }
        numbers.add(number.getAsDouble());
      }
      return numbers;
    }
    OptionalDouble number = NumericValues.parse(value);
    if (number.isEmpty()) {
      throw new TypeMismatchException(field, value, "numeric");
    }
    return number.getAsDouble();
  }

  private static String checkCategorical(FieldDefinition field, Object value) {
    if (!(value instanceof String text)) {
      throw new TypeMismatchException(field, value, "a string");
    }
    List<String> options = field.options();
    if (!options.isEmpty() && !options.contains(text)) {
      throw new InvalidOptionException(field, text);
    }
    return text;
  }

  private static String checkQualitative(FieldDefinition field, Object value) {
    if (!(value instanceof String text)) {
      throw new TypeMismatchException(field, value, "text");
    }
    return text;
  }

  private static boolean isNotProvided(Object value) {
    return value == null || "".equals(value);
  }
}
