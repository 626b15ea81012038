package com.ospicorp.labnotebook.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ResultValueValidatorTest {

  private static final SchemaIndex TEMPERATURE = SchemaIndex.of(List.of(
      FieldDefinition.quantitative("temperature", null)));
  private static final SchemaIndex APPEARANCE = SchemaIndex.of(List.of(
      FieldDefinition.categorical("appearance", "Appearance", List.of("clear", "cloudy"))));
  private static final SchemaIndex NOTES = SchemaIndex.of(List.of(
      FieldDefinition.qualitative("notes", "Notes")));

  private final ResultValueValidator lenient = new ResultValueValidator(UnknownFieldPolicy.IGNORE);
  private final ResultValueValidator strict = new ResultValueValidator(UnknownFieldPolicy.REJECT);

  private static Map<String, Object> values(Object... pairs) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put((String) pairs[i], pairs[i + 1]);
    }
    return map;
  }

  @Test
  void nonNumericQuantitativeValueIsRejected() {
    assertThatThrownBy(() -> lenient.validate(TEMPERATURE, values("temperature", "not-a-number")))
        .isInstanceOf(TypeMismatchException.class)
        .hasMessageContaining("temperature")
        .hasMessageContaining("numeric")
        .satisfies(ex -> {
          TypeMismatchException mismatch = (TypeMismatchException) ex;
          assertThat(mismatch.field()).isEqualTo("temperature");
          assertThat(mismatch.errorCode()).isEqualTo(TypeMismatchException.ERROR_CODE);
        });
  }

  @Test
  void numericQuantitativeValueIsAcceptedAsDouble() {
    Map<String, Object> normalized = lenient.validate(TEMPERATURE, values("temperature", 23.5));

    assertThat(normalized).containsExactly(Map.entry("temperature", 23.5d));
  }

  @Test
  void categoricalValueOutsideOptionsIsRejected() {
    assertThatThrownBy(() -> lenient.validate(APPEARANCE, values("appearance", "opaque")))
        .isInstanceOf(InvalidOptionException.class)
        .hasMessageContaining("[clear, cloudy]")
        .satisfies(ex -> assertThat(((InvalidOptionException) ex).allowed())
            .containsExactly("clear", "cloudy"));
  }

  @Test
  void categoricalValueInOptionsIsAcceptedUnchanged() {
    assertThat(lenient.validate(APPEARANCE, values("appearance", "clear")))
        .containsExactly(Map.entry("appearance", "clear"));
  }

  @Test
  void emptyStringCountsAsNotProvided() {
    assertThat(lenient.validate(NOTES, values("notes", "")))
        .containsExactly(Map.entry("notes", ""));
    assertThat(lenient.validate(TEMPERATURE, values("temperature", "")))
        .containsExactly(Map.entry("temperature", ""));
    assertThat(lenient.validate(APPEARANCE, values("appearance", null)))
        .containsEntry("appearance", null);
  }

  @Nested
  class UnknownKeys {
    private final SchemaIndex schema = SchemaIndex.of(List.of(FieldDefinition.quantitative("a", "A")));

    @Test
    void strictPolicyRejectsUndefinedKey() {
      assertThatThrownBy(() -> strict.validate(schema, values("b", 1)))
          .isInstanceOf(UnknownFieldException.class)
          .hasMessageContaining("'b'")
          .satisfies(ex -> assertThat(((UnknownFieldException) ex).field()).isEqualTo("b"));
    }

    @Test
    void lenientPolicyDropsUndefinedKey() {
      assertThat(lenient.validate(schema, values("b", 1))).isEmpty();
      assertThat(lenient.validate(schema, values("b", 1, "a", "2"))).containsExactly(Map.entry("a", 2d));
    }

    @Test
    void strictPolicyRejectsUndefinedKeyEvenWithEmptyValue() {
      assertThatThrownBy(() -> strict.validate(schema, values("b", "")))
          .isInstanceOf(UnknownFieldException.class);
    }

    @Test
    void everyKeyIsUnknownAgainstAnEmptySchema() {
      assertThat(lenient.validate(SchemaIndex.empty(), values("x", 1, "y", "text"))).isEmpty();
      assertThatThrownBy(() -> strict.validate(SchemaIndex.empty(), values("x", 1)))
          .isInstanceOf(UnknownFieldException.class);
    }
  }

  static Stream<Arguments> numericInputs() {
    return Stream.of(
        Arguments.of(7, 7d),
        Arguments.of(7L, 7d),
        Arguments.of(-0.25, -0.25d),
        Arguments.of(new BigDecimal("1.5"), 1.5d),
        Arguments.of("42", 42d),
        Arguments.of(" 3.5 ", 3.5d),
        Arguments.of("1e3", 1000d),
        Arguments.of("-12.75", -12.75d));
  }

  @ParameterizedTest
  @MethodSource("numericInputs")
  void numericInputsAreCoercedToDouble(Object input, double expected) {
    assertThat(lenient.validate(TEMPERATURE, values("temperature", input)).get("temperature"))
        .isEqualTo(expected);
  }

  static Stream<Object> nonNumericInputs() {
    return Stream.of(true, false, "abc", "12abc", "NaN", "Infinity", " ", Map.of("v", 1), List.of(List.of(1)));
  }

  @ParameterizedTest
  @MethodSource("nonNumericInputs")
  void nonNumericInputsAreRejected(Object input) {
    assertThatThrownBy(() -> lenient.validate(TEMPERATURE, values("temperature", input)))
        .isInstanceOf(TypeMismatchException.class);
  }

  @Test
  void quantitativeListIsCoercedElementWise() {
    Map<String, Object> normalized = lenient.validate(TEMPERATURE,
        values("temperature", List.of(1, "2.5", 3.25)));

    assertThat(normalized.get("temperature")).isEqualTo(List.of(1d, 2.5d, 3.25d));
  }

  @Test
  void quantitativeListWithBadElementIsRejected() {
    assertThatThrownBy(() -> lenient.validate(TEMPERATURE, values("temperature", Arrays.asList(1, null))))
        .isInstanceOf(TypeMismatchException.class)
        .hasMessageContaining("a list of numeric values");
    assertThatThrownBy(() -> lenient.validate(TEMPERATURE, values("temperature", List.of(1, "x"))))
        .isInstanceOf(TypeMismatchException.class);
  }

  @Test
  void emptyQuantitativeListIsAccepted() {
    assertThat(lenient.validate(TEMPERATURE, values("temperature", List.of())).get("temperature"))
        .isEqualTo(List.of());
  }

  @Test
  void categoricalAndQualitativeRequireStrings() {
    assertThatThrownBy(() -> lenient.validate(APPEARANCE, values("appearance", 1)))
        .isInstanceOf(TypeMismatchException.class)
        .hasMessageContaining("a string");
    assertThatThrownBy(() -> lenient.validate(NOTES, values("notes", List.of("a"))))
        .isInstanceOf(TypeMismatchException.class)
        .hasMessageContaining("text");
  }

  @Test
  void categoricalMembershipIsCaseSensitive() {
    assertThatThrownBy(() -> lenient.validate(APPEARANCE, values("appearance", "Clear")))
        .isInstanceOf(InvalidOptionException.class);
  }

  @Test
  void categoricalWithoutOptionsAcceptsAnyString() {
    SchemaIndex emptyOptions = SchemaIndex.of(List.of(
        FieldDefinition.categorical("grade", "Grade", List.of())));
    SchemaIndex nullOptions = SchemaIndex.of(List.of(
        FieldDefinition.categorical("grade", "Grade", null)));

    assertThat(strict.validate(emptyOptions, values("grade", "anything"))).containsEntry("grade", "anything");
    assertThat(strict.validate(nullOptions, values("grade", "B+"))).containsEntry("grade", "B+");
    assertThatThrownBy(() -> strict.validate(nullOptions, values("grade", 3)))
        .isInstanceOf(TypeMismatchException.class);
  }

  @Test
  void firstFailureInIterationOrderWins() {
    SchemaIndex schema = SchemaIndex.of(List.of(
        FieldDefinition.quantitative("viscosity", "Viscosity"),
        FieldDefinition.categorical("appearance", "Appearance", List.of("clear"))));

    assertThatThrownBy(() -> lenient.validate(schema, values("appearance", "milky", "viscosity", "thick")))
        .isInstanceOf(InvalidOptionException.class);
    assertThatThrownBy(() -> lenient.validate(schema, values("viscosity", "thick", "appearance", "milky")))
        .isInstanceOf(TypeMismatchException.class);
  }

  @Test
  void validationIsIdempotent() {
    SchemaIndex schema = SchemaIndex.of(List.of(
        FieldDefinition.quantitative("viscosity", "Viscosity"),
        FieldDefinition.quantitative("readings", "Readings"),
        FieldDefinition.categorical("appearance", "Appearance", List.of("clear")),
        FieldDefinition.qualitative("notes", "Notes")));
    Map<String, Object> input = values("viscosity", "4200", "readings", List.of("1", 2),
        "appearance", "clear", "notes", "ok", "extra", 5);

    Map<String, Object> once = lenient.validate(schema, input);
    Map<String, Object> twice = lenient.validate(schema, once);

    assertThat(twice).isEqualTo(once);
  }

  @Test
  void inputMapIsNotModified() {
    Map<String, Object> input = new HashMap<>(values("temperature", "21", "unknown", 1));
    Map<String, Object> snapshot = new HashMap<>(input);
    List<Object> list = new ArrayList<>(List.of("1", "2"));
    Map<String, Object> withList = values("temperature", list);

    lenient.validate(TEMPERATURE, input);
    lenient.validate(TEMPERATURE, withList);

    assertThat(input).isEqualTo(snapshot);
    assertThat(list).containsExactly("1", "2");
  }

  @Test
  void nullOrEmptyInputGivesEmptyMap() {
    assertThat(strict.validate(TEMPERATURE, null)).isEmpty();
    assertThat(strict.validate(TEMPERATURE, Map.of())).isEmpty();
  }

  @Test
  void policyIsReadFromProperty() {
    assertThat(new ResultValueValidator("reject").unknownFieldPolicy()).isEqualTo(UnknownFieldPolicy.REJECT);
    assertThat(new ResultValueValidator("IGNORE").unknownFieldPolicy()).isEqualTo(UnknownFieldPolicy.IGNORE);
    assertThat(new ResultValueValidator("").unknownFieldPolicy()).isEqualTo(UnknownFieldPolicy.IGNORE);
    assertThatThrownBy(() -> new ResultValueValidator("maybe"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("ignore,reject");
  }
}
