package com.ospicorp.labnotebook.resultschema.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ospicorp.labnotebook.project.service.ProjectService;
import com.ospicorp.labnotebook.resultschema.model.ResultSchema;
import com.ospicorp.labnotebook.resultschema.model.ResultSchemaCreateRequest;
import com.ospicorp.labnotebook.resultschema.model.ResultSchemaDto;
import com.ospicorp.labnotebook.resultschema.model.ResultSchemaUpdateRequest;
import com.ospicorp.labnotebook.resultschema.repository.ResultSchemaRepository;
import com.ospicorp.labnotebook.validation.ValueType;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResultSchemaServiceTest {
  private ResultSchemaRepository repository;
  private ProjectService projectService;
  private ResultSchemaService service;

  @BeforeEach
  void setUp() {
    repository = mock(ResultSchemaRepository.class);
    projectService = mock(ProjectService.class);
    service = new ResultSchemaService(repository, projectService);
    when(repository.saveAndFlush(any(ResultSchema.class))).thenAnswer(invocation -> invocation.getArgument(0));
  }

  private static ResultSchema stored(ValueType type, List<String> options) {
    ResultSchema schema = new ResultSchema();
    schema.setId(4L);
    schema.setProjectId(1L);
    schema.setFieldKey("appearance");
    schema.setLabel("Appearance");
    schema.setValueType(type);
    schema.setOptions(options);
    return schema;
  }

  @Test
  void createDefaultsOrderToZero() {
    ResultSchemaDto dto = service.create(new ResultSchemaCreateRequest(1L, "ph", "pH",
        ValueType.QUANTITATIVE, null, null, null, null));

    assertThat(dto.key()).isEqualTo("ph");
    assertThat(dto.valueType()).isEqualTo(ValueType.QUANTITATIVE);
    assertThat(dto.order()).isZero();
  }

  @Test
  void categoricalWithoutOptionsIsRejected() {
    assertThatThrownBy(() -> service.create(new ResultSchemaCreateRequest(1L, "appearance", "Appearance",
        ValueType.CATEGORICAL, null, null, List.of(), 0)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage(ResultSchemaService.OPTIONS_REQUIRED);
    verify(repository, never()).saveAndFlush(any());
  }

  @Test
  void nullOptionIsRejected() {
    assertThatThrownBy(() -> service.create(new ResultSchemaCreateRequest(1L, "appearance", "Appearance",
        ValueType.CATEGORICAL, null, null, Arrays.asList("clear", null), 0)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage(ResultSchemaService.BLANK_OPTION);
    verify(repository, never()).saveAndFlush(any());
  }

  @Test
  void blankOptionInPatchIsRejected() {
    when(repository.findById(4L)).thenReturn(Optional.of(stored(ValueType.CATEGORICAL, List.of("clear"))));

    assertThatThrownBy(() -> service.update(4L,
        new ResultSchemaUpdateRequest(null, null, null, null, List.of("clear", ""), null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage(ResultSchemaService.BLANK_OPTION);
  }

  @Test
  void outputColumnKeysAreReserved() {
    assertThatThrownBy(() -> service.create(new ResultSchemaCreateRequest(1L, "author", "Author",
        ValueType.QUALITATIVE, null, null, null, 0)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("key author is reserved");
    assertThatThrownBy(() -> service.create(new ResultSchemaCreateRequest(1L, "experiment_id", "Id",
        ValueType.QUANTITATIVE, null, null, null, 0)))
        .isInstanceOf(IllegalArgumentException.class);
    verify(repository, never()).saveAndFlush(any());
  }

  @Test
  void unknownProjectIsRejected() {
    doThrow(new IllegalArgumentException("Invalid project_id")).when(projectService).requireExisting(8L);

    assertThatThrownBy(() -> service.create(new ResultSchemaCreateRequest(8L, "ph", "pH",
        ValueType.QUANTITATIVE, null, null, null, 0)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void switchingToCategoricalNeedsOptionsFromRequestOrRow() {
    when(repository.findById(4L)).thenReturn(Optional.of(stored(ValueType.QUALITATIVE, null)));

    assertThatThrownBy(() -> service.update(4L,
        new ResultSchemaUpdateRequest(null, ValueType.CATEGORICAL, null, null, null, null)))
        .isInstanceOf(IllegalArgumentException.class);

    ResultSchemaDto dto = service.update(4L, new ResultSchemaUpdateRequest(null, ValueType.CATEGORICAL,
        null, null, List.of("clear", "cloudy"), 2));
    assertThat(dto.valueType()).isEqualTo(ValueType.CATEGORICAL);
    assertThat(dto.options()).containsExactly("clear", "cloudy");
    assertThat(dto.order()).isEqualTo(2);
  }

  @Test
  void updateKeepsExistingOptionsWhenAbsent() {
    when(repository.findById(4L)).thenReturn(Optional.of(stored(ValueType.CATEGORICAL, List.of("clear"))));

    ResultSchemaDto dto = service.update(4L,
        new ResultSchemaUpdateRequest("Look", null, null, null, null, null));

    assertThat(dto.label()).isEqualTo("Look");
    assertThat(dto.key()).isEqualTo("appearance");
    assertThat(dto.options()).containsExactly("clear");
  }

  @Test
  void missingRowIsNotFound() {
    when(repository.findById(5L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.delete(5L))
        .isInstanceOf(NoSuchElementException.class)
        .hasMessage("Result schema not found: 5");
  }
}
