package com.ospicorp.labnotebook.outputconfig.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ospicorp.labnotebook.outputconfig.model.OutputConfig;
import com.ospicorp.labnotebook.outputconfig.model.OutputConfigDto;
import com.ospicorp.labnotebook.outputconfig.model.OutputConfigUpsertRequest;
import com.ospicorp.labnotebook.outputconfig.repository.OutputConfigRepository;
import com.ospicorp.labnotebook.project.service.ProjectService;
import com.ospicorp.labnotebook.validation.FieldDefinition;
import com.ospicorp.labnotebook.validation.SchemaIndex;
import com.ospicorp.labnotebook.validation.SchemaIndexLoader;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OutputConfigServiceTest {
  private OutputConfigRepository repository;
  private ProjectService projectService;
  private OutputConfigService service;

  @BeforeEach
  void setUp() {
    repository = mock(OutputConfigRepository.class);
    projectService = mock(ProjectService.class);
    SchemaIndexLoader loader = mock(SchemaIndexLoader.class);
    when(loader.load(1L)).thenReturn(SchemaIndex.of(List.of(
        FieldDefinition.quantitative("ph", "pH"),
        FieldDefinition.qualitative("notes", "Notes"))));
    when(repository.save(any(OutputConfig.class))).thenAnswer(invocation -> invocation.getArgument(0));
    service = new OutputConfigService(repository, projectService, loader);
  }

  @Test
  void dropsUnknownAndRepeatedKeysKeepingFirstPosition() {
    when(repository.findByProjectId(1L)).thenReturn(Optional.empty());

    OutputConfigDto dto = service.upsert(new OutputConfigUpsertRequest(1L,
        List.of("notes", "ghost", "ph", "notes")));

    assertThat(dto.projectId()).isEqualTo(1L);
    assertThat(dto.includedKeys()).containsExactly("notes", "ph");
  }

  @Test
  void replacesExistingConfig() {
    OutputConfig existing = new OutputConfig();
    existing.setId(7L);
    existing.setProjectId(1L);
    existing.setIncludedKeys(List.of("ph", "notes"));
    when(repository.findByProjectId(1L)).thenReturn(Optional.of(existing));

    OutputConfigDto dto = service.upsert(new OutputConfigUpsertRequest(1L, null));

    assertThat(dto.id()).isEqualTo(7L);
    assertThat(dto.includedKeys()).isEmpty();
  }

  @Test
  void unknownProjectIsRejected() {
    doThrow(new IllegalArgumentException("Invalid project_id")).when(projectService).requireExisting(2L);

    assertThatThrownBy(() -> service.upsert(new OutputConfigUpsertRequest(2L, List.of("ph"))))
        .isInstanceOf(IllegalArgumentException.class);
    verify(repository, never()).save(any());
  }
}
