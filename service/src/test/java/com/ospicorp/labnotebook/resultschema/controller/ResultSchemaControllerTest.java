package com.ospicorp.labnotebook.resultschema.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.labnotebook.config.ApiExceptionHandler;
import com.ospicorp.labnotebook.resultschema.model.ResultSchemaDto;
import com.ospicorp.labnotebook.resultschema.service.ResultSchemaService;
import com.ospicorp.labnotebook.validation.ValueType;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ResultSchemaControllerTest {
  private ResultSchemaService service;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    service = mock(ResultSchemaService.class);
    mockMvc = MockMvcBuilders.standaloneSetup(new ResultSchemaController(service))
        .setControllerAdvice(new ApiExceptionHandler())
        .build();
  }

  @Test
  void createsCategoricalField() throws Exception {
    when(service.create(any())).thenReturn(new ResultSchemaDto(3L, 1L, "appearance", "Appearance",
        ValueType.CATEGORICAL, null, null, List.of("clear", "cloudy"), 0, Instant.parse("2024-05-01T10:00:00Z")));

    mockMvc.perform(post("/api/result-schemas").contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"project_id": 1, "key": "appearance", "label": "Appearance",
                 "value_type": "categorical", "options": ["clear", "cloudy"]}
                """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.key").value("appearance"))
        .andExpect(jsonPath("$.value_type").value("categorical"))
        .andExpect(jsonPath("$.options[1]").value("cloudy"));
  }

  @Test
  void categoricalWithoutOptionsIsBadRequest() throws Exception {
    mockMvc.perform(post("/api/result-schemas").contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"project_id": 1, "key": "appearance", "label": "Appearance", "value_type": "categorical"}
                """))
        .andExpect(status().isBadRequest());
    verify(service, never()).create(any());
  }

  @Test
  void nullOrBlankOptionIsBadRequest() throws Exception {
    mockMvc.perform(post("/api/result-schemas").contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"project_id": 1, "key": "appearance", "label": "Appearance", "value_type": "categorical",
                 "options": ["clear", null]}
                """))
        .andExpect(status().isBadRequest());
    mockMvc.perform(patch("/api/result-schemas/3").contentType(MediaType.APPLICATION_JSON)
            .content("{\"options\": [\"clear\", \" \"]}"))
        .andExpect(status().isBadRequest());
    verify(service, never()).create(any());
    verify(service, never()).update(any(Long.class), any());
  }

  @Test
  void keyWithSpacesIsBadRequest() throws Exception {
    mockMvc.perform(post("/api/result-schemas").contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"project_id": 1, "key": "peel strength", "label": "Peel", "value_type": "quantitative"}
                """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unknownValueTypeIsBadRequest() throws Exception {
    mockMvc.perform(post("/api/result-schemas").contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"project_id": 1, "key": "ph", "label": "pH", "value_type": "numeric"}
                """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void patchSwitchingToCategoricalWithoutOptionsIsBadRequest() throws Exception {
    when(service.update(any(Long.class), any()))
        .thenThrow(new IllegalArgumentException("options is required for categorical fields"));

    mockMvc.perform(patch("/api/result-schemas/3").contentType(MediaType.APPLICATION_JSON)
            .content("{\"value_type\": \"categorical\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("options is required for categorical fields"));
  }
}
