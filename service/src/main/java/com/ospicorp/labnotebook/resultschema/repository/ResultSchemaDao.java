package com.ospicorp.labnotebook.resultschema.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.labnotebook.validation.FieldDefinition;
import com.ospicorp.labnotebook.validation.ValueType;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

/**
 * Read path for the validator: plain rows, no entity state.
 */
@Repository
public class ResultSchemaDao {
  private static final TypeReference<List<String>> OPTIONS_TYPE = new TypeReference<>() {};

  private final JdbcTemplate jdbc;
  private final ObjectMapper mapper;

  public ResultSchemaDao(JdbcTemplate jdbc, ObjectMapper mapper) {
    this.jdbc = jdbc;
    this.mapper = mapper;
  }

  public List<FieldDefinition> fetchResultSchemas(long projectId) {
    String sql = """
      SELECT field_key, label, value_type, options::text
      FROM result_schemas
      WHERE project_id = ?
      ORDER BY display_order, id
    """;
    return jdbc.query(sql, (rs, i) -> new FieldDefinition(
            rs.getString(1),
            rs.getString(2),
            ValueType.fromCode(rs.getString(3)),
            readOptions(rs.getString(4))),
        projectId);
  }

  // null and blank entries are dropped
  List<String> readOptions(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      List<String> options = mapper.readValue(json, OPTIONS_TYPE);
      if (options == null) {
        return List.of();
      }
      return options.stream()
          .filter(StringUtils::hasText)
          .toList();
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Malformed options column: " + json, ex);
    }
  }
}
