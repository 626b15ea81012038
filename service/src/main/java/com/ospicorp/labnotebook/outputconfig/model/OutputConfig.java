package com.ospicorp.labnotebook.outputconfig.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "output_configs")
public class OutputConfig {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "project_id", nullable = false, unique = true, updatable = false)
  private Long projectId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "included_keys", columnDefinition = "jsonb", nullable = false)
  private List<String> includedKeys = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  public OutputConfig() {
    // JPA default constructor
  }

  @PrePersist
  void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getProjectId() {
    return projectId;
  }

  public void setProjectId(Long projectId) {
    this.projectId = projectId;
  }

  public List<String> getIncludedKeys() {
    return includedKeys;
  }

  public void setIncludedKeys(List<String> includedKeys) {
    this.includedKeys = includedKeys == null ? new ArrayList<>() : new ArrayList<>(includedKeys);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }
}
