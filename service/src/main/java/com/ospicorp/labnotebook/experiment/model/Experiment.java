package com.ospicorp.labnotebook.experiment.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "experiments")
public class Experiment {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private Long projectId;

  private String name;
  private String author;
  private String purpose;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "jsonb", nullable = false)
  private List<MaterialLine> materials = new ArrayList<>();

  // normalized by ResultValueValidator before every write
  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "result_values", columnDefinition = "jsonb", nullable = false)
  private Map<String, Object> resultValues = new LinkedHashMap<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  public Experiment() {
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

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getAuthor() {
    return author;
  }

  public void setAuthor(String author) {
    this.author = author;
  }

  public String getPurpose() {
    return purpose;
  }

  public void setPurpose(String purpose) {
    this.purpose = purpose;
  }

  public List<MaterialLine> getMaterials() {
    return materials;
  }

  public void setMaterials(List<MaterialLine> materials) {
    this.materials = materials == null ? new ArrayList<>() : new ArrayList<>(materials);
  }

  public Map<String, Object> getResultValues() {
    return resultValues;
  }

  public void setResultValues(Map<String, Object> resultValues) {
    this.resultValues = resultValues == null ? new LinkedHashMap<>() : new LinkedHashMap<>(resultValues);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }
}
