package com.ospicorp.labnotebook.outputconfig.repository;

import com.ospicorp.labnotebook.outputconfig.model.OutputConfig;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OutputConfigRepository extends JpaRepository<OutputConfig, Long> {
  Optional<OutputConfig> findByProjectId(Long projectId);
}
