package com.ospicorp.labnotebook.experiment.repository;

import com.ospicorp.labnotebook.experiment.model.Experiment;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ExperimentRepository extends JpaRepository<Experiment, Long> {
  List<Experiment> findByProjectIdOrderByCreatedAtDescIdDesc(Long projectId);
}
