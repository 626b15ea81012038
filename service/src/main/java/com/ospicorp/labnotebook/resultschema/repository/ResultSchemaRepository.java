package com.ospicorp.labnotebook.resultschema.repository;

import com.ospicorp.labnotebook.resultschema.model.ResultSchema;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ResultSchemaRepository extends JpaRepository<ResultSchema, Long> {
  List<ResultSchema> findByProjectIdOrderByDisplayOrderAscIdAsc(Long projectId);
}
