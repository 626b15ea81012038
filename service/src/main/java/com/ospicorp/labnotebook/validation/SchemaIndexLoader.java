package com.ospicorp.labnotebook.validation;

import com.ospicorp.labnotebook.resultschema.repository.ResultSchemaDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SchemaIndexLoader {
  private static final Logger log = LoggerFactory.getLogger(SchemaIndexLoader.class);

  private final ResultSchemaDao resultSchemaDao;

  public SchemaIndexLoader(ResultSchemaDao resultSchemaDao) {
    this.resultSchemaDao = resultSchemaDao;
  }

  /**
   * Reads the current schema rows of a project. A project without rows, or one that does not
   * exist, gives an empty index.
   */
  public SchemaIndex load(long projectId) {
    SchemaIndex index = SchemaIndex.of(resultSchemaDao.fetchResultSchemas(projectId));
    log.debug("Loaded {} result fields for project {}", index.size(), projectId);
    return index;
  }
}
