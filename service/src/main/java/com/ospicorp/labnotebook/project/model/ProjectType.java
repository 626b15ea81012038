package com.ospicorp.labnotebook.project.model;

public enum ProjectType {
  VOC,
  REGULAR
}
