package com.ospicorp.labnotebook.project.model;

public enum ProjectStatus {
  ONGOING,
  CLOSED
}
