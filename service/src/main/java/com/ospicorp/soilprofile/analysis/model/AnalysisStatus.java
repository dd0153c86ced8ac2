package com.ospicorp.soilprofile.analysis.model;

public enum AnalysisStatus {
  OK,
  INVALID_INPUT,
  INTERNAL_ERROR
}
