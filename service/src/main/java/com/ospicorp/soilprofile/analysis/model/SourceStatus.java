package com.ospicorp.soilprofile.analysis.model;

public record SourceStatus(String source, boolean available) {}
