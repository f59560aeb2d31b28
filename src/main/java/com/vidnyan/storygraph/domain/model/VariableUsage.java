package com.vidnyan.storygraph.domain.model;

public record VariableUsage(String unitId, int line) {}
