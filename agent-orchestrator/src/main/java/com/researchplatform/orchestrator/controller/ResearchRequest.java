package com.researchplatform.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ResearchRequest(@JsonProperty("task") String task) {}
