package com.purchasingpower.orchestrator.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Progress of the planning stages: the selection once it is known, then one entry per
 * finished specialist.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanPayload {

    public static final String STAGE_SELECTION = "selection";
    public static final String STAGE_SPECIALIST = "specialist_completed";

    String stage;

    List<String> selectedDomains;
    Double complexity;
    Double confidence;
    Boolean crossDomain;
    String rationale;
    Integer estimatedDurationSeconds;
    Boolean chitchat;
    String detectedLanguage;

    String domain;
    Boolean success;
    Integer completed;
    Integer total;
}
