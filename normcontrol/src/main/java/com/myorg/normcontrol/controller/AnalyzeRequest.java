package com.myorg.normcontrol.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.myorg.normcontrol.model.PageText;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Body of {@code POST /api/compliance/analyze}: already extracted page texts.
 */
@Getter
@Setter
@NoArgsConstructor
public class AnalyzeRequest {
    @JsonProperty("document_id")
    private String documentId;
    private List<PageText> pages;
}
