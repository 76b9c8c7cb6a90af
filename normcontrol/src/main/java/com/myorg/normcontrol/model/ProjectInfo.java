package com.myorg.normcontrol.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Project-level information read from the first page of a document.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProjectInfo {

    public static final String PROJECT_CODE = "project_code";
    public static final String PROJECT_NAME = "project_name";
    public static final String STAGE = "stage";
    public static final String DOCUMENT_MARK = "document_mark";
    public static final String DOCUMENT_SET = "document_set";

    @JsonProperty(PROJECT_CODE)
    private String projectCode;

    @JsonProperty(PROJECT_NAME)
    private String projectName;

    @JsonProperty(STAGE)
    private ProjectStage stage;

    /** Mark code such as {@code КЖ}. */
    @JsonProperty(DOCUMENT_MARK)
    private String documentMark;

    /** Human readable mark name such as {@code Конструктивные решения}. */
    @JsonProperty(DOCUMENT_SET)
    private String documentSet;

    @JsonProperty("confidence")
    private double confidence;

    public static ProjectInfo empty() {
        return ProjectInfo.builder().build();
    }

    @JsonIgnore
    public boolean hasField(String field) {
        String value = fieldValue(field);
        return value != null && !value.isBlank();
    }

    /**
     * Field value by JSON name, the stage as its value string. {@code null} when absent or unknown.
     */
    @JsonIgnore
    public String fieldValue(String field) {
        if (field == null) return null;
        switch (field) {
            case PROJECT_CODE: return projectCode;
            case PROJECT_NAME: return projectName;
            case STAGE: return stage == null ? null : stage.getValue();
            case DOCUMENT_MARK: return documentMark;
            case DOCUMENT_SET: return documentSet;
            default: return null;
        }
    }
}
