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
 * Title block (stamp) fields recovered from a drawing sheet. Every field is optional;
 * a partially filled stamp is the normal case.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StampInfo {

    public static final String SHEET_NUMBER = "sheet_number";
    public static final String TOTAL_SHEETS = "total_sheets";
    public static final String REVISION = "revision";
    public static final String INVENTORY_NUMBER = "inventory_number";
    public static final String SCALE = "scale";
    public static final String PROJECT_CODE = "project_code";
    public static final String OBJECT_NAME = "object_name";
    public static final String STAGE = "stage";
    public static final String DOCUMENT_SET = "document_set";

    @JsonProperty(SHEET_NUMBER)
    private Integer sheetNumber;

    @JsonProperty(TOTAL_SHEETS)
    private Integer totalSheets;

    @JsonProperty(REVISION)
    private Integer revision;

    @JsonProperty(INVENTORY_NUMBER)
    private String inventoryNumber;

    @JsonProperty(SCALE)
    private String scale;

    @JsonProperty(PROJECT_CODE)
    private String projectCode;

    @JsonProperty(OBJECT_NAME)
    private String objectName;

    @JsonProperty(STAGE)
    private String stage;

    @JsonProperty(DOCUMENT_SET)
    private String documentSet;

    @JsonProperty("has_stamp")
    private boolean hasStamp;

    @JsonProperty("confidence")
    private double confidence;

    public static StampInfo empty() {
        return StampInfo.builder().build();
    }

    /**
     * Looks a field up by its JSON name. Unknown names read as absent.
     */
    @JsonIgnore
    public boolean hasField(String field) {
        if (field == null) return false;
        switch (field) {
            case SHEET_NUMBER: return sheetNumber != null;
            case TOTAL_SHEETS: return totalSheets != null;
            case REVISION: return revision != null;
            case INVENTORY_NUMBER: return isPresent(inventoryNumber);
            case SCALE: return isPresent(scale);
            case PROJECT_CODE: return isPresent(projectCode);
            case OBJECT_NAME: return isPresent(objectName);
            case STAGE: return isPresent(stage);
            case DOCUMENT_SET: return isPresent(documentSet);
            default: return false;
        }
    }

    private static boolean isPresent(String s) {
        return s != null && !s.isBlank();
    }
}
