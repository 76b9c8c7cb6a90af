package com.myorg.normcontrol.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Result of the first-page analysis: what the document says about itself.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentMetadata {

    @JsonProperty("project_info")
    private ProjectInfo projectInfo;

    @JsonProperty("first_page_stamp")
    private StampInfo firstPageStamp;

    // norms listed in the mark profile the document resolved to
    @JsonProperty("applicable_norms")
    private List<String> applicableNorms;

    public static DocumentMetadata empty() {
        return DocumentMetadata.builder()
                .projectInfo(ProjectInfo.empty())
                .firstPageStamp(StampInfo.empty())
                .applicableNorms(List.of())
                .build();
    }

    public ProjectInfo getProjectInfo() {
        return projectInfo == null ? ProjectInfo.empty() : projectInfo;
    }

    public List<String> getApplicableNorms() {
        return applicableNorms == null ? List.of() : List.copyOf(applicableNorms);
    }
}
