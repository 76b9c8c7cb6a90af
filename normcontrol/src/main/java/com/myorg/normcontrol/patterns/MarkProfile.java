package com.myorg.normcontrol.patterns;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Document mark (discipline) entry: code, display name, content keywords used to guess the
 * mark when the project code carries none, and the normative documents that govern it.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class MarkProfile {

    @JsonProperty("code")
    private String code;

    @JsonProperty("name")
    private String name;

    @JsonProperty("keywords")
    private List<String> keywords;

    @JsonProperty("norm_references")
    private List<String> normReferences;

    public List<String> getKeywords() {
        return keywords == null ? List.of() : List.copyOf(keywords);
    }

    public List<String> getNormReferences() {
        return normReferences == null ? List.of() : List.copyOf(normReferences);
    }
}
