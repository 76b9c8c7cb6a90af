package com.myorg.normcontrol.patterns;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Labeled extraction patterns for one structured field. The first pattern whose group 1
 * matches wins; {@code weight} is added to the extraction confidence when it does.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class FieldPatternDefinition {

    @JsonProperty("field")
    private String field;

    @JsonProperty("patterns")
    private List<String> patterns;

    @JsonProperty("weight")
    private double weight;

    public List<String> getPatterns() {
        return patterns == null ? List.of() : List.copyOf(patterns);
    }
}
