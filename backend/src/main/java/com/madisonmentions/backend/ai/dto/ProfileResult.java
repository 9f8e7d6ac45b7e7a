package com.madisonmentions.backend.ai.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inferred current outlet and prose bio. Either may be null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProfileResult {
    @JsonProperty("current_outlet")
    private String currentOutlet;

    @JsonProperty("reporter_bio")
    private String reporterBio;

    public static ProfileResult empty() {
        return new ProfileResult(null, null);
    }
}
