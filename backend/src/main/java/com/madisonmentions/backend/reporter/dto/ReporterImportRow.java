package com.madisonmentions.backend.reporter.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReporterImportRow {
    private String name;
    private String outlet;
    private String bio;
    private String twitterHandle;
    private String linkedinUrl;
    private String websiteUrl;
    private String title;
}
