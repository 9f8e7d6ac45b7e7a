package com.madisonmentions.backend.search.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReporterSearchResult {
    private String name;
    private String title;
    @Builder.Default
    private List<String> outlets = new ArrayList<>();
    @Builder.Default
    private List<String> topics = new ArrayList<>();
    private String provider;
    private String externalId;
}
