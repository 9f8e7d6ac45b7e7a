package com.madisonmentions.backend.reporter.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.madisonmentions.backend.analysis.dto.OutletCount;
import com.madisonmentions.backend.reporter.service.ResolutionTier;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything known about one reporter, as returned by {@code GET /api/reporter/{name}}.
 * {@code proServicesRelevant} is null until the reporter has been classified.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReporterDossier {
    private String reporterName;
    private LocalDate queryDate;
    @Builder.Default
    private List<DossierArticle> articles = new ArrayList<>();
    @Builder.Default
    private List<OutletCount> outletHistory = new ArrayList<>();
    private String currentOutlet;
    private String reporterBio;
    private SocialLinksDTO socialLinks;
    private boolean outletChangeDetected;
    private String outletChangeNote;
    private LocalDateTime lastUpdated;
    private Boolean proServicesRelevant;
    private String relevanceRationale;
    private ResolutionTier resolutionTier;
}
