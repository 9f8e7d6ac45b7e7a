package com.madisonmentions.backend.analysis.dto;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provider-independent article shape used by dedup, trend analysis and persistence.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalArticle {
    private String headline;
    private String outlet;
    private LocalDate publishedDate;
    private String url;
    private String summary;
    @Builder.Default
    private List<String> topics = new ArrayList<>();
}
