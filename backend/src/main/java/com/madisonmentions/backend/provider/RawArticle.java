package com.madisonmentions.backend.provider;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Article as a provider delivered it: fields are mapped but not yet validated or cleaned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawArticle {
    private String title;
    private String url;
    private String publishedAt;
    private String sourceDomain;
    @Builder.Default
    private List<String> topics = new ArrayList<>();
}
