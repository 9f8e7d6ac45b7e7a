package com.madisonmentions.backend.provider;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A reporter found through topic search.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdentitySummary {
    private String provider;
    private String id;
    private String name;
    private String title;
    @Builder.Default
    private List<String> outlets = new ArrayList<>();
    @Builder.Default
    private List<String> topics = new ArrayList<>();
}
