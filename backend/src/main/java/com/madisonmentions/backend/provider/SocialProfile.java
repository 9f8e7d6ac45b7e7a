package com.madisonmentions.backend.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Social and contact data a provider knows about a reporter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SocialProfile {
    private String twitterHandle;
    private String twitterUrl;
    private String linkedinUrl;
    private String websiteUrl;
    private String title;
}
