package com.madisonmentions.backend.reporter.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.madisonmentions.backend.provider.SocialProfile;
import com.madisonmentions.backend.reporter.entity.SocialLinks;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SocialLinksDTO {
    private String twitterHandle;
    private String twitterUrl;
    private String linkedinUrl;
    private String websiteUrl;
    private String title;

    public static SocialLinksDTO from(SocialLinks links) {
        if (links == null || links.isEmpty()) {
            return null;
        }
        return new SocialLinksDTO(links.getTwitterHandle(), links.getTwitterUrl(), links.getLinkedinUrl(),
                links.getWebsiteUrl(), links.getTitle());
    }

    public static SocialLinksDTO from(SocialProfile profile) {
        if (profile == null) {
            return null;
        }
        return new SocialLinksDTO(profile.getTwitterHandle(), profile.getTwitterUrl(), profile.getLinkedinUrl(),
                profile.getWebsiteUrl(), profile.getTitle());
    }
}
