package com.madisonmentions.backend.reporter.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class SocialLinks {
    private String twitterHandle;

    @Column(length = 1024)
    private String twitterUrl;

    @Column(length = 1024)
    private String linkedinUrl;

    @Column(length = 1024)
    private String websiteUrl;

    private String title;

    public boolean isEmpty() {
        return twitterHandle == null && twitterUrl == null && linkedinUrl == null
                && websiteUrl == null && title == null;
    }
}
