package com.madisonmentions.backend.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderIdentity {
    private String provider;
    private String id;
    private SocialProfile socialProfile;
}
