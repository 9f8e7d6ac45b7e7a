package com.madisonmentions.backend.reporter.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "reporters", indexes = {
        @Index(name = "idx_reporters_external", columnList = "externalSource, externalId")
})
public class Reporter {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Canonical form: trimmed, whitespace collapsed, lower-cased
    @Column(nullable = false, unique = true)
    private String name;

    private String externalId;

    private String externalSource;

    private String currentOutlet;

    @Column(columnDefinition = "TEXT")
    private String bio;

    @Embedded
    private SocialLinks socialLinks;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private ReporterSource source = ReporterSource.PROVIDER;

    // Verdict columns are written on insert and then only through ReporterRepository.updateRelevanceIfUnknown
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32, updatable = false)
    @Builder.Default
    private RelevanceVerdict relevance = RelevanceVerdict.UNKNOWN;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String relevanceRationale;

    private LocalDateTime lastUpdated;

    @CreationTimestamp
    private LocalDateTime createdAt;

    public boolean hasIdentity() {
        return externalId != null && !externalId.isBlank();
    }
}
