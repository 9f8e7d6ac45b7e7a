package com.madisonmentions.backend.monitoring.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
@Table(name = "api_usage_log", indexes = {
        @Index(name = "idx_api_usage_provider_used_at", columnList = "provider, usedAt")
})
public class ApiUsageLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String provider; // perigon, newsapi, chat-model

    @Column(nullable = false)
    private String operation; // FIND_IDENTITY, FETCH_ARTICLES, SUMMARIZE, ...

    @Column(nullable = false)
    private Boolean success;

    @Column(nullable = false)
    private Boolean rateLimited;

    private Integer itemCount;

    private Long durationMs;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    private LocalDateTime usedAt;
}
