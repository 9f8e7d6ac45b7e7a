package com.madisonmentions.backend.reporter.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "articles", indexes = {
        @Index(name = "idx_articles_reporter_date", columnList = "reporter_id, publishedDate")
})
public class Article {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "reporter_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Reporter reporter;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String headline;

    @Column(nullable = false)
    private String outlet;

    @Column(nullable = false)
    private LocalDate publishedDate;

    @Column(nullable = false, unique = true, length = 2048)
    private String url;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Convert(converter = TopicListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<String> topics = new ArrayList<>();

    @CreationTimestamp
    private LocalDateTime createdAt;
}
