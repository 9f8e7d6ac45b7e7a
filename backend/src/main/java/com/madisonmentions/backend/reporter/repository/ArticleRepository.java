package com.madisonmentions.backend.reporter.repository;

import com.madisonmentions.backend.reporter.entity.Article;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ArticleRepository extends JpaRepository<Article, Long> {

    List<Article> findByReporterIdOrderByPublishedDateDescUrlAsc(Long reporterId);

    long countByReporterId(Long reporterId);

    @Query("SELECT MAX(a.publishedDate) FROM Article a WHERE a.reporter.id = :reporterId")
    LocalDate findLatestPublishedDate(@Param("reporterId") Long reporterId);

    @Query("SELECT a.url FROM Article a WHERE a.url IN :urls")
    List<String> findExistingUrls(@Param("urls") Collection<String> urls);
}
