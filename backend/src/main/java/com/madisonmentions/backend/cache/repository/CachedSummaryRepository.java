package com.madisonmentions.backend.cache.repository;

import com.madisonmentions.backend.cache.entity.CachedSummary;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface CachedSummaryRepository extends JpaRepository<CachedSummary, Long> {

    Optional<CachedSummary> findByCacheKey(String cacheKey);

    @Query("SELECT c FROM CachedSummary c WHERE c.cacheKey IN :keys")
    List<CachedSummary> findByCacheKeys(@Param("keys") Collection<String> keys);

    @Query("SELECT c.cacheKey FROM CachedSummary c WHERE c.cacheKey IN :keys")
    List<String> findExistingKeys(@Param("keys") Collection<String> keys);
}
