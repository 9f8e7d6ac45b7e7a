package com.madisonmentions.backend.cache.repository;

import com.madisonmentions.backend.cache.entity.CachedQuery;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface CachedQueryRepository extends JpaRepository<CachedQuery, Long> {

    Optional<CachedQuery> findByCacheKeyAndBucketDate(String cacheKey, LocalDate bucketDate);

    @Query("SELECT c FROM CachedQuery c WHERE c.cacheKey = :cacheKey AND c.createdAt >= :since " +
            "ORDER BY c.createdAt DESC LIMIT 1")
    Optional<CachedQuery> findLatestSince(@Param("cacheKey") String cacheKey, @Param("since") LocalDateTime since);
}
