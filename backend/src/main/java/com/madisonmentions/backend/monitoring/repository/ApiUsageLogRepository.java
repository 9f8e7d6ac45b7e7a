package com.madisonmentions.backend.monitoring.repository;

import com.madisonmentions.backend.monitoring.entity.ApiUsageLog;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ApiUsageLogRepository extends JpaRepository<ApiUsageLog, Long> {

    @Query("SELECT COUNT(a) FROM ApiUsageLog a WHERE a.provider = :provider AND a.usedAt >= :since")
    Long countCallsByProviderSince(@Param("provider") String provider, @Param("since") LocalDateTime since);

    @Query("SELECT COUNT(a) FROM ApiUsageLog a WHERE a.provider = :provider AND a.success = false AND a.usedAt >= :since")
    Long countFailuresByProviderSince(@Param("provider") String provider, @Param("since") LocalDateTime since);

    @Query("SELECT COUNT(a) FROM ApiUsageLog a WHERE a.provider = :provider AND a.rateLimited = true AND a.usedAt >= :since")
    Long countRateLimitedByProviderSince(@Param("provider") String provider, @Param("since") LocalDateTime since);

    @Query("SELECT AVG(a.durationMs) FROM ApiUsageLog a WHERE a.provider = :provider AND a.usedAt >= :since")
    Double averageDurationByProviderSince(@Param("provider") String provider, @Param("since") LocalDateTime since);

    @Query("SELECT DISTINCT a.provider FROM ApiUsageLog a")
    List<String> findDistinctProviders();

    @Query("SELECT a FROM ApiUsageLog a WHERE a.success = false ORDER BY a.usedAt DESC")
    List<ApiUsageLog> findFailedOperations(Pageable pageable);

    /**
     * Newest entries first. A null filter matches every value.
     */
    @Query("SELECT a FROM ApiUsageLog a WHERE (:provider IS NULL OR a.provider = :provider) " +
            "AND (:operation IS NULL OR a.operation = :operation) " +
            "AND (:success IS NULL OR a.success = :success) " +
            "ORDER BY a.usedAt DESC, a.id DESC")
    List<ApiUsageLog> findFiltered(@Param("provider") String provider,
                                   @Param("operation") String operation,
                                   @Param("success") Boolean success,
                                   Pageable pageable);
}
