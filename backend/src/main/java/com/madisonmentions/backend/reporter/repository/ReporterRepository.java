package com.madisonmentions.backend.reporter.repository;

import com.madisonmentions.backend.reporter.entity.RelevanceVerdict;
import com.madisonmentions.backend.reporter.entity.Reporter;
import java.time.LocalDateTime;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ReporterRepository extends JpaRepository<Reporter, Long> {

    Optional<Reporter> findByName(String name);

    /**
     * Writes regenerated profile fields and the freshness stamp without touching any other column.
     * Null values keep what is stored. Returns the number of rows changed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Reporter r SET r.currentOutlet = COALESCE(:outlet, r.currentOutlet), " +
            "r.bio = COALESCE(:bio, r.bio), r.lastUpdated = :now WHERE r.id = :id")
    int updateProfile(@Param("id") Long id,
                      @Param("outlet") String outlet,
                      @Param("bio") String bio,
                      @Param("now") LocalDateTime now);

    /**
     * Sets the verdict only while it is still UNKNOWN. Returns the number of rows changed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Reporter r SET r.relevance = :verdict, r.relevanceRationale = :rationale " +
            "WHERE r.id = :id AND r.relevance = com.madisonmentions.backend.reporter.entity.RelevanceVerdict.UNKNOWN")
    int updateRelevanceIfUnknown(@Param("id") Long id,
                                 @Param("verdict") RelevanceVerdict verdict,
                                 @Param("rationale") String rationale);
}
