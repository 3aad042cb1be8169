package com.example.callaudit_backend.repository;

import com.example.callaudit_backend.model.DailyUsage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for per-user daily usage counters.
 */
public interface DailyUsageRepository extends JpaRepository<DailyUsage, UUID> {
    Optional<DailyUsage> findByUserIdAndDateKey(String userId, LocalDate dateKey);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update DailyUsage d
               set d.used = d.used + :delta
             where d.userId = :userId
               and d.dateKey = :dateKey
            """)
    int increment(@Param("userId") String userId,
                  @Param("dateKey") LocalDate dateKey,
                  @Param("delta") int delta);

    /**
     * Adds {@code delta} only while the result stays within {@code limit}.
     *
     * @return 1 when the row was updated, 0 when the limit would be crossed
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update DailyUsage d
               set d.used = d.used + :delta
             where d.userId = :userId
               and d.dateKey = :dateKey
               and d.used + :delta <= :limit
            """)
    int incrementWithinLimit(@Param("userId") String userId,
                             @Param("dateKey") LocalDate dateKey,
                             @Param("delta") int delta,
                             @Param("limit") int limit);
}
