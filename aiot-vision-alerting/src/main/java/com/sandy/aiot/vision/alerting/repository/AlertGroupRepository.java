package com.sandy.aiot.vision.alerting.repository;

import com.sandy.aiot.vision.alerting.entity.AlertGroup;
import com.sandy.aiot.vision.alerting.entity.GroupStatus;
import com.sandy.aiot.vision.alerting.entity.Severity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AlertGroupRepository extends JpaRepository<AlertGroup, Long> {

    /** Locks the active group row for a key; concurrent ingests of the same key queue here. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select g from AlertGroup g where g.activeKey = :key")
    Optional<AlertGroup> findActiveByKeyForUpdate(@Param("key") String key);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select g from AlertGroup g where g.id = :id")
    Optional<AlertGroup> findByIdForUpdate(@Param("id") Long id);

    @Query("select g from AlertGroup g where (:deviceId is null or g.deviceId = :deviceId) " +
            "and (:severity is null or g.severity = :severity) " +
            "and (:status is null or g.status = :status) order by g.lastOccurrence desc")
    List<AlertGroup> search(@Param("deviceId") String deviceId,
                            @Param("severity") Severity severity,
                            @Param("status") GroupStatus status,
                            Pageable pageable);

    long countByStatus(GroupStatus status);

    @Query("select coalesce(sum(g.occurrenceCount), 0) from AlertGroup g")
    long sumOccurrences();

    @Query("select coalesce(max(g.occurrenceCount), 0) from AlertGroup g")
    int maxOccurrences();
}
