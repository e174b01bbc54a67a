package com.sandy.aiot.vision.alerting.repository;

import com.sandy.aiot.vision.alerting.entity.Alert;
import com.sandy.aiot.vision.alerting.entity.AlertState;
import com.sandy.aiot.vision.alerting.entity.Severity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AlertRepository extends JpaRepository<Alert, Long> {

    /** Row lock serializing transitions and escalation advances on one alert. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Alert a where a.id = :id")
    Optional<Alert> findByIdForUpdate(@Param("id") Long id);

    @Query("select a from Alert a where (:severity is null or a.severity = :severity) " +
            "and (:state is null or a.currentState = :state) " +
            "and (:deviceId is null or a.deviceId = :deviceId) " +
            "and (:since is null or a.createdAt >= :since)")
    Page<Alert> search(@Param("severity") Severity severity,
                       @Param("state") AlertState state,
                       @Param("deviceId") String deviceId,
                       @Param("since") Instant since,
                       Pageable pageable);

    @Query("select a from Alert a where a.escalationDueAt is not null and a.escalationDueAt <= :now " +
            "and a.currentState <> com.sandy.aiot.vision.alerting.entity.AlertState.RESOLVED " +
            "order by a.escalationDueAt asc, a.id asc")
    List<Alert> findDueForEscalation(@Param("now") Instant now, Pageable pageable);

    @Modifying
    @Query("update Alert a set a.escalationDueAt = :now where a.severity in :severities " +
            "and a.currentState <> com.sandy.aiot.vision.alerting.entity.AlertState.RESOLVED")
    int rearmEscalation(@Param("severities") Collection<Severity> severities, @Param("now") Instant now);

    @Modifying
    @Query("update Alert a set a.groupId = null where a.groupId = :groupId")
    int unlinkGroup(@Param("groupId") Long groupId);

    long countByGroupId(Long groupId);

    long countByGroupIdAndCurrentStateNot(Long groupId, AlertState state);

    long countByCurrentStateNot(AlertState state);

    @Query("select a from Alert a where a.ruleId = :ruleId " +
            "and (:deviceId is null or a.deviceId = :deviceId) " +
            "and (:severity is null or a.severity = :severity) order by a.createdAt desc")
    List<Alert> findByRule(@Param("ruleId") String ruleId,
                           @Param("deviceId") String deviceId,
                           @Param("severity") Severity severity,
                           Pageable pageable);
}
