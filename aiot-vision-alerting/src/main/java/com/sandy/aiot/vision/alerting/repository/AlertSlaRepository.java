package com.sandy.aiot.vision.alerting.repository;

import com.sandy.aiot.vision.alerting.entity.AlertSla;
import com.sandy.aiot.vision.alerting.entity.Severity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AlertSlaRepository extends JpaRepository<AlertSla, Long> {

    Optional<AlertSla> findByAlertId(Long alertId);

    /** Conditional write: only the first human response sets TTA. */
    @Modifying
    @Query("update AlertSla s set s.ttaActualMin = :actual, s.acknowledgedAt = :at, s.ttaBreached = :breached " +
            "where s.alertId = :alertId and s.ttaActualMin is null")
    int recordFirstResponse(@Param("alertId") Long alertId,
                            @Param("actual") int actual,
                            @Param("at") Instant at,
                            @Param("breached") boolean breached);

    /** Conditional write: TTR is set at most once. */
    @Modifying
    @Query("update AlertSla s set s.ttrActualMin = :actual, s.resolvedAt = :at, s.ttrBreached = :breached " +
            "where s.alertId = :alertId and s.ttrActualMin is null")
    int recordResolution(@Param("alertId") Long alertId,
                         @Param("actual") int actual,
                         @Param("at") Instant at,
                         @Param("breached") boolean breached);

    @Query("select s from AlertSla s where s.createdAt between :from and :to " +
            "and (:severity is null or s.severity = :severity)")
    List<AlertSla> findInWindow(@Param("severity") Severity severity,
                                @Param("from") Instant from,
                                @Param("to") Instant to);

    @Query("select s from AlertSla s where " +
            "((:tta = true and s.ttaBreached = true) or (:ttr = true and s.ttrBreached = true)) " +
            "and (:severity is null or s.severity = :severity) order by s.createdAt desc")
    List<AlertSla> findBreached(@Param("tta") boolean tta,
                                @Param("ttr") boolean ttr,
                                @Param("severity") Severity severity,
                                Pageable pageable);

    @Modifying
    @Query("delete from AlertSla s where s.alertId = :alertId")
    int deleteByAlertId(@Param("alertId") Long alertId);
}
