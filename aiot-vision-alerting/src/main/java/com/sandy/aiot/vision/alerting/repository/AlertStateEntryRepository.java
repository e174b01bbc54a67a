package com.sandy.aiot.vision.alerting.repository;

import com.sandy.aiot.vision.alerting.entity.AlertStateEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AlertStateEntryRepository extends JpaRepository<AlertStateEntry, Long> {

    Optional<AlertStateEntry> findTopByAlertIdOrderByChangedAtDescIdDesc(Long alertId);

    List<AlertStateEntry> findByAlertIdOrderByChangedAtAscIdAsc(Long alertId);

    @Modifying
    @Query("delete from AlertStateEntry e where e.alertId = :alertId")
    int deleteByAlertId(@Param("alertId") Long alertId);
}
