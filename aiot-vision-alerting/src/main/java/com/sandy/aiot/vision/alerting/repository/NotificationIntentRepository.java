package com.sandy.aiot.vision.alerting.repository;

import com.sandy.aiot.vision.alerting.entity.NotificationIntent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NotificationIntentRepository extends JpaRepository<NotificationIntent, Long> {

    List<NotificationIntent> findByAlertIdOrderByIdAsc(Long alertId);

    List<NotificationIntent> findAllByOrderByIdDesc(Pageable pageable);

    @Modifying
    @Query("delete from NotificationIntent n where n.alertId = :alertId")
    int deleteByAlertId(@Param("alertId") Long alertId);
}
