package com.sandy.aiot.vision.alerting.repository;

import com.sandy.aiot.vision.alerting.entity.OnCallSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface OnCallScheduleRepository extends JpaRepository<OnCallSchedule, Long> {
    Optional<OnCallSchedule> findByName(String name);
    List<OnCallSchedule> findByEnabledTrueOrderByNameAsc();
    List<OnCallSchedule> findAllByOrderByNameAsc();
}
