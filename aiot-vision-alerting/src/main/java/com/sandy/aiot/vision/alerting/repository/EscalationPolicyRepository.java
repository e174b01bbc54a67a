package com.sandy.aiot.vision.alerting.repository;

import com.sandy.aiot.vision.alerting.entity.EscalationPolicy;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EscalationPolicyRepository extends JpaRepository<EscalationPolicy, Long> {
    List<EscalationPolicy> findByEnabledTrueOrderByNameAsc();
    List<EscalationPolicy> findAllByOrderByNameAsc();
    Optional<EscalationPolicy> findByName(String name);
}
