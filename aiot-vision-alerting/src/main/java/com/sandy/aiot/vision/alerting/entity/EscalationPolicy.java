package com.sandy.aiot.vision.alerting.entity;

import com.sandy.aiot.vision.alerting.entity.converter.EscalationTiersConverter;
import com.sandy.aiot.vision.alerting.entity.converter.SeverityListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "escalation_policies")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationPolicy {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 255)
    private String name;

    @Column(length = 1000)
    private String description;

    @Convert(converter = SeverityListConverter.class)
    @Column(nullable = false, length = 200)
    @Builder.Default
    private List<Severity> severities = new ArrayList<>();

    private boolean enabled;

    /** Null means "use alerting.escalation.acknowledge-suppresses". */
    private Boolean acknowledgeSuppresses;

    @Convert(converter = EscalationTiersConverter.class)
    @Column(nullable = false, length = 8000)
    @Builder.Default
    private List<EscalationTier> tiers = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    public boolean appliesTo(Severity severity) {
        return severities != null && severities.contains(severity);
    }

    /** Tier for a 1-based level position, or null past the end of the chain. */
    public EscalationTier tierAt(int position) {
        if (tiers == null || position < 1 || position > tiers.size()) return null;
        return tiers.get(position - 1);
    }

    public int tierCount() {
        return tiers == null ? 0 : tiers.size();
    }
}
