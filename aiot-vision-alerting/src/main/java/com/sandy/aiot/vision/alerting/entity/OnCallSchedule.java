package com.sandy.aiot.vision.alerting.entity;

import com.sandy.aiot.vision.alerting.entity.converter.OnCallOverridesConverter;
import com.sandy.aiot.vision.alerting.entity.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "on_call_schedules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnCallSchedule {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 255)
    private String name;

    @Column(length = 1000)
    private String description;

    /** IANA zone id, e.g. "UTC" or "America/Chicago". */
    @Column(nullable = false, length = 64)
    private String timezone;

    private boolean enabled;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RotationType rotationType;

    /** Authoritative phase of the rotation cycle. */
    @Column(nullable = false)
    private Instant rotationStart;

    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, length = 4000)
    @Builder.Default
    private List<String> users = new ArrayList<>();

    /** Consulted in insertion order before any rotation math; first match wins. */
    @Convert(converter = OnCallOverridesConverter.class)
    @Column(length = 8000)
    @Builder.Default
    private List<OnCallOverride> overrides = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;
}
