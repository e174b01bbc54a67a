package com.sandy.aiot.vision.alerting.vo;

import com.sandy.aiot.vision.alerting.entity.EscalationTier;
import lombok.Data;

import java.util.List;

/** Create or partial update of an escalation policy; null fields are left unchanged on update. */
@Data
public class PolicyReq {
    private String name;
    private String description;
    private List<String> severities;
    private List<EscalationTier> tiers;
    private Boolean enabled;
    private Boolean acknowledgeSuppresses;
}
