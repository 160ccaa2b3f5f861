package com.panelbridge.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * An action plan as listed by the panel. {@code contents} and {@code description} are only
 * populated when the plan was fetched individually.
 */
@Value
@Builder
public class ActionPlan {

    long id;
    String name;
    String planType;
    Integer partitionId;
    String description;
    boolean highSecurity;
    String contents;

    public boolean isSystemPlan() {
        return "System".equals(planType);
    }
}
