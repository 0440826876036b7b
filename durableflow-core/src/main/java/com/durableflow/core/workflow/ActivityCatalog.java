package com.durableflow.core.workflow;

import com.durableflow.core.model.ActivityOptions;
import java.util.Optional;

/**
 * Source of the options an activity type was registered with.
 * Consulted when an invocation is scheduled without explicit options.
 */
@FunctionalInterface
public interface ActivityCatalog {

    Optional<ActivityOptions> defaultOptions(String activityType);

    static ActivityCatalog empty() {
        return activityType -> Optional.empty();
    }
}
