package com.durableflow.worker;

import com.durableflow.core.exception.RegistrationException;
import com.durableflow.core.model.ActivityOptions;
import com.durableflow.core.workflow.ActivityCatalog;
import com.durableflow.core.workflow.WorkflowRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered activity types: handler plus the options invocations get when workflow code
 * does not pass its own.
 */
public class ActivityRegistry implements ActivityCatalog {

    private static final Logger log = LoggerFactory.getLogger(ActivityRegistry.class);

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    public record Registration(String activityType, ActivityHandler handler, ActivityOptions options) {
    }

    public void register(String activityType, ActivityHandler handler) {
        register(activityType, handler, ActivityOptions.defaults());
    }

    /**
     * @throws RegistrationException if the name is invalid or already registered
     */
    public void register(String activityType, ActivityHandler handler, ActivityOptions options) {
        WorkflowRegistry.validateTypeName("Activity", activityType);
        if (handler == null) {
            throw new RegistrationException("Activity handler is required for " + activityType);
        }
        Registration registration = new Registration(activityType, handler,
            options != null ? options : ActivityOptions.defaults());
        if (registrations.putIfAbsent(activityType, registration) != null) {
            throw new RegistrationException("Activity type already registered: " + activityType);
        }
        log.info("Registered activity handler: {}", activityType);
    }

    public Optional<Registration> find(String activityType) {
        return Optional.ofNullable(registrations.get(activityType));
    }

    public Set<String> activityTypes() {
        return Set.copyOf(registrations.keySet());
    }

    @Override
    public Optional<ActivityOptions> defaultOptions(String activityType) {
        return find(activityType).map(Registration::options);
    }
}
