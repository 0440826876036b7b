package com.durableflow.core.workflow;

import com.durableflow.core.exception.NotFoundException;
import com.durableflow.core.exception.RegistrationException;
import com.durableflow.core.model.WorkflowOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Typed registry mapping workflow type names to their code and options.
 * Names are validated at registration; lookups happen by the name carried in history.
 */
public class WorkflowRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRegistry.class);

    static final Pattern TYPE_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_.\\-]{0,127}");

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    /**
     * A registered workflow type.
     */
    public record Registration(String workflowType, Workflow workflow, WorkflowOptions options) {
    }

    public void register(String workflowType, Workflow workflow) {
        register(workflowType, workflow, WorkflowOptions.defaults());
    }

    public void register(String workflowType, Workflow workflow, WorkflowOptions options) {
        validateTypeName("Workflow", workflowType);
        if (workflow == null) {
            throw new RegistrationException("Workflow implementation is required for " + workflowType);
        }
        Registration registration = new Registration(workflowType, workflow,
            options != null ? options : WorkflowOptions.defaults());
        if (registrations.putIfAbsent(workflowType, registration) != null) {
            throw new RegistrationException("Workflow type already registered: " + workflowType);
        }
        log.info("Registered workflow type: {} (queue={})", workflowType, registration.options().taskQueue());
    }

    public Optional<Registration> find(String workflowType) {
        return Optional.ofNullable(registrations.get(workflowType));
    }

    public Registration get(String workflowType) {
        return find(workflowType)
            .orElseThrow(() -> new NotFoundException("WorkflowType", workflowType));
    }

    public Set<String> workflowTypes() {
        return Set.copyOf(registrations.keySet());
    }

    /**
     * Validate a workflow or activity type name.
     */
    public static void validateTypeName(String kind, String typeName) {
        if (typeName == null || !TYPE_NAME.matcher(typeName).matches()) {
            throw new RegistrationException(kind + " type name is invalid: '" + typeName + "'");
        }
    }
}
