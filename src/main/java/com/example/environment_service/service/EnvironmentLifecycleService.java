package com.example.environment_service.service;

import com.example.environment_service.adapter.AdapterRetryExecutor;
import com.example.environment_service.adapter.ClusterAdapter;
import com.example.environment_service.config.OrchestrationProperties;
import com.example.environment_service.dto.EnvironmentRequest;
import com.example.environment_service.dto.ExpirySweepResult;
import com.example.environment_service.exception.AdapterException;
import com.example.environment_service.exception.EnvironmentException;
import com.example.environment_service.exception.ErrorKind;
import com.example.environment_service.exception.IllegalTransitionException;
import com.example.environment_service.exception.NotFoundException;
import com.example.environment_service.exception.PartialProvisioningException;
import com.example.environment_service.exception.ValidationException;
import com.example.environment_service.model.Environment;
import com.example.environment_service.model.EnvironmentAction;
import com.example.environment_service.model.EnvironmentState;
import com.example.environment_service.model.GitSource;
import com.example.environment_service.model.ObservedResource;
import com.example.environment_service.model.ObservedState;
import com.example.environment_service.model.QuotaPolicy;
import com.example.environment_service.model.QuotaUsage;
import com.example.environment_service.model.ResourceKind;
import com.example.environment_service.model.ResourceSpec;
import com.example.environment_service.model.Template;
import com.example.environment_service.repository.EnvironmentRepository;
import com.example.environment_service.repository.TemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Owns the environment state machine: provisioning with rollback, status reconciliation,
 * start/stop/restart/delete actions and expiry.
 *
 * <p>Cluster writes for one environment are strictly sequential. Each adapter call goes
 * through {@link AdapterRetryExecutor}, so only transient failures are retried.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EnvironmentLifecycleService {

    static final String ENV_ENVIRONMENT_ID = "ENVIRONMENT_ID";
    static final String ENV_TEMPLATE_NAME = "TEMPLATE_NAME";
    static final String ENV_USER_ID = "USER_ID";
    private static final Set<String> RESERVED_VARIABLES = Set.of(ENV_ENVIRONMENT_ID, ENV_TEMPLATE_NAME, ENV_USER_ID);

    private static final Pattern GIT_URL = Pattern.compile("^(https?://|git://|ssh://|git@)[A-Za-z0-9._~:/@%+=,-]+$");

    private final EnvironmentRepository environmentRepository;
    private final TemplateRepository templateRepository;
    private final ClusterAdapter clusterAdapter;
    private final AdapterRetryExecutor retryExecutor;
    private final ManifestBuilder manifestBuilder;
    private final QuotaGovernor quotaGovernor;
    private final StackImageCompiler imageCompiler;
    private final OrchestrationProperties properties;
    private final Clock clock;

    // ------------------------------------------------------------------ create

    /**
     * Validates the request, resolves quota and image, then submits every manifest in order.
     *
     * @return the environment in {@code PROVISIONING}
     * @throws PartialProvisioningException when a later manifest failed after earlier ones were
     *                                      created; those have been rolled back
     */
    public Environment create(EnvironmentRequest request) {
        String identity = request.getIdentity() != null && !request.getIdentity().isBlank()
                ? request.getIdentity() : request.getUserId();
        validate(request, identity);

        Template template = templateRepository.findById(request.getTemplateId())
                .orElseThrow(() -> new NotFoundException(identity, "Template not found: " + request.getTemplateId()));

        QuotaPolicy quota = quotaGovernor.resolve(identity, template.getDefaultLimits(), request.getQuotaOverrides());
        String image = resolveImage(template, identity);
        List<Integer> ports = template.getStack() != null ? template.getStack().getExposedPorts() : List.of();
        validatePorts(identity, ports);

        Instant now = clock.instant();
        Duration ttl = request.getTtlSeconds() != null
                ? Duration.ofSeconds(request.getTtlSeconds()) : properties.getDefaultTtl();
        String slug = ManifestBuilder.slug(identity);
        String id = UUID.randomUUID().toString();

        Environment environment = Environment.builder()
                .id(id)
                .identity(identity)
                .userId(request.getUserId())
                .namespace(ManifestBuilder.namespaceName(slug))
                .templateId(template.getId())
                .templateVersion(template.getVersion())
                .gitSource(gitSource(request))
                .quota(quota)
                .exposedPorts(ports == null ? List.of() : List.copyOf(ports))
                .environmentVariables(mergeVariables(id, template, request))
                .image(image)
                .accessUrl(manifestBuilder.accessUrl(identity))
                .state(EnvironmentState.PENDING)
                .statusMessage("Provisioning requested")
                .createdAt(now)
                .updatedAt(now)
                .expiresAt(now.plus(ttl))
                .build();

        List<ResourceSpec> specs = manifestBuilder.build(template, environment);
        environmentRepository.save(environment);

        log.info("========================================");
        log.info("🚀 PROVISIONING ENVIRONMENT {}", identity);
        log.info("Environment ID: {}", id);
        log.info("Namespace: {}", environment.getNamespace());
        log.info("Template: {} v{}", template.getId(), template.getVersion());
        log.info("========================================");

        List<ResourceSpec> created = new ArrayList<>();
        for (ResourceSpec spec : specs) {
            try {
                log.info("📦 Creating {}", spec.describe());
                retryExecutor.execute("create " + spec.describe(), () -> clusterAdapter.createResource(spec));
                created.add(spec);
            } catch (RuntimeException e) {
                EnvironmentException failure = asEnvironmentException(e, identity);
                log.error("❌ Failed to create {}: {}", spec.describe(), failure.getMessage(), e);
                handleProvisioningFailure(environment, created, failure);
            }
        }

        Instant started = clock.instant();
        environment.setProvisioningStartedAt(started);
        transition(environment, EnvironmentState.PROVISIONING, "Resources submitted, waiting for readiness");

        log.info("========================================");
        log.info("✅ ENVIRONMENT {} SUBMITTED", identity);
        log.info("========================================");
        return environment;
    }

    private void handleProvisioningFailure(Environment environment, List<ResourceSpec> created,
                                           EnvironmentException failure) {
        String identity = environment.getIdentity();
        if (created.isEmpty()) {
            if (failure.getErrorKind() == ErrorKind.ADAPTER_CONFLICT) {
                // the name belongs to another environment; this record owns nothing
                environmentRepository.delete(environment.getId());
            } else {
                markFailed(environment, failure);
            }
            throw failure;
        }

        List<String> rollbackFailures = rollback(created);
        markFailed(environment, failure);
        throw new PartialProvisioningException(identity,
                created.stream().map(ResourceSpec::describe).collect(Collectors.toList()),
                rollbackFailures, failure);
    }

    private List<String> rollback(List<ResourceSpec> created) {
        List<String> failures = new ArrayList<>();
        for (int i = created.size() - 1; i >= 0; i--) {
            ResourceSpec spec = created.get(i);
            try {
                log.info("↩️ Rolling back {}", spec.describe());
                retryExecutor.run("delete " + spec.describe(),
                        () -> clusterAdapter.deleteResource(spec.getKind(), spec.getNamespace(), spec.getName()));
            } catch (RuntimeException e) {
                log.warn("⚠️ Rollback of {} failed: {}", spec.describe(), e.getMessage());
                failures.add(spec.describe());
            }
        }
        return failures;
    }

    private void validate(EnvironmentRequest request, String identity) {
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new ValidationException(identity, "User id is required");
        }
        if (request.getTemplateId() == null || request.getTemplateId().isBlank()) {
            throw new ValidationException(identity, "Template id is required");
        }
        ManifestBuilder.slug(identity);
        if (request.getGitRepository() != null && !request.getGitRepository().isBlank()
                && !GIT_URL.matcher(request.getGitRepository()).matches()) {
            throw new ValidationException(identity, "Unsupported git repository URL: " + request.getGitRepository());
        }
        if (request.getGitBranch() != null && !request.getGitBranch().matches("[A-Za-z0-9._/-]*")) {
            throw new ValidationException(identity, "Invalid git branch: " + request.getGitBranch());
        }
        if (request.getTtlSeconds() != null && request.getTtlSeconds() <= 0) {
            throw new ValidationException(identity, "TTL must be positive");
        }
    }

    private static void validatePorts(String identity, List<Integer> ports) {
        if (ports == null) {
            return;
        }
        for (Integer port : ports) {
            if (port == null || port < 1 || port > 65535) {
                throw new ValidationException(identity, "Port out of range: " + port);
            }
        }
    }

    private String resolveImage(Template template, String identity) {
        if (template.getStack() != null) {
            // images are built per template, so the tag is keyed on the template id
            return imageCompiler.compile(template.getStack(), template.getId(), true).getImageTag();
        }
        if (template.getBaseImage() == null || template.getBaseImage().isBlank()) {
            throw new ValidationException(identity, "Template " + template.getId() + " has neither stack nor base image");
        }
        return template.getBaseImage();
    }

    private static GitSource gitSource(EnvironmentRequest request) {
        if (request.getGitRepository() == null || request.getGitRepository().isBlank()) {
            return null;
        }
        return new GitSource(request.getGitRepository(), request.getGitBranch());
    }

    private static Map<String, String> mergeVariables(String id, Template template, EnvironmentRequest request) {
        Map<String, String> variables = new LinkedHashMap<>();
        if (request.getEnvironmentVariables() != null) {
            variables.putAll(request.getEnvironmentVariables());
        }
        if (template.getStack() != null && template.getStack().getEnvironmentVariables() != null) {
            variables.putAll(template.getStack().getEnvironmentVariables());
        }
        RESERVED_VARIABLES.forEach(variables::remove);
        variables.put(ENV_ENVIRONMENT_ID, id);
        variables.put(ENV_TEMPLATE_NAME, template.getName() != null ? template.getName() : template.getId());
        variables.put(ENV_USER_ID, request.getUserId());
        return variables;
    }

    // --------------------------------------------------------------- reconcile

    /**
     * Reads the owned cluster objects and records the state they imply. Never writes to the cluster.
     */
    public Environment reconcile(String id) {
        Environment environment = get(id);
        EnvironmentState current = environment.getState();
        if (current == EnvironmentState.PENDING || current == EnvironmentState.STOPPED
                || current == EnvironmentState.FAILED || current.isTerminal()) {
            return environment;
        }

        ObservedState observed = observe(environment);
        boolean deadlinePassed = current == EnvironmentState.PROVISIONING
                && environment.getProvisioningStartedAt() != null
                && clock.instant().isAfter(environment.getProvisioningStartedAt().plus(properties.getProvisioningTimeout()));

        EnvironmentState next = EnvironmentStateReconciler.next(current, observed, deadlinePassed);
        if (next == current) {
            return environment;
        }

        if (next == EnvironmentState.FAILED && deadlinePassed) {
            environment.setLastErrorKind(ErrorKind.TIMEOUT);
            transition(environment, next, "Not ready within " + properties.getProvisioningTimeout());
        } else {
            transition(environment, next, describe(next, observed));
        }
        return environment;
    }

    ObservedState observe(Environment environment) {
        String slug = ManifestBuilder.slug(environment.getIdentity());
        String namespace = environment.getNamespace();

        ObservedResource ns = find(ResourceKind.NAMESPACE, null, namespace);
        ObservedResource quota = find(ResourceKind.RESOURCE_QUOTA, namespace, ManifestBuilder.quotaName(slug));
        ObservedResource volume = find(ResourceKind.PERSISTENT_VOLUME_CLAIM, namespace, ManifestBuilder.volumeName(slug));
        ObservedResource workload = find(ResourceKind.DEPLOYMENT, namespace, ManifestBuilder.workloadName(slug));
        ObservedResource service = find(ResourceKind.SERVICE, namespace, ManifestBuilder.serviceName(slug));
        ObservedResource ingress = find(ResourceKind.INGRESS, namespace, ManifestBuilder.ingressName(slug));

        return ObservedState.builder()
                .namespacePresent(ns != null)
                .namespacePhase(ns != null ? ns.getPhase() : null)
                .quotaPresent(quota != null)
                .quotaUsed(quota != null && quota.getQuotaUsed() != null ? quota.getQuotaUsed() : QuotaUsage.empty())
                .volumePresent(volume != null)
                .workloadPresent(workload != null)
                .workloadReadyReplicas(workload != null ? workload.getReadyReplicas() : 0)
                .workloadDesiredReplicas(workload != null ? workload.getDesiredReplicas() : 0)
                .servicePresent(service != null)
                .ingressPresent(ingress != null)
                .build();
    }

    private ObservedResource find(ResourceKind kind, String namespace, String name) {
        try {
            return retryExecutor.execute("get " + kind.getKubernetesKind() + "/" + name,
                    () -> clusterAdapter.getResource(kind, namespace, name));
        } catch (AdapterException e) {
            if (e.isNotFound()) {
                return null;
            }
            throw e;
        }
    }

    private static String describe(EnvironmentState state, ObservedState observed) {
        switch (state) {
            case RUNNING:
                return "Workload ready";
            case DEGRADED:
                return "Workload not ready (" + observed.getWorkloadReadyReplicas() + "/"
                        + observed.getWorkloadDesiredReplicas() + ")";
            case STOPPED:
                return "Workload stopped";
            case DELETED:
                return "All resources removed";
            default:
                return state.name();
        }
    }

    // ----------------------------------------------------------------- actions

    public Environment act(String id, EnvironmentAction action) {
        Environment environment = get(id);
        EnvironmentState state = environment.getState();
        log.info("⚙️ {} requested for {} in state {}", action, environment.getIdentity(), state);

        switch (action) {
            case START:
                requireState(environment, action, EnvironmentState.STOPPED);
                return startWorkload(environment);
            case STOP:
                requireState(environment, action, EnvironmentState.RUNNING, EnvironmentState.DEGRADED);
                return stopWorkload(environment);
            case RESTART:
                requireState(environment, action,
                        EnvironmentState.RUNNING, EnvironmentState.DEGRADED, EnvironmentState.STOPPED);
                if (state != EnvironmentState.STOPPED) {
                    stopWorkload(environment);
                    awaitWorkloadGone(environment);
                }
                return startWorkload(environment);
            case DELETE:
                return delete(id, false);
            default:
                throw new IllegalArgumentException("Unknown action: " + action);
        }
    }

    private Environment startWorkload(Environment environment) {
        Template template = templateRepository.findById(environment.getTemplateId())
                .orElseThrow(() -> new NotFoundException(environment.getIdentity(),
                        "Template not found: " + environment.getTemplateId()));
        ResourceSpec workload = manifestBuilder.workloadSpec(template, environment);

        environment.setProvisioningStartedAt(clock.instant());
        transition(environment, EnvironmentState.PROVISIONING, "Starting workload");
        try {
            retryExecutor.execute("create " + workload.describe(), () -> clusterAdapter.createResource(workload));
        } catch (AdapterException e) {
            if (e.getErrorKind() != ErrorKind.ADAPTER_CONFLICT) {
                log.error("❌ Failed to start {}: {}", environment.getIdentity(), e.getMessage(), e);
                markFailed(environment, e);
                throw e;
            }
            log.info("Workload {} already present", workload.describe());
        }
        return environment;
    }

    private Environment stopWorkload(Environment environment) {
        String slug = ManifestBuilder.slug(environment.getIdentity());
        String name = ManifestBuilder.workloadName(slug);
        transition(environment, EnvironmentState.STOPPING, "Stopping workload");
        try {
            retryExecutor.run("delete Deployment/" + name,
                    () -> clusterAdapter.deleteResource(ResourceKind.DEPLOYMENT, environment.getNamespace(), name));
        } catch (AdapterException e) {
            log.error("❌ Failed to stop {}: {}", environment.getIdentity(), e.getMessage(), e);
            markFailed(environment, e);
            throw e;
        }
        if (find(ResourceKind.DEPLOYMENT, environment.getNamespace(), name) == null) {
            transition(environment, EnvironmentState.STOPPED, "Workload stopped");
        }
        return environment;
    }

    private void awaitWorkloadGone(Environment environment) {
        if (environment.getState() == EnvironmentState.STOPPED) {
            return;
        }
        String name = ManifestBuilder.workloadName(ManifestBuilder.slug(environment.getIdentity()));
        int attempts = pollAttempts(properties.getProvisioningTimeout());
        for (int i = 0; i < attempts; i++) {
            if (!sleep(properties.getReadinessPollInterval())) {
                break;
            }
            if (find(ResourceKind.DEPLOYMENT, environment.getNamespace(), name) == null) {
                transition(environment, EnvironmentState.STOPPED, "Workload stopped");
                return;
            }
        }
        throw new EnvironmentException(ErrorKind.TIMEOUT, environment.getIdentity(),
                "Workload still terminating, restart aborted");
    }

    private static void requireState(Environment environment, EnvironmentAction action, EnvironmentState... allowed) {
        for (EnvironmentState state : allowed) {
            if (environment.getState() == state) {
                return;
            }
        }
        throw new IllegalTransitionException(environment.getIdentity(),
                "Cannot " + action + " environment in state " + environment.getState());
    }

    // ------------------------------------------------------------------ delete

    /**
     * Deletes every owned object in reverse manifest order and records the outcome.
     *
     * @param force record {@code DELETED} even if objects remain or deletion failed
     */
    public Environment delete(String id, boolean force) {
        Environment environment = get(id);
        if (environment.getState().isTerminal()) {
            throw new IllegalTransitionException(environment.getIdentity(), "Environment already deleted");
        }
        if (environment.getState() != EnvironmentState.DELETING) {
            transition(environment, EnvironmentState.DELETING, force ? "Forced delete requested" : "Delete requested");
        }

        log.info("🗑️ Deleting environment {} ({})", environment.getIdentity(), environment.getNamespace());
        String slug = ManifestBuilder.slug(environment.getIdentity());
        String namespace = environment.getNamespace();
        String owner = namespaceOwner(environment);
        if (owner != null && !owner.equals(environment.getId())) {
            log.warn("⚠️ Namespace {} now belongs to environment {}, leaving its objects in place", namespace, owner);
            transition(environment, EnvironmentState.DELETED, "Namespace reused by environment " + owner
                    + ", nothing removed");
            return environment;
        }
        List<ResourceSpec> owned = List.of(
                ownedRef(ResourceKind.INGRESS, namespace, ManifestBuilder.ingressName(slug)),
                ownedRef(ResourceKind.SERVICE, namespace, ManifestBuilder.serviceName(slug)),
                ownedRef(ResourceKind.DEPLOYMENT, namespace, ManifestBuilder.workloadName(slug)),
                ownedRef(ResourceKind.PERSISTENT_VOLUME_CLAIM, namespace, ManifestBuilder.volumeName(slug)),
                ownedRef(ResourceKind.RESOURCE_QUOTA, namespace, ManifestBuilder.quotaName(slug)),
                ownedRef(ResourceKind.NAMESPACE, null, namespace));

        AdapterException lastFailure = null;
        for (ResourceSpec spec : owned) {
            try {
                retryExecutor.run("delete " + spec.describe(),
                        () -> clusterAdapter.deleteResource(spec.getKind(), spec.getNamespace(), spec.getName()));
            } catch (AdapterException e) {
                log.error("❌ Failed to delete {}: {}", spec.describe(), e.getMessage(), e);
                lastFailure = e;
            }
        }

        if (lastFailure != null) {
            if (force) {
                environment.setLastErrorKind(lastFailure.getErrorKind());
                transition(environment, EnvironmentState.DELETED, "Force-deleted with cleanup errors: "
                        + lastFailure.getMessage());
                return environment;
            }
            markFailed(environment, lastFailure);
            throw lastFailure;
        }

        ObservedState observed = observe(environment);
        EnvironmentState next = EnvironmentStateReconciler.next(EnvironmentState.DELETING, observed, false);
        if (next == EnvironmentState.DELETED) {
            transition(environment, EnvironmentState.DELETED, "All resources removed");
        } else if (force) {
            transition(environment, EnvironmentState.DELETED, "Force-deleted while resources still terminating");
        } else {
            environment.setStatusMessage("Waiting for resources to terminate");
            environment.setUpdatedAt(clock.instant());
            environmentRepository.save(environment);
        }
        return environment;
    }

    /**
     * @return the {@code environment-id} label on the environment's namespace, or {@code null} when the
     *         namespace is gone or unlabelled
     */
    private String namespaceOwner(Environment environment) {
        ObservedResource namespace;
        try {
            namespace = find(ResourceKind.NAMESPACE, null, environment.getNamespace());
        } catch (AdapterException e) {
            log.error("❌ Cannot read owner of namespace {}: {}", environment.getNamespace(), e.getMessage(), e);
            markFailed(environment, e);
            throw e;
        }
        if (namespace == null || namespace.getLabels() == null) {
            return null;
        }
        return namespace.getLabels().get(ManifestBuilder.LABEL_ENVIRONMENT_ID);
    }

    private static ResourceSpec ownedRef(ResourceKind kind, String namespace, String name) {
        return ResourceSpec.builder().kind(kind).namespace(namespace).name(name).build();
    }

    // ------------------------------------------------------------------ expiry

    /**
     * Deletes every live environment whose expiry is at or before {@code now}. One failed delete
     * does not stop the rest.
     */
    public ExpirySweepResult expireSweep(Instant now, boolean dryRun) {
        List<Environment> expired = environmentRepository.findAll().stream()
                .filter(Environment::isActive)
                .filter(env -> env.getState() != EnvironmentState.DELETING)
                .filter(env -> env.getExpiresAt() != null && !env.getExpiresAt().isAfter(now))
                .sorted(Comparator.comparing(Environment::getExpiresAt).thenComparing(Environment::getId))
                .collect(Collectors.toList());

        log.info("⏰ Expiry sweep at {}: {} expired environment(s){}", now, expired.size(), dryRun ? " (dry run)" : "");

        List<String> expiredIds = expired.stream().map(Environment::getId).collect(Collectors.toList());
        List<String> initiated = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        if (!dryRun) {
            for (Environment environment : expired) {
                try {
                    delete(environment.getId(), false);
                    initiated.add(environment.getId());
                } catch (EnvironmentException e) {
                    log.error("❌ Expiry delete failed for {}: {}", environment.getIdentity(), e.getMessage(), e);
                    failed.add(environment.getId());
                }
            }
        }

        return ExpirySweepResult.builder()
                .sweptAt(now)
                .dryRun(dryRun)
                .expiredEnvironmentIds(expiredIds)
                .deleteInitiated(initiated)
                .deleteFailed(failed)
                .build();
    }

    // ------------------------------------------------------------------ queries

    /**
     * Reconciles until the environment is running, has failed, or the timeout elapses.
     *
     * @return the last recorded environment
     */
    public Environment awaitRunning(String id, Duration timeout) {
        int attempts = pollAttempts(timeout);
        Environment environment = reconcile(id);
        for (int i = 0; i < attempts && isWaiting(environment); i++) {
            log.debug("⏳ Waiting for {} ({}), attempt {}/{}", environment.getIdentity(), environment.getState(),
                    i + 1, attempts);
            if (!sleep(properties.getReadinessPollInterval())) {
                break;
            }
            environment = reconcile(id);
        }
        if (isWaiting(environment)) {
            log.warn("⚠️ {} not running after {}", environment.getIdentity(), timeout);
        }
        return environment;
    }

    private static boolean isWaiting(Environment environment) {
        return environment.getState() == EnvironmentState.PENDING
                || environment.getState() == EnvironmentState.PROVISIONING;
    }

    public Environment extendExpiry(String id, Instant newExpiresAt) {
        Environment environment = get(id);
        if (!environment.isActive() || environment.getState() == EnvironmentState.DELETING) {
            throw new IllegalTransitionException(environment.getIdentity(),
                    "Cannot extend expiry in state " + environment.getState());
        }
        if (newExpiresAt == null || !newExpiresAt.isAfter(clock.instant())) {
            throw new ValidationException(environment.getIdentity(), "New expiry must be in the future");
        }
        environment.setExpiresAt(newExpiresAt);
        environment.setUpdatedAt(clock.instant());
        environmentRepository.save(environment);
        log.info("Extended expiry of {} to {}", environment.getIdentity(), newExpiresAt);
        return environment;
    }

    public Environment get(String id) {
        return environmentRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(id, "Environment not found: " + id));
    }

    public List<Environment> listByUser(String userId) {
        return environmentRepository.findByUserId(userId).stream()
                .sorted(Comparator.comparing(Environment::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    // ----------------------------------------------------------------- helpers

    private void transition(Environment environment, EnvironmentState target, String message) {
        EnvironmentState current = environment.getState();
        if (!current.canTransitionTo(target)) {
            throw new IllegalTransitionException(environment.getIdentity(),
                    "Illegal transition " + current + " -> " + target);
        }
        environment.setState(target);
        environment.setStatusMessage(message);
        environment.setUpdatedAt(clock.instant());
        environmentRepository.save(environment);
        log.info("🔄 {}: {} -> {} ({})", environment.getIdentity(), current, target, message);
    }

    private void markFailed(Environment environment, EnvironmentException failure) {
        environment.setLastErrorKind(failure.getErrorKind());
        transition(environment, EnvironmentState.FAILED, failure.getMessage());
    }

    private static EnvironmentException asEnvironmentException(RuntimeException e, String identity) {
        if (e instanceof EnvironmentException) {
            return (EnvironmentException) e;
        }
        return new EnvironmentException(ErrorKind.INTERNAL, identity, e.getMessage(), e);
    }

    private int pollAttempts(Duration timeout) {
        long interval = Math.max(1, properties.getReadinessPollInterval().toMillis());
        return (int) Math.max(1, timeout.toMillis() / interval);
    }

    private static boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
