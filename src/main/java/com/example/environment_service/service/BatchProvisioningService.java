package com.example.environment_service.service;

import com.example.environment_service.config.OrchestrationProperties;
import com.example.environment_service.dto.BatchItemOutcome;
import com.example.environment_service.dto.BatchItemResult;
import com.example.environment_service.dto.BatchJobRequest;
import com.example.environment_service.dto.BatchMode;
import com.example.environment_service.dto.BatchOperation;
import com.example.environment_service.dto.BatchResult;
import com.example.environment_service.dto.EnvironmentRequest;
import com.example.environment_service.exception.BatchTooLargeException;
import com.example.environment_service.exception.EnvironmentException;
import com.example.environment_service.exception.ErrorKind;
import com.example.environment_service.exception.NotFoundException;
import com.example.environment_service.exception.ValidationException;
import com.example.environment_service.model.Environment;
import com.example.environment_service.model.EnvironmentState;
import com.example.environment_service.model.SandboxUser;
import com.example.environment_service.model.Template;
import com.example.environment_service.repository.EnvironmentRepository;
import com.example.environment_service.repository.SandboxUserRepository;
import com.example.environment_service.repository.TemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Runs bounded create or delete batches on a fixed-size worker pool.
 *
 * <p>The whole job is validated before any item starts. After that every item is isolated:
 * each worker writes only its own result slot and a failure never cancels a sibling.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchProvisioningService {

    static final Pattern NAME_PREFIX = Pattern.compile("(?=.{1,40}$)[a-z][a-z0-9]*(?:-[a-z0-9]+)*");

    private final EnvironmentLifecycleService lifecycleService;
    private final EnvironmentRepository environmentRepository;
    private final TemplateRepository templateRepository;
    private final SandboxUserRepository sandboxUserRepository;
    private final QuotaGovernor quotaGovernor;
    private final StackImageCompiler imageCompiler;
    private final OrchestrationProperties properties;
    private final Clock clock;

    private final AtomicInteger poolSequence = new AtomicInteger();

    public BatchResult runBatch(BatchJobRequest job) {
        return submit(job).await();
    }

    /**
     * Validates the job and starts it.
     *
     * @throws BatchTooLargeException when the item count exceeds the configured ceiling
     * @throws ValidationException    for any other malformed parameter
     */
    public BatchExecution submit(BatchJobRequest job) {
        List<BatchItem> items = plan(job);
        int concurrency = concurrency(job, items.size());
        AtomicBoolean cancelled = new AtomicBoolean(false);

        log.info("========================================");
        log.info("📋 STARTING BATCH {} '{}'", job.getOperation(), job.getNamePrefix());
        log.info("Items: {}, mode: {}, concurrency: {}", items.size(), job.getMode(), concurrency);
        log.info("========================================");

        long started = System.nanoTime();
        if (items.isEmpty()) {
            return new BatchExecution(job.getNamePrefix(), cancelled,
                    CompletableFuture.completedFuture(BatchResult.of(job, List.of(), 0)));
        }

        AtomicReferenceArray<BatchItemResult> slots = new AtomicReferenceArray<>(items.size());
        ExecutorService pool = Executors.newFixedThreadPool(concurrency, runnable -> {
            Thread thread = new Thread(runnable, "batch-" + poolSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        List<CompletableFuture<Void>> tasks = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            int slot = i;
            BatchItem item = items.get(i);
            tasks.add(CompletableFuture.runAsync(() -> {
                if (cancelled.get()) {
                    slots.set(slot, BatchItemResult.cancelled(item.identity));
                    return;
                }
                slots.set(slot, runItem(job, item));
            }, pool));
        }

        CompletableFuture<BatchResult> result = CompletableFuture
                .allOf(tasks.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<BatchItemResult> results = new ArrayList<>(items.size());
                    for (int i = 0; i < items.size(); i++) {
                        results.add(slots.get(i));
                    }
                    BatchResult batch = BatchResult.of(job, results, (System.nanoTime() - started) / 1_000_000);
                    log.info("========================================");
                    log.info("✅ BATCH '{}' FINISHED: {} succeeded, {} failed, {} cancelled in {} ms",
                            job.getNamePrefix(), batch.getSucceeded(), batch.getFailed(), batch.getCancelled(),
                            batch.getElapsedMillis());
                    log.info("========================================");
                    return batch;
                })
                .whenComplete((batch, error) -> pool.shutdown());

        return new BatchExecution(job.getNamePrefix(), cancelled, result);
    }

    private BatchItemResult runItem(BatchJobRequest job, BatchItem item) {
        long started = System.nanoTime();
        BatchItemResult.BatchItemResultBuilder result = BatchItemResult.builder().identity(item.identity);
        try {
            if (job.getOperation() == BatchOperation.CREATE) {
                if (job.getMode() == BatchMode.DRY_RUN) {
                    dryRunCreate(job, item);
                    result.outcome(BatchItemOutcome.SUCCEEDED).message("Would create " + item.identity);
                } else {
                    Environment environment = lifecycleService.create(EnvironmentRequest.builder()
                            .identity(item.identity)
                            .userId(item.identity)
                            .templateId(job.getTemplateId())
                            .quotaOverrides(job.getQuotaOverrides())
                            .ttlSeconds(job.getTtlSeconds())
                            .build());
                    sandboxUserRepository.save(SandboxUser.builder()
                            .id(item.identity)
                            .environmentId(environment.getId())
                            .batchPrefix(job.getNamePrefix())
                            .createdAt(clock.instant())
                            .build());
                    result.outcome(BatchItemOutcome.SUCCEEDED).environmentId(environment.getId())
                            .message(environment.getState().name());
                }
            } else if (job.getMode() == BatchMode.DRY_RUN) {
                boolean deletable = item.environment.isActive();
                result.outcome(deletable ? BatchItemOutcome.DELETABLE : BatchItemOutcome.NOT_DELETABLE)
                        .environmentId(item.environment.getId())
                        .message(item.environment.getState().name());
            } else {
                Environment environment = lifecycleService.delete(item.environment.getId(), false);
                result.outcome(BatchItemOutcome.SUCCEEDED).environmentId(environment.getId())
                        .message(environment.getState().name());
            }
        } catch (EnvironmentException e) {
            log.warn("⚠️ Batch item {} failed: {}", item.identity, e.getMessage());
            result.outcome(BatchItemOutcome.FAILED).errorKind(e.getErrorKind()).message(e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ Batch item {} failed unexpectedly: {}", item.identity, e.getMessage(), e);
            result.outcome(BatchItemOutcome.FAILED).errorKind(ErrorKind.INTERNAL).message(e.getMessage());
        }
        return result.durationMillis((System.nanoTime() - started) / 1_000_000).build();
    }

    private void dryRunCreate(BatchJobRequest job, BatchItem item) {
        Template template = templateRepository.findById(job.getTemplateId())
                .orElseThrow(() -> new NotFoundException(item.identity, "Template not found: " + job.getTemplateId()));
        ManifestBuilder.slug(item.identity);
        quotaGovernor.resolve(item.identity, template.getDefaultLimits(), job.getQuotaOverrides());
        if (template.getStack() != null) {
            imageCompiler.compile(template.getStack(), template.getId(), true);
        }
    }

    private List<BatchItem> plan(BatchJobRequest job) {
        if (job.getOperation() == null) {
            throw new ValidationException(job.getNamePrefix(), "Batch operation is required");
        }
        if (job.getNamePrefix() == null || !NAME_PREFIX.matcher(job.getNamePrefix()).matches()) {
            throw new ValidationException(job.getNamePrefix(), "Invalid name prefix: " + job.getNamePrefix());
        }
        if (job.getMode() == null) {
            job.setMode(BatchMode.APPLY);
        }
        int ceiling = properties.getBatch().getMaxSize();

        if (job.getOperation() == BatchOperation.CREATE) {
            if (job.getCount() < 1) {
                throw new ValidationException(job.getNamePrefix(), "Batch count must be at least 1");
            }
            if (job.getCount() > ceiling) {
                throw new BatchTooLargeException(job.getNamePrefix(), job.getCount(), ceiling);
            }
            if (job.getTemplateId() == null || job.getTemplateId().isBlank()) {
                throw new ValidationException(job.getNamePrefix(), "Template id is required for create batches");
            }
            if (templateRepository.findById(job.getTemplateId()).isEmpty()) {
                throw new NotFoundException(job.getNamePrefix(), "Template not found: " + job.getTemplateId());
            }
            int longest = ManifestBuilder.MAX_SLUG_LENGTH - 1 - suffixWidth(job.getCount());
            if (job.getNamePrefix().length() > longest) {
                throw new ValidationException(job.getNamePrefix(), "Name prefix must be at most " + longest
                        + " characters for " + job.getCount() + " items");
            }
            List<BatchItem> items = new ArrayList<>(job.getCount());
            for (String identity : identities(job.getNamePrefix(), job.getCount())) {
                items.add(new BatchItem(identity, null));
            }
            return items;
        }

        Pattern batchNamespace = Pattern.compile(
                Pattern.quote(ManifestBuilder.namespaceName(job.getNamePrefix()) + "-") + "\\d{2,}");
        List<Environment> matched = environmentRepository.findByNamespacePrefix(
                        ManifestBuilder.namespaceName(job.getNamePrefix()) + "-").stream()
                .filter(env -> batchNamespace.matcher(env.getNamespace()).matches())
                .filter(env -> job.getMode() != BatchMode.APPLY || env.getState() != EnvironmentState.DELETED)
                .collect(Collectors.toList());
        if (matched.size() > ceiling) {
            throw new BatchTooLargeException(job.getNamePrefix(), matched.size(), ceiling);
        }
        return matched.stream()
                .map(env -> new BatchItem(env.getIdentity(), env))
                .collect(Collectors.toList());
    }

    private int concurrency(BatchJobRequest job, int items) {
        OrchestrationProperties.Batch batch = properties.getBatch();
        int requested = job.getConcurrency() != null ? job.getConcurrency() : batch.getDefaultConcurrency();
        if (requested < 1) {
            throw new ValidationException(job.getNamePrefix(), "Concurrency must be at least 1");
        }
        return Math.max(1, Math.min(Math.min(requested, batch.getMaxConcurrency()), items));
    }

    /**
     * @return {@code prefix-01 ... prefix-N}, zero-padded to at least two digits
     */
    static List<String> identities(String prefix, int count) {
        int width = suffixWidth(count);
        List<String> identities = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            identities.add(prefix + "-" + String.format("%0" + width + "d", i));
        }
        return identities;
    }

    private static int suffixWidth(int count) {
        return Math.max(2, String.valueOf(count).length());
    }

    private static final class BatchItem {
        private final String identity;
        private final Environment environment;

        private BatchItem(String identity, Environment environment) {
            this.identity = identity;
            this.environment = environment;
        }
    }
}
