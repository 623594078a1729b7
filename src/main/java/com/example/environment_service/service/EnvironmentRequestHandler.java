package com.example.environment_service.service;

import com.example.environment_service.config.OrchestrationProperties;
import com.example.environment_service.dto.BatchJobRequest;
import com.example.environment_service.dto.BatchResult;
import com.example.environment_service.dto.EnvironmentActionRequest;
import com.example.environment_service.dto.EnvironmentRequest;
import com.example.environment_service.dto.EnvironmentStatusEvent;
import com.example.environment_service.dto.ExpirySweepResult;
import com.example.environment_service.dto.ExpirySweepTrigger;
import com.example.environment_service.dto.ResourceAlert;
import com.example.environment_service.exception.EnvironmentException;
import com.example.environment_service.exception.ErrorKind;
import com.example.environment_service.kafka.BatchResultProducer;
import com.example.environment_service.kafka.EnvironmentStatusProducer;
import com.example.environment_service.kafka.ResourceAlertProducer;
import com.example.environment_service.model.Environment;
import com.example.environment_service.model.EnvironmentAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Runs inbound requests off the listener threads and reports every outcome, success or
 * failure, on the outbound topics.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EnvironmentRequestHandler {

    private final EnvironmentLifecycleService lifecycleService;
    private final BatchProvisioningService batchService;
    private final ResourceAlertService alertService;
    private final EnvironmentStatusProducer statusProducer;
    private final BatchResultProducer batchResultProducer;
    private final ResourceAlertProducer alertProducer;
    private final OrchestrationProperties properties;
    private final Clock clock;

    @Async
    public void handleProvisionRequest(EnvironmentRequest request) {
        String identity = request.getIdentity() != null ? request.getIdentity() : request.getUserId();
        try {
            Environment environment = lifecycleService.create(request);
            statusProducer.sendStatus(EnvironmentStatusEvent.of(environment, clock.instant()));

            if (request.isAwaitReady()) {
                log.info("⏳ Waiting for {} to become ready...", identity);
                environment = lifecycleService.awaitRunning(environment.getId(), properties.getProvisioningTimeout());
                statusProducer.sendStatus(EnvironmentStatusEvent.of(environment, clock.instant()));
            }
        } catch (EnvironmentException e) {
            log.error("❌ Provisioning of {} failed [{}]: {}", identity, e.getErrorKind(), e.getMessage(), e);
            statusProducer.sendStatus(EnvironmentStatusEvent.failure(identity, e.getErrorKind(), e.getMessage(),
                    clock.instant()));
        } catch (Exception e) {
            log.error("❌ Unexpected error provisioning {}: {}", identity, e.getMessage(), e);
            statusProducer.sendStatus(EnvironmentStatusEvent.failure(identity, ErrorKind.INTERNAL, e.getMessage(),
                    clock.instant()));
        }
    }

    @Async
    public void handleActionRequest(EnvironmentActionRequest request) {
        String id = request.getEnvironmentId();
        try {
            Environment environment = request.getAction() == EnvironmentAction.DELETE
                    ? lifecycleService.delete(id, request.isForce())
                    : lifecycleService.act(id, request.getAction());
            statusProducer.sendStatus(EnvironmentStatusEvent.of(environment, clock.instant()));
        } catch (EnvironmentException e) {
            log.error("❌ {} on {} failed [{}]: {}", request.getAction(), id, e.getErrorKind(), e.getMessage(), e);
            EnvironmentStatusEvent event = EnvironmentStatusEvent.failure(e.getIdentity(), e.getErrorKind(),
                    e.getMessage(), clock.instant());
            event.setEnvironmentId(id);
            statusProducer.sendStatus(event);
        } catch (Exception e) {
            log.error("❌ Unexpected error handling {} on {}: {}", request.getAction(), id, e.getMessage(), e);
        }
    }

    @Async
    public void handleBatchRequest(BatchJobRequest job) {
        try {
            BatchResult result = batchService.runBatch(job);
            batchResultProducer.sendResult(result);
        } catch (EnvironmentException e) {
            log.error("❌ Batch '{}' rejected [{}]: {}", job.getNamePrefix(), e.getErrorKind(), e.getMessage(), e);
            batchResultProducer.sendResult(BatchResult.rejected(job, e.getErrorKind(), e.getMessage()));
        } catch (Exception e) {
            log.error("❌ Unexpected error running batch '{}': {}", job.getNamePrefix(), e.getMessage(), e);
        }
    }

    @Async
    public void handleExpirySweep(ExpirySweepTrigger trigger) {
        Instant now = trigger.getNow() != null ? trigger.getNow() : clock.instant();
        try {
            ExpirySweepResult result = lifecycleService.expireSweep(now, trigger.isDryRun());
            log.info("Expiry sweep done: {} expired, {} deleted, {} failed", result.getExpiredEnvironmentIds().size(),
                    result.getDeleteInitiated().size(), result.getDeleteFailed().size());
            if (!trigger.isDryRun()) {
                for (String id : result.getDeleteInitiated()) {
                    statusProducer.sendStatus(EnvironmentStatusEvent.of(lifecycleService.get(id), clock.instant()));
                }
            }

            List<ResourceAlert> alerts = alertService.collect(now);
            alerts.forEach(alertProducer::sendAlert);
        } catch (Exception e) {
            log.error("❌ Expiry sweep at {} failed: {}", now, e.getMessage(), e);
        }
    }
}
