package com.rxgate.fulfillmentservice.notification;

import com.rxgate.common.contracts.PrescriptionDecisionContract;
import com.rxgate.fulfillmentservice.config.FulfillmentProperties;
import com.rxgate.fulfillmentservice.config.NotificationExecutorConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends one notification per order concurrently. Each send fails on its own;
 * the caller gets the failures back instead of an exception.
 */
@Component
@Slf4j
public class NotificationFanout {

    private final NotificationDispatcher dispatcher;
    private final TaskExecutor executor;
    private final FulfillmentProperties properties;

    public NotificationFanout(NotificationDispatcher dispatcher,
                              @Qualifier(NotificationExecutorConfig.NOTIFICATION_EXECUTOR) TaskExecutor executor,
                              FulfillmentProperties properties) {
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.properties = properties;
    }

    public List<NotificationFailure> dispatchAll(List<PrescriptionDecisionContract> contracts) {
        if (contracts.isEmpty()) {
            return List.of();
        }

        List<CompletableFuture<NotificationFailure>> futures = new ArrayList<>(contracts.size());
        for (PrescriptionDecisionContract contract : contracts) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> send(contract), executor));
            } catch (RejectedExecutionException e) {
                log.error("Notification executor rejected task: orderId={}", contract.getOrderId());
                futures.add(CompletableFuture.completedFuture(
                        new NotificationFailure(contract.getOrderId(), "Notification executor saturated")));
            }
        }

        long timeoutMillis = properties.getNotification().getAwaitTimeout().toMillis();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Notification batch did not finish within {}ms, reporting pending sends as failed",
                    timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for notification batch");
        } catch (Exception e) {
            // send() never completes exceptionally
            log.error("Notification batch failed: {}", e.getMessage(), e);
        }

        List<NotificationFailure> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            CompletableFuture<NotificationFailure> future = futures.get(i);
            Long orderId = contracts.get(i).getOrderId();
            if (!future.isDone()) {
                failures.add(new NotificationFailure(orderId, "Timed out waiting for notification"));
                continue;
            }
            try {
                NotificationFailure failure = future.join();
                if (failure != null) {
                    failures.add(failure);
                }
            } catch (CompletionException e) {
                log.error("Notification task failed to run: orderId={}", orderId, e);
                failures.add(new NotificationFailure(orderId, e.getMessage()));
            }
        }
        return failures;
    }

    private NotificationFailure send(PrescriptionDecisionContract contract) {
        try {
            dispatcher.notify(contract);
            return null;
        } catch (Exception e) {
            log.error("Notification failed: prescriptionId={}, orderId={}, error={}",
                    contract.getPrescriptionId(), contract.getOrderId(), e.getMessage(), e);
            return new NotificationFailure(contract.getOrderId(), e.getMessage());
        }
    }
}
