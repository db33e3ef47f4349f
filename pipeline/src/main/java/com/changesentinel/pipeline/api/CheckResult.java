package com.changesentinel.pipeline.api;

import com.changesentinel.core.model.CheckOutcome;
import com.changesentinel.core.model.NotificationEvent;
import com.changesentinel.pipeline.notify.DeliveryResult;

import java.util.List;

public record CheckResult(
        String taskId,
        CheckOutcome outcome,
        List<NotificationEvent> events,
        List<DeliveryResult> deliveries,
        boolean committed,
        String error
) {
    public CheckResult {
        events = List.copyOf(events);
        deliveries = List.copyOf(deliveries);
    }

    public static CheckResult skipped(String taskId, String reason) {
        return new CheckResult(taskId, CheckOutcome.SKIPPED, List.of(), List.of(), true, reason);
    }

    public static CheckResult failed(String taskId, String error, boolean committed) {
        return new CheckResult(taskId, CheckOutcome.FAILED, List.of(), List.of(), committed, error);
    }

    public boolean allDelivered() {
        return deliveries.stream().allMatch(DeliveryResult::ok);
    }
}
