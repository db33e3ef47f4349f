package com.changesentinel.pipeline.notify;

import com.changesentinel.core.bus.EventBus;
import com.changesentinel.core.events.NotificationFailed;
import com.changesentinel.core.events.NotificationSent;
import com.changesentinel.core.model.NotificationEvent;

import java.time.Clock;
import java.util.logging.Logger;

public class Notifier {
    private static final Logger LOGGER = Logger.getLogger(Notifier.class.getName());

    private final NotificationTransport transport;
    private final MessageFormatter formatter;
    private final EventBus eventBus;
    private final Clock clock;

    public Notifier(NotificationTransport transport, MessageFormatter formatter, EventBus eventBus, Clock clock) {
        this.transport = transport;
        this.formatter = formatter;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public DeliveryResult notify(NotificationEvent event, String destination) {
        String message = formatter.format(event);
        try {
            transport.deliver(destination, message);
        } catch (RuntimeException ex) {
            String reason = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            LOGGER.warning("Delivery to " + destination + " failed for task " + event.taskId() + ": " + reason);
            eventBus.publish(new NotificationFailed(clock.instant(), event.taskId(), destination, reason));
            return DeliveryResult.failed(reason);
        }
        eventBus.publish(new NotificationSent(clock.instant(), event.taskId(), destination, event.kind()));
        return DeliveryResult.delivered();
    }
}
