package com.changesentinel.pipeline.notify;

import com.changesentinel.core.model.Classification;
import com.changesentinel.core.model.NotificationEvent;
import com.changesentinel.core.model.NotificationKind;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public class MessageFormatter {
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ZoneId zone;

    public MessageFormatter(ZoneId zone) {
        this.zone = zone;
    }

    public String format(NotificationEvent event) {
        if (event.kind() == NotificationKind.NEW_ITEM) {
            return formatItem(event);
        }
        return "Detected update"
                + "\nURL: " + event.link()
                + "\nTime: " + TIME.format(event.timestamp().atZone(zone))
                + "\nSummary: " + event.summary();
    }

    private String formatItem(NotificationEvent event) {
        StringBuilder message = new StringBuilder()
                .append("New item: ").append(event.title())
                .append("\nLink: ").append(event.link());
        if (event.summary() != null && !event.summary().isBlank()) {
            message.append("\nPosted: ").append(event.summary());
        }
        Classification classification = event.classification();
        if (classification != null) {
            if (classification.startDate() != null) {
                message.append("\nStart: ").append(classification.startDate());
            }
            if (classification.endDate() != null) {
                message.append("\nEnd: ").append(classification.endDate());
            }
            if (classification.dateRangeIssue() != null) {
                message.append("\nCheck dates: ").append(classification.dateRangeIssue());
            }
            if (classification.contact() != null) {
                message.append("\nContact: QQ group ").append(classification.contact());
            }
        }
        return message.toString();
    }
}
