package com.changesentinel.pipeline.notify;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class NoticeDetails {
    static final String FROM_TODAY = "即日起";

    private static final List<Pattern> CONTACT_GROUP = List.of(
            Pattern.compile("QQ群号?[：: ]?(\\d{5,12})", Pattern.CASE_INSENSITIVE),
            Pattern.compile("QQ[：: ]?(\\d{5,12})", Pattern.CASE_INSENSITIVE),
            Pattern.compile("群号[：: ]?(\\d{5,12})")
    );
    private static final List<Pattern> DATES = List.of(
            Pattern.compile("(\\d{4})年(\\d{1,2})月(\\d{1,2})日"),
            Pattern.compile("(\\d{4})[./-](\\d{1,2})[./-](\\d{1,2})")
    );

    private NoticeDetails() {
    }

    static Optional<String> contactGroup(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (Pattern pattern : CONTACT_GROUP) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    static Optional<LocalDate> parseDate(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (Pattern pattern : DATES) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                try {
                    return Optional.of(LocalDate.of(
                            Integer.parseInt(matcher.group(1)),
                            Integer.parseInt(matcher.group(2)),
                            Integer.parseInt(matcher.group(3))));
                } catch (DateTimeException e) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }
}
