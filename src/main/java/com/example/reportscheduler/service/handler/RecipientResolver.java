package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.client.SubscriberDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Final recipient list of a run: the explicit recipients followed by the opted-in subscribers,
 * unless the schedule bypasses opt-in. Order is kept, blanks and duplicates are dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecipientResolver {

    private final SubscriberDirectory subscriberDirectory;

    public List<String> resolve(JobContext context) {
        var seen = new LinkedHashSet<String>();
        var resolved = new ArrayList<String>();

        addAll(context.getRecipients(), seen, resolved);

        if (!context.isBypassOptIn()) {
            var subscribers = subscriberDirectory.optedInRecipients(context.getJobType());
            addAll(subscribers, seen, resolved);
        }

        log.debug("Resolved {} recipient(s) for schedule {}", resolved.size(), context.getScheduleId());
        return resolved;
    }

    private static void addAll(List<String> addresses, Set<String> seen, List<String> resolved) {
        if (addresses == null) {
            return;
        }
        for (var address : addresses) {
            if (address == null || address.isBlank()) {
                continue;
            }
            var trimmed = address.trim();
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                resolved.add(trimmed);
            }
        }
    }
}
