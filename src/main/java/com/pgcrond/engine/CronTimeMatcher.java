package com.pgcrond.engine;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TimeMatcher for classic five-field Unix cron timespecs, backed by cron-utils.
 *
 * <p>Parsed expressions are cached by their text because the job table is reparsed
 * every minute but rarely changes.</p>
 */
public class CronTimeMatcher implements TimeMatcher {
    private static final int MAX_CACHED = 1024;

    private final CronParser parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private final Map<String, ExecutionTime> cache = new ConcurrentHashMap<>();

    @Override
    public boolean matches(String timespec, ZonedDateTime minute) throws InvalidTimespecException {
        return executionTime(timespec).isMatch(minute.truncatedTo(ChronoUnit.MINUTES));
    }

    private ExecutionTime executionTime(String timespec) throws InvalidTimespecException {
        ExecutionTime cached = cache.get(timespec);
        if (cached != null) {
            return cached;
        }
        ExecutionTime executionTime;
        try {
            Cron cron = parser.parse(timespec);
            cron.validate();
            executionTime = ExecutionTime.forCron(cron);
        } catch (IllegalArgumentException e) {
            throw new InvalidTimespecException(timespec, e);
        }
        if (cache.size() >= MAX_CACHED) {
            cache.clear();
        }
        cache.put(timespec, executionTime);
        return executionTime;
    }
}
