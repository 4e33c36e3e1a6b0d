package io.stockingest.market;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Once-a-day trigger time in UTC, written as the cron subset {@code M H * * *}.
 */
public record DailySchedule(int minute, int hour) {
    public DailySchedule {
        if (minute < 0 || minute > 59) throw new IllegalArgumentException("minute out of range: " + minute);
        if (hour < 0 || hour > 23) throw new IllegalArgumentException("hour out of range: " + hour);
    }

    public static DailySchedule parse(String cron) {
        if (cron == null) throw new IllegalArgumentException("cron expression is required");
        String[] f = cron.trim().split("\\s+");
        if (f.length != 5 || !f[2].equals("*") || !f[3].equals("*") || !f[4].equals("*")) {
            throw new IllegalArgumentException("Only daily cron expressions 'M H * * *' are supported: " + cron);
        }
        try {
            return new DailySchedule(Integer.parseInt(f[0]), Integer.parseInt(f[1]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Minute and hour must be numbers: " + cron, e);
        }
    }

    /** First trigger strictly after {@code now}. */
    public Instant nextAfter(Instant now) {
        ZonedDateTime t = now.atZone(ZoneOffset.UTC);
        ZonedDateTime candidate = t.withHour(hour).withMinute(minute).withSecond(0).withNano(0);
        if (!candidate.isAfter(t)) candidate = candidate.plusDays(1);
        return candidate.toInstant();
    }

    public Duration untilNext(Clock clock) {
        Instant now = clock.instant();
        return Duration.between(now, nextAfter(now));
    }
}
