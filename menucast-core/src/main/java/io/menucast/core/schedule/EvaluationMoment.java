package io.menucast.core.schedule;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * The instant a scheduling tick evaluates, broken down in the scheduler's zone.
 *
 * @param weekday 0 for Monday through 6 for Sunday
 */
public record EvaluationMoment(LocalDate today, String timeOfDay, int weekday, int dayOfMonth, ZoneId zone) {
    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("HH:mm");

    public EvaluationMoment {
        Objects.requireNonNull(today, "today must not be null");
        Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
    }

    public static EvaluationMoment at(Clock clock, ZoneId zone) {
        return of(LocalDateTime.ofInstant(clock.instant(), zone), zone);
    }

    public static EvaluationMoment of(LocalDateTime local, ZoneId zone) {
        LocalDate date = local.toLocalDate();
        return new EvaluationMoment(
            date,
            local.format(TIME_OF_DAY),
            date.getDayOfWeek().getValue() - 1,
            date.getDayOfMonth(),
            zone
        );
    }
}
