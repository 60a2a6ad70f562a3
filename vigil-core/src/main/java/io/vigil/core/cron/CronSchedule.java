package io.vigil.core.cron;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.time.ZoneId;
import java.util.Objects;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = CronSchedule.At.class, name = "at"),
    @JsonSubTypes.Type(value = CronSchedule.Every.class, name = "every"),
    @JsonSubTypes.Type(value = CronSchedule.Cron.class, name = "cron")
})
public sealed interface CronSchedule permits CronSchedule.At, CronSchedule.Every, CronSchedule.Cron {

    Long nextRunAfter(long afterMs, ZoneId zone);

    default boolean oneShot() {
        return false;
    }

    record At(String at) implements CronSchedule {
        public At {
            Objects.requireNonNull(at, "at must not be null");
        }

        @Override
        public Long nextRunAfter(long afterMs, ZoneId zone) {
            Long target = Schedules.parseTimestamp(at, zone);
            return target != null && target > afterMs ? target : null;
        }

        @Override
        public boolean oneShot() {
            return true;
        }
    }

    record Every(String every) implements CronSchedule {
        public Every {
            Objects.requireNonNull(every, "every must not be null");
        }

        @Override
        public Long nextRunAfter(long afterMs, ZoneId zone) {
            Long interval = Schedules.parseDurationMs(every);
            if (interval == null) {
                return null;
            }
            try {
                return Math.addExact(afterMs, interval);
            } catch (ArithmeticException e) {
                return null;
            }
        }
    }

    record Cron(String cron) implements CronSchedule {
        public Cron {
            Objects.requireNonNull(cron, "cron must not be null");
        }

        @Override
        public Long nextRunAfter(long afterMs, ZoneId zone) {
            return CronExpression.parse(cron)
                .map(expression -> expression.nextFireAfter(afterMs, zone))
                .orElse(null);
        }
    }
}
