package io.jobs4j.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Cron helpers backed by Quartz {@link CronExpression}.
 * <p>
 * Accepted input:
 * <ul>
 *   <li>Standard five-field cron: {@code "0 2 * * *"} (minute hour day-of-month month day-of-week)</li>
 *   <li>Six-field cron with leading seconds: {@code "30 0 2 * * *"}</li>
 * </ul>
 * <p>
 * Day-of-week numbers use the standard cron convention (0 or 7 = Sunday) and are translated to
 * Quartz numbering (1 = Sunday); the occurrence after {@code #} is kept as is. When both day fields
 * are restricted the expression fires on days matching either of them, as in standard cron. Quartz
 * cannot express that in one expression, so such input becomes two Quartz expressions.
 */
public final class CronSchedules {
    private CronSchedules() {
    }

    /**
     * Translate a five- or six-field cron expression into Quartz syntax.
     *
     * @return one Quartz expression, or two (day-of-month only, day-of-week only) when both day fields are restricted
     * @throws IllegalArgumentException if the expression is blank or has the wrong number of fields
     */
    public static List<String> normalize(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        throw new IllegalArgumentException("Expected 5 or 6 cron fields but got " + parts.length + ": " + spec);
    }

    /**
     * Returns true if the expression can be evaluated.
     */
    public static boolean isValid(String spec) {
        try {
            validate(spec);
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /**
     * @throws IllegalArgumentException describing why the expression cannot be evaluated
     */
    public static void validate(String spec) {
        for (String cron : normalize(spec)) {
            try {
                CronExpression.validateExpression(cron);
            } catch (ParseException ex) {
                throw new IllegalArgumentException(ex.getMessage(), ex);
            }
        }
    }

    /**
     * Computes the first run strictly after {@code after}.
     *
     * @param zone time zone the expression is evaluated in; null means system default
     * @return next run time, or {@code null} if the expression never fires again
     */
    public static Instant nextRunAfter(String spec, ZoneId zone, Instant after) {
        Objects.requireNonNull(after, "after must not be null");
        TimeZone timeZone = TimeZone.getTimeZone(zone != null ? zone : ZoneId.systemDefault());

        Instant earliest = null;
        for (String cron : normalize(spec)) {
            CronExpression exp;
            try {
                exp = new CronExpression(cron);
            } catch (ParseException ex) {
                throw new IllegalArgumentException("Invalid cron expression: " + spec, ex);
            }
            exp.setTimeZone(timeZone);

            Date next = exp.getNextValidTimeAfter(Date.from(after));
            if (next != null && (earliest == null || next.toInstant().isBefore(earliest))) {
                earliest = next.toInstant();
            }
        }
        return earliest;
    }

    private static List<String> toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dow = toQuartzDayOfWeek(dayOfWeek);
        boolean anyDow = "*".equals(dow) || "?".equals(dow);
        boolean anyDom = "*".equals(dayOfMonth) || "?".equals(dayOfMonth);

        // Quartz requires '?' in exactly one of the two day fields.
        if (anyDow) {
            return List.of(String.join(" ", sec, min, hour, dayOfMonth, month, "?"));
        }
        if (anyDom) {
            return List.of(String.join(" ", sec, min, hour, "?", month, dow));
        }
        return List.of(
                String.join(" ", sec, min, hour, dayOfMonth, month, "?"),
                String.join(" ", sec, min, hour, "?", month, dow)
        );
    }

    private static String toQuartzDayOfWeek(String field) {
        if ("*".equals(field) || "?".equals(field)) {
            return field;
        }
        StringBuilder out = new StringBuilder();
        for (String part : field.split(",")) {
            if (out.length() > 0) {
                out.append(',');
            }
            int slash = part.indexOf('/');
            int hash = part.indexOf('#');
            int cut = slash >= 0 ? slash : hash;
            String base = cut >= 0 ? part.substring(0, cut) : part;
            String suffix = cut >= 0 ? part.substring(cut) : "";
            out.append(shiftDayNumbers(base)).append(suffix);
        }
        return out.toString();
    }
    // 0..7 (0 and 7 = Sunday) -> 1..7 (1 = Sunday)
    private static String shiftDayNumbers(String base) {
        if ("*".equals(base)) {
            return base;
        }
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < base.length()) {
            char c = base.charAt(i);
            if (Character.isDigit(c)) {
                int start = i;
                while (i < base.length() && Character.isDigit(base.charAt(i))) {
                    i++;
                }
                int day = Integer.parseInt(base.substring(start, i));
                if (day > 7) {
                    throw new IllegalArgumentException("Day-of-week out of range: " + day);
                }
                out.append((day % 7) + 1);
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
}
