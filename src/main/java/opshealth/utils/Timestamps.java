package opshealth.utils;

import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * ISO-8601时间戳解析与格式化
 * <p>
 * 带偏移量的时间统一换算为UTC，不带偏移量的时间按UTC处理。
 */
public final class Timestamps {

    private Timestamps() {
    }

    /**
     * 解析时间戳，无法解析时返回空
     */
    public static Optional<Instant> parse(String value) {
        if (StringUtils.isBlank(value)) {
            return Optional.empty();
        }
        String text = value.trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + "T" + text.substring(11);
        }

        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return parseDate(text);
        }
    }

    private static Optional<Instant> parseDate(String text) {
        try {
            return Optional.of(LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * 格式化为以Z结尾的UTC时间戳
     */
    public static String format(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MICROS).toString();
    }

    public static LocalDate utcDate(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }
}
