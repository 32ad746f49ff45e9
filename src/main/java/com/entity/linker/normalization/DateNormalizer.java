package com.entity.linker.normalization;

import com.entity.linker.core.model.DatePrecision;
import com.entity.linker.core.model.PartialDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses raw date strings into {@link PartialDate}s.
 *
 * <p>Accepted forms: {@code YYYY}, {@code YYYY-MM}, {@code YYYY-MM-DD} and ISO timestamps
 * such as {@code 1897-06-05T00:00:00Z}. A zero month or day means "unknown", as in
 * {@code 1743-00-00T00:00:00Z}. Unparseable input yields an empty result.</p>
 */
public class DateNormalizer {
    private static final Logger log = LoggerFactory.getLogger(DateNormalizer.class);

    private static final Pattern DATE = Pattern.compile(
            "^\\+?(-?\\d{1,4})(?:-(\\d{1,2})(?:-(\\d{1,2}))?)?(?:T[0-9:.]*(?:Z|[+-]\\d{2}:?\\d{2})?)?$");

    public Optional<PartialDate> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = DATE.matcher(raw.strip());
        if (!matcher.matches()) {
            log.debug("date.unparseable value='{}'", raw);
            return Optional.empty();
        }

        int year = Integer.parseInt(matcher.group(1));
        Integer month = positiveOrNull(matcher.group(2));
        Integer day = month != null ? positiveOrNull(matcher.group(3)) : null;
        try {
            return Optional.of(new PartialDate(year, month, day));
        } catch (IllegalArgumentException e) {
            log.debug("date.invalid value='{}' reason={}", raw, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses the value and drops components finer than the given precision,
     * for sources that store a full timestamp next to a separate precision.
     */
    public Optional<PartialDate> parse(String raw, DatePrecision precision) {
        return parse(raw).map(date -> date.truncate(precision));
    }

    private static Integer positiveOrNull(String group) {
        if (group == null) {
            return null;
        }
        int value = Integer.parseInt(group);
        return value > 0 ? value : null;
    }
}
