package com.chemfetch.sds.extraction.field;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <h2>DateNormalizer</h2>
 *
 * <p>Reads issue dates out of SDS text and turns them into ISO
 * {@code yyyy-MM-dd}. Numeric dates are read day-first; month-first is only
 * tried when the day-first reading is impossible. Dates in the future are
 * ignored.</p>
 *
 * <p>Label preference, strongest first:</p>
 * <ol>
 *   <li>issue, revision, version, preparation or creation date,</li>
 *   <li>other dated labels ({@code MSDS date}, {@code Date}),</li>
 *   <li>print dates, "last updated" and "revised" notes (month-year forms
 *       read as the first of the month) and unlabeled dates in the first
 *       lines of the document.</li>
 * </ol>
 */
@Slf4j
@Component
public class DateNormalizer {

    static final String DATE_VALUE = "(\\d{4}-\\d{1,2}-\\d{1,2}"
            + "|\\d{1,2}[/.\\-]\\d{1,2}[/.\\-]\\d{2,4}"
            + "|\\d{1,2}(?:st|nd|rd|th)?[\\s\\-.]+[A-Za-z]{3,9}\\.?[\\s\\-.,]+\\d{2,4}"
            + "|[A-Za-z]{3,9}\\.?\\s+\\d{1,2}(?:st|nd|rd|th)?,?\\s+\\d{4})";

    private static final Pattern LABELED = Pattern.compile(
            "\\b(revision\\s+date|date\\s+of\\s+(?:last\\s+)?(?:issue|revision|preparation)|issue\\s+date|issued\\s+on"
                    + "|date\\s+issued|version\\s+date|sds\\s+creation\\s+date|creation\\s+date|date\\s+prepared"
                    + "|prepared\\s+on|last\\s+(?:updated|revised)|revised(?:\\s+on)?|rev(?:ision)?\\.?|issued|msds\\s+date"
                    + "|sds\\s+date|effective\\s+date|print(?:ed)?\\s+(?:date|on)|date\\s+printed|date)"
                    + "\\b[^\\n\\d]{0,40}?" + DATE_VALUE,
            Pattern.CASE_INSENSITIVE);

    private static final Pattern MONTH_YEAR = Pattern.compile(
            "\\b(?:last\\s+updated|updated|last\\s+revised|revised)\\s*(?:on)?\\s*[:\\-]?\\s*([A-Za-z]{3,9}\\.?\\s+\\d{4})\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BARE_DATE = Pattern.compile("(?<![\\d/.\\-])" + DATE_VALUE + "(?![\\d/.\\-])");

    private static final Pattern STRONG_LABEL = Pattern.compile(
            "issue|issued|prepar|creation|revision|rev\\b|rev\\.|version", Pattern.CASE_INSENSITIVE);

    /** "Last updated" style notes only count when nothing better is printed. */
    private static final Pattern FALLBACK_LABEL = Pattern.compile("print|updated|revised", Pattern.CASE_INSENSITIVE);

    private static final int HEADER_LINES = 20;

    private static final int EARLIEST_YEAR = 1980;

    private static final List<DateTimeFormatter> DAY_FIRST = List.of(
            fmt("d/M/uuuu"), fmt("d-M-uuuu"), fmt("d.M.uuuu"), shortYear("d/M/"), shortYear("d-M-"),
            shortYear("d.M."), fmt("uuuu-M-d"), fmt("uuuu/M/d"),
            fmt("d MMM uuuu"), fmt("d MMMM uuuu"), fmt("d-MMM-uuuu"), fmt("d-MMMM-uuuu"), fmt("d.MMM.uuuu"),
            shortYear("d-MMM-"), shortYear("d MMM "),
            fmt("MMM d uuuu"), fmt("MMMM d uuuu"));

    private static final List<DateTimeFormatter> MONTH_FIRST = List.of(
            fmt("M/d/uuuu"), fmt("M-d-uuuu"), shortYear("M/d/"));

    private static final List<DateTimeFormatter> MONTH_YEAR_FORMATS = List.of(fmt("MMMM uuuu"), fmt("MMM uuuu"));

    private final Clock clock;

    public DateNormalizer(final Clock clock) {
        this.clock = clock;
    }

    /**
     * @param raw date as printed
     * @return the parsed date, empty when unreadable
     */
    public Optional<LocalDate> parse(final String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String s = raw.strip();
        if (s.length() > 10 && s.matches("^\\d{4}-\\d{2}-\\d{2}[T ].*")) {
            s = s.substring(0, 10);
        }
        s = s.replaceAll("(?i)(\\d)(st|nd|rd|th)\\b", "$1")
                .replaceAll("(?i)\\bsept\\b", "Sep")
                .replaceAll("([A-Za-z]{3,9})\\.(?=\\s)", "$1")
                .replace(",", " ")
                .replaceAll("\\s+", " ")
                .strip();
        Optional<LocalDate> parsed = tryAll(DAY_FIRST, s);
        return parsed.isPresent() ? parsed : tryAll(MONTH_FIRST, s);
    }

    /**
     * Accepts {@code DD/MM/YYYY}, {@code D/M/YY} (read as 20YY) and ISO forms.
     *
     * @param raw date as received
     * @return ISO {@code yyyy-MM-dd}, empty when unreadable
     */
    public Optional<String> toIso(final String raw) {
        return parse(raw).map(DateTimeFormatter.ISO_LOCAL_DATE::format);
    }

    /**
     * @param text normalised SDS text
     * @return the most credible issue date as ISO text
     */
    public Optional<FieldResult> extractIssueDate(final String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        LocalDate today = LocalDate.now(clock);
        List<Candidate> candidates = new ArrayList<>();

        Matcher m = LABELED.matcher(text);
        while (m.find()) {
            Optional<LocalDate> date = parse(m.group(2)).filter(d -> plausible(d, today));
            if (date.isPresent()) {
                candidates.add(new Candidate(date.get(), rank(m.group(1)), m.start()));
            } else {
                log.trace("Ignoring date '{}' after '{}'", m.group(2), m.group(1));
            }
        }

        Matcher bare = BARE_DATE.matcher(SectionLocator.head(text, HEADER_LINES));
        while (bare.find()) {
            int at = bare.start();
            parse(bare.group(1)).filter(d -> plausible(d, today))
                    .ifPresent(d -> candidates.add(new Candidate(d, 2, at)));
        }

        Matcher monthYear = MONTH_YEAR.matcher(text);
        while (monthYear.find()) {
            int at = monthYear.start();
            parseMonthYear(monthYear.group(1)).filter(d -> plausible(d, today))
                    .ifPresent(d -> candidates.add(new Candidate(d, 2, at)));
        }

        return candidates.stream()
                .min(Comparator.comparingInt(Candidate::rank).thenComparingInt(Candidate::offset))
                .map(c -> FieldResult.of(DateTimeFormatter.ISO_LOCAL_DATE.format(c.date()), confidence(c.rank())));
    }

    /**
     * @param raw text such as {@code "August 2021"}
     * @return the first day of that month
     */
    public Optional<LocalDate> parseMonthYear(final String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String s = raw.strip().replaceAll("(?i)\\bsept\\b", "Sep").replaceAll("\\.", "");
        for (DateTimeFormatter f : MONTH_YEAR_FORMATS) {
            try {
                return Optional.of(YearMonth.parse(s, f).atDay(1));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }

    /* ------------------------------------------------------------------ */

    private record Candidate(LocalDate date, int rank, int offset) {
    }

    private static int rank(final String label) {
        if (FALLBACK_LABEL.matcher(label).find()) {
            return 2;
        }
        return STRONG_LABEL.matcher(label).find() ? 0 : 1;
    }

    private static double confidence(final int rank) {
        return switch (rank) {
            case 0 -> FieldResult.SAME_LINE;
            case 1 -> FieldResult.NEXT_LINE;
            default -> FieldResult.POSITIONAL;
        };
    }

    private static boolean plausible(final LocalDate date, final LocalDate today) {
        return !date.isAfter(today) && date.getYear() >= EARLIEST_YEAR;
    }

    private static Optional<LocalDate> tryAll(final List<DateTimeFormatter> formats, final String s) {
        for (DateTimeFormatter f : formats) {
            try {
                return Optional.of(LocalDate.parse(s, f));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter fmt(final String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    /** Two-digit years are read as 20YY. */
    private static DateTimeFormatter shortYear(final String prefix) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(prefix)
                .appendValueReduced(ChronoField.YEAR, 2, 2, 2000)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
