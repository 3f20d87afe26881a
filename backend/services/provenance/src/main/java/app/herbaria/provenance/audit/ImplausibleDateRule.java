package app.herbaria.provenance.audit;

import app.herbaria.provenance.config.QualityProps;
import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.type.DwcTerm;
import app.herbaria.provenance.domain.type.FlagKind;
import app.herbaria.provenance.domain.type.FlagSeverity;
import app.herbaria.provenance.exception.ConfigurationException;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date fields must parse, and every year they mention must fall inside the configured range.
 *
 * <p>Accepts ISO 8601 dates of year, month or day precision, date-times with or without an offset,
 * ISO intervals ({@code 1987-06/1987-07}, shortened {@code 1987-06-12/15}), and the usual label
 * spellings such as {@code 12 Jun 1987}, {@code June 12, 1987}, {@code 12.6.1987}.
 */
@Component
public class ImplausibleDateRule implements QualityRule {

    private static final Pattern ISO = Pattern.compile("^(\\d{4})(?:-(\\d{1,2})(?:-(\\d{1,2}))?)?$");

    private static final List<DateTimeFormatter> LABEL_FORMATS = List.of(
            formatter("d MMM uuuu"),
            formatter("d MMMM uuuu"),
            formatter("d-MMM-uuuu"),
            formatter("MMM d, uuuu"),
            formatter("MMMM d, uuuu"),
            formatter("MMM uuuu"),
            formatter("MMMM uuuu"),
            formatter("d.M.uuuu"),
            formatter("M/d/uuuu")
    );

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME
    );

    private final List<DwcTerm> dateFields;
    private final int minYear;
    private final int maxYear;

    public ImplausibleDateRule(QualityProps props) {
        List<DwcTerm> terms = new ArrayList<>();
        for (String name : props.dateFields()) {
            terms.add(DwcTerm.fromName(name)
                    .orElseThrow(() -> new ConfigurationException("Unknown date field: " + name)));
        }
        this.dateFields = List.copyOf(terms);
        this.minYear = props.minYear();
        this.maxYear = props.resolvedMaxYear();
        if (minYear > maxYear) {
            throw new ConfigurationException("minYear " + minYear + " is after maxYear " + maxYear);
        }
    }

    @Override
    public FlagKind kind() {
        return FlagKind.implausible_date;
    }

    @Override
    public List<QualityFlag> evaluate(AggregatedRecord record, AuditContext context) {
        List<QualityFlag> flags = new ArrayList<>();
        for (DwcTerm term : dateFields) {
            Optional<String> value = record.value(term).map(String::trim).filter(v -> !v.isEmpty());
            if (value.isEmpty()) {
                continue;
            }
            List<Integer> years = years(value.get());
            if (years.isEmpty()) {
                flags.add(flag(record, term, term.name() + " '" + value.get() + "' is not a recognizable date"));
                continue;
            }
            for (int year : years) {
                if (year < minYear || year > maxYear) {
                    flags.add(flag(record, term, term.name() + " '" + value.get() + "' has year " + year
                            + " outside " + minYear + "-" + maxYear));
                    break;
                }
            }
        }
        return flags;
    }

    /**
     * Years mentioned by a date or interval, empty when the text is not a date.
     */
    static List<Integer> years(String text) {
        String[] parts = text.split("/");
        if (parts.length == 2) {
            String startText = parts[0].trim();
            String endText = parts[1].trim();
            Integer start = isoDateYear(startText);
            Integer end = isoDateYear(endText);
            if (start != null && end == null) {
                end = isoDateYear(completeIntervalEnd(startText, endText));
            }
            if (start != null && end != null) {
                return start <= end ? List.of(start, end) : List.of();
            }
        }
        Integer iso = isoDateYear(text);
        if (iso != null) {
            return List.of(iso);
        }
        for (DateTimeFormatter format : LABEL_FORMATS) {
            try {
                TemporalAccessor parsed = format.parse(text);
                return List.of(parsed.get(ChronoField.YEAR));
            } catch (DateTimeException ignored) {
                // next format
            }
        }
        return List.of();
    }

    private static Integer isoDateYear(String text) {
        Integer year = isoYear(text);
        if (year != null || text.indexOf('T') < 0) {
            return year;
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return format.parse(text).get(ChronoField.YEAR);
            } catch (DateTimeException ignored) {
                // next format
            }
        }
        return null;
    }

    // ISO 8601 lets an interval end omit leading components: 1987-06-12/15, 1987-06-12/07-03.
    private static String completeIntervalEnd(String start, String end) {
        int t = start.indexOf('T');
        String[] startParts = (t >= 0 ? start.substring(0, t) : start).split("-");
        String[] endParts = end.split("-");
        if (endParts.length >= startParts.length || end.indexOf('T') >= 0) {
            return end;
        }
        List<String> merged = new ArrayList<>(List.of(startParts).subList(0, startParts.length - endParts.length));
        merged.addAll(List.of(endParts));
        return String.join("-", merged);
    }

    private static Integer isoYear(String text) {
        Matcher m = ISO.matcher(text);
        if (!m.matches()) {
            return null;
        }
        int year = Integer.parseInt(m.group(1));
        try {
            if (m.group(3) != null) {
                LocalDate.of(year, Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
            } else if (m.group(2) != null) {
                ChronoField.MONTH_OF_YEAR.checkValidValue(Integer.parseInt(m.group(2)));
            }
        } catch (DateTimeException e) {
            return null;
        }
        return year;
    }

    private QualityFlag flag(AggregatedRecord record, DwcTerm term, String detail) {
        return QualityFlag.of(record.specimenIdentity(), kind(), term.name(), FlagSeverity.medium, detail);
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
