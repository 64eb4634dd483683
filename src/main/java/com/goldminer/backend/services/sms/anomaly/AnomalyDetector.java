package com.goldminer.backend.services.sms.anomaly;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.goldminer.backend.config.AnomalyProperties;
import com.goldminer.backend.dto.sms.HistoryEntry;
import com.goldminer.backend.enums.AnomalyFlag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Flags a transaction against its prior history with three independent rules:
 * <ul>
 *   <li>{@code high_value}: amount above the configured percentile of historical amounts,
 *       only once at least {@code minHistory} amounts are known;</li>
 *   <li>{@code burst_frequency}: the same payee at least {@code burstCount} times inside the
 *       trailing window, the current transaction included;</li>
 *   <li>{@code unknown_merchant}: payee absent from the most recent {@code unknownMerchantWindow}
 *       history entries.</li>
 * </ul>
 * History never includes the transaction itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyDetector {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("uuuu/MM/dd").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT));

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AnomalyProperties props;

    public Set<AnomalyFlag> detect(AnomalyCandidate candidate, List<HistoryEntry> history) {
        List<HistoryEntry> prior = history == null ? List.of() : history;
        Set<AnomalyFlag> flags = EnumSet.noneOf(AnomalyFlag.class);

        if (isEnabled(AnomalyFlag.HIGH_VALUE) && isHighValue(candidate, prior)) {
            flags.add(AnomalyFlag.HIGH_VALUE);
        }
        if (isEnabled(AnomalyFlag.BURST_FREQUENCY) && isBurst(candidate, prior)) {
            flags.add(AnomalyFlag.BURST_FREQUENCY);
        }
        if (isEnabled(AnomalyFlag.UNKNOWN_MERCHANT) && isUnknownMerchant(candidate, prior)) {
            flags.add(AnomalyFlag.UNKNOWN_MERCHANT);
        }
        return Collections.unmodifiableSet(flags);
    }

    /**
     * Evaluates a chronologically ordered batch; each item's history is the items before it.
     */
    public List<Set<AnomalyFlag>> detectBatch(List<AnomalyCandidate> candidates) {
        List<Set<AnomalyFlag>> results = new ArrayList<>(candidates.size());
        List<HistoryEntry> history = new ArrayList<>();
        for (AnomalyCandidate candidate : candidates) {
            results.add(detect(candidate, List.copyOf(history)));
            history.add(candidate.toHistoryEntry());
        }
        return results;
    }

    public AnomalyReport report(List<Set<AnomalyFlag>> flagsByIndex) {
        Map<AnomalyFlag, Long> counts = new EnumMap<>(AnomalyFlag.class);
        for (AnomalyFlag flag : AnomalyFlag.values()) {
            counts.put(flag, 0L);
        }
        int anomalous = 0;
        for (Set<AnomalyFlag> flags : flagsByIndex) {
            if (!flags.isEmpty()) {
                anomalous++;
            }
            flags.forEach(flag -> counts.merge(flag, 1L, Long::sum));
        }
        double rate = flagsByIndex.isEmpty() ? 0.0 : (double) anomalous / flagsByIndex.size();
        return new AnomalyReport(flagsByIndex.size(), anomalous, rate, counts, flagsByIndex);
    }

    private boolean isEnabled(AnomalyFlag flag) {
        return props.enabledRules().contains(flag);
    }

    private boolean isHighValue(AnomalyCandidate candidate, List<HistoryEntry> history) {
        if (candidate.amount() == null) {
            return false;
        }
        List<BigDecimal> amounts = new ArrayList<>();
        for (HistoryEntry entry : history) {
            if (entry.amount() != null) {
                amounts.add(entry.amount());
            }
        }
        if (amounts.size() < props.minHistory()) {
            return false;
        }
        BigDecimal threshold = percentile(amounts, props.highValuePercentile());
        return candidate.amount().compareTo(threshold) > 0;
    }

    private boolean isBurst(AnomalyCandidate candidate, List<HistoryEntry> history) {
        String payee = normalizePayee(candidate.payee());
        if (payee.isEmpty() || candidate.occurredAt() == null) {
            return false;
        }
        LocalDateTime windowStart = candidate.occurredAt().minus(props.burstWindow());
        int count = 1;
        for (HistoryEntry entry : history) {
            if (!payee.equals(normalizePayee(entry.payee()))) {
                continue;
            }
            Optional<LocalDateTime> at = parseTimestamp(entry.timestamp());
            if (at.isEmpty()) {
                log.warn("Skipping history entry with unparseable timestamp '{}' for burst detection", entry.timestamp());
                continue;
            }
            if (!at.get().isBefore(windowStart) && !at.get().isAfter(candidate.occurredAt())) {
                count++;
            }
        }
        return count >= props.burstCount();
    }

    private boolean isUnknownMerchant(AnomalyCandidate candidate, List<HistoryEntry> history) {
        String payee = normalizePayee(candidate.payee());
        if (payee.isEmpty()) {
            return false;
        }
        int from = Math.max(0, history.size() - props.unknownMerchantWindow());
        for (HistoryEntry entry : history.subList(from, history.size())) {
            if (payee.equals(normalizePayee(entry.payee()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Linear interpolation between closest ranks.
     */
    static BigDecimal percentile(List<BigDecimal> values, double percentile) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("percentile of an empty list");
        }
        List<BigDecimal> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        BigDecimal position = BigDecimal.valueOf(percentile)
                .multiply(BigDecimal.valueOf(sorted.size() - 1L))
                .divide(HUNDRED, MathContext.DECIMAL64);
        int lower = position.setScale(0, RoundingMode.FLOOR).intValue();
        BigDecimal fraction = position.subtract(BigDecimal.valueOf(lower));
        BigDecimal low = sorted.get(lower);
        if (fraction.signum() == 0) {
            return low;
        }
        return low.add(sorted.get(lower + 1).subtract(low).multiply(fraction, MathContext.DECIMAL64));
    }

    static String normalizePayee(String payee) {
        if (payee == null) {
            return "";
        }
        return payee.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    static Optional<LocalDateTime> parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            LocalDateTime parsed = parseDateTime(text, format);
            if (parsed != null) {
                return Optional.of(parsed);
            }
        }
        LocalDateTime withOffset = parseDateTime(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        if (withOffset != null) {
            return Optional.of(withOffset);
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate parsed = parseDate(text, format);
            if (parsed != null) {
                return Optional.of(parsed.atStartOfDay());
            }
        }
        return Optional.empty();
    }

    private static LocalDateTime parseDateTime(String text, DateTimeFormatter format) {
        try {
            return LocalDateTime.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDate parseDate(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
