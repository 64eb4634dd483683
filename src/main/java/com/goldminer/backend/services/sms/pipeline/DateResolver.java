package com.goldminer.backend.services.sms.pipeline;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.goldminer.backend.dto.sms.RawMessage;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the calendar date of a transaction.
 *
 * <p>The date captured from the message wins. Day-first formats are tried before month-first
 * ones. A day/month date without a year takes the year of the file creation time, else of
 * the ingestion time. Without a usable captured date the source timestamp is used, then the
 * file creation time.
 */
@Component
@Slf4j
public class DateResolver {

    private static final List<DateTimeFormatter> FORMATS = List.of(
            DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu-M-d").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d-M-uuuu").withResolverStyle(ResolverStyle.STRICT));

    private static final Pattern DAY_MONTH = Pattern.compile("^(\\d{1,2})[/-](\\d{1,2})$");

    public LocalDate resolve(String dateRaw, RawMessage message, LocalDateTime ingestedAt) {
        LocalDate extracted = parseExtracted(dateRaw, message.fileCreatedAt(), ingestedAt);
        if (extracted != null) {
            return extracted;
        }
        if (message.sourceTimestamp() != null) {
            return message.sourceTimestamp().toLocalDate();
        }
        if (message.fileCreatedAt() != null) {
            return message.fileCreatedAt().toLocalDate();
        }
        return null;
    }

    LocalDate parseExtracted(String dateRaw, LocalDateTime fileCreatedAt, LocalDateTime ingestedAt) {
        if (dateRaw == null || dateRaw.isBlank()) {
            return null;
        }
        String text = dateRaw.strip();

        Matcher dayMonth = DAY_MONTH.matcher(text);
        if (dayMonth.matches()) {
            LocalDateTime reference = fileCreatedAt != null ? fileCreatedAt : ingestedAt;
            if (reference == null) {
                return null;
            }
            try {
                return LocalDate.of(reference.getYear(), Integer.parseInt(dayMonth.group(2)), Integer.parseInt(dayMonth.group(1)));
            } catch (DateTimeException e) {
                log.debug("Invalid day/month date '{}'", text);
                return null;
            }
        }

        for (DateTimeFormatter format : FORMATS) {
            LocalDate parsed = parse(text, format);
            if (parsed != null) {
                return parsed;
            }
        }
        log.debug("Unrecognized date '{}'", text);
        return null;
    }

    private static LocalDate parse(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
