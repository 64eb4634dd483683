package com.goldminer.backend.services.sms.identity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;

import org.springframework.stereotype.Component;

import com.goldminer.backend.enums.TransactionState;

/**
 * Idempotency key of a transaction: SHA-256 (lowercase hex) over
 * {@code resolvedDate|amount|payee|accountId|state}.
 *
 * <p>Amounts are hashed at their stored scale ({@code 250.5}, {@code 250.50} and
 * {@code 250.499} hash alike) and payee whitespace is collapsed. Optional fields hash as
 * empty strings.
 */
@Component
public class ContentHasher {

    /** Scale at which amounts are stored and hashed, rounded half up. */
    public static final int AMOUNT_SCALE = 2;

    private static final char SEPARATOR = '|';

    /**
     * @throws IllegalArgumentException when {@code accountId} or {@code state} is missing
     */
    public String hash(LocalDate resolvedDate, BigDecimal amount, String payee, String accountId, TransactionState state) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId is required for the content hash");
        }
        if (state == null) {
            throw new IllegalArgumentException("transaction state is required for the content hash");
        }

        String canonical = new StringBuilder()
                .append(resolvedDate == null ? "" : resolvedDate.toString()).append(SEPARATOR)
                .append(amount == null ? "" : canonicalAmount(amount)).append(SEPARATOR)
                .append(collapseWhitespace(payee)).append(SEPARATOR)
                .append(accountId.strip()).append(SEPARATOR)
                .append(state.name())
                .toString();
        return computeSha256Hex(canonical.getBytes(StandardCharsets.UTF_8));
    }

    private static String canonicalAmount(BigDecimal amount) {
        return amount.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }

    private static String collapseWhitespace(String value) {
        return value == null ? "" : value.strip().replaceAll("\\s+", " ");
    }

    private static String computeSha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return toHexLower(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static String toHexLower(byte[] bytes) {
        char[] hex = new char[bytes.length * 2];
        final char[] alphabet = "0123456789abcdef".toCharArray();
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            hex[i * 2] = alphabet[v >>> 4];
            hex[i * 2 + 1] = alphabet[v & 0x0F];
        }
        return new String(hex);
    }
}
