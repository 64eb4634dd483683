package com.goldminer.backend.services.sms.pipeline;

import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.goldminer.backend.dto.sms.PromoVerdict;
import com.goldminer.backend.enums.TransactionState;

/**
 * Decides the monetary relevance of a message with an ordered list of rules; the first
 * rule that matches wins. A promo verdict takes precedence over the OTP and declined guards.
 */
@Component
public class TransactionStateClassifier {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Pattern OTP = Pattern.compile(
            "(?<![\\p{L}\\p{N}_])(?:otp|one\\s*time\\s*password|code|رمز التحقق|كلمة المرور لمرة واحدة)(?![\\p{L}\\p{N}_])", FLAGS);
    private static final Pattern DECLINED = Pattern.compile(
            "(?<![\\p{L}\\p{N}_])(?:declined|refused|مرفوضة|مرفوض|تم رفض)(?![\\p{L}\\p{N}_])", FLAGS);

    /**
     * What the state rules look at.
     */
    public record Signals(PromoVerdict promoVerdict, String text, boolean hasAmount) {}

    private record StateRule(TransactionState state, Predicate<Signals> applies) {}

    private static final List<StateRule> RULES = List.of(
            new StateRule(TransactionState.PROMO, s -> s.promoVerdict() != null && s.promoVerdict().skip()),
            new StateRule(TransactionState.OTP, s -> OTP.matcher(s.text()).find()),
            new StateRule(TransactionState.DECLINED, s -> DECLINED.matcher(s.text()).find()),
            new StateRule(TransactionState.UNKNOWN, s -> !s.hasAmount()),
            new StateRule(TransactionState.MONETARY, s -> true));

    public TransactionState classify(Signals signals) {
        Signals safe = new Signals(signals.promoVerdict(), signals.text() == null ? "" : signals.text(), signals.hasAmount());
        for (StateRule rule : RULES) {
            if (rule.applies().test(safe)) {
                return rule.state();
            }
        }
        return TransactionState.UNKNOWN;
    }

    public TransactionState classify(PromoVerdict promoVerdict, String text, boolean hasAmount) {
        return classify(new Signals(promoVerdict, text, hasAmount));
    }
}
