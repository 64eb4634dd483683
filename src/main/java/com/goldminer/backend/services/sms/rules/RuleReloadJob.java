package com.goldminer.backend.services.sms.rules;

import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Polls rule files and reloads the ones whose modification time changed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "goldminer.rules", name = "auto-reload", havingValue = "true")
public class RuleReloadJob {

    private final List<ReloadableRules> ruleSets;

    @Scheduled(fixedDelayString = "${goldminer.rules.reload-interval-ms:30000}")
    public void reloadChangedRules() {
        int reloaded = 0;
        for (ReloadableRules rules : ruleSets) {
            if (rules.reloadIfModified()) {
                reloaded++;
            }
        }
        if (reloaded > 0) {
            log.info("Reloaded {} rule set(s)", reloaded);
        }
    }
}
