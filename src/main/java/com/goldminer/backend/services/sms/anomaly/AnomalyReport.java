package com.goldminer.backend.services.sms.anomaly;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.goldminer.backend.enums.AnomalyFlag;

public record AnomalyReport(
        int totalTransactions,
        int anomalousTransactions,
        double anomalyRate,
        Map<AnomalyFlag, Long> countsByFlag,
        List<Set<AnomalyFlag>> flagsByIndex
) {
    public AnomalyReport {
        countsByFlag = Map.copyOf(countsByFlag);
        flagsByIndex = List.copyOf(flagsByIndex);
    }
}
