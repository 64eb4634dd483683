package com.goldminer.backend.services.sms.accounts;

import java.math.BigDecimal;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class AccountDefinition {
    private String accountId;
    private String accountType;
    private BigDecimal interestRate;
    private BigDecimal creditLimit;
    private Integer billingCycle;
    private String label;
}
