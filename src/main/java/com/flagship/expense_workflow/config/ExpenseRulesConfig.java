package com.flagship.expense_workflow.config;

import com.flagship.expense_workflow.expense.ExpenseRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Binds the expense.rules.* properties into the {@link ExpenseRules} used by
 * the services.
 */
@Configuration
@Slf4j
public class ExpenseRulesConfig {

    @Value("${expense.rules.receipt-threshold:100}")
    private BigDecimal receiptThreshold;

    @Value("${expense.rules.approval-ceiling:1000}")
    private BigDecimal approvalCeiling;

    @Value("${expense.rules.max-expense-age-days:90}")
    private int maxExpenseAgeDays;

    @Bean
    public ExpenseRules expenseRules() {
        ExpenseRules rules = new ExpenseRules(receiptThreshold, approvalCeiling, maxExpenseAgeDays);
        log.info("Expense rules: receiptThreshold={}, approvalCeiling={}, maxExpenseAgeDays={}",
                receiptThreshold, approvalCeiling, maxExpenseAgeDays);
        return rules;
    }
}
