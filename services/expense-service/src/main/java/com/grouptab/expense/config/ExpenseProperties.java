package com.grouptab.expense.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under {@code grouptab.expense}
 */
@Data
@ConfigurationProperties(prefix = "grouptab.expense")
public class ExpenseProperties {

    private Events events = new Events();

    @Data
    public static class Events {

        private boolean enabled = true;

        private String topic = "group-expense-events";
    }
}
