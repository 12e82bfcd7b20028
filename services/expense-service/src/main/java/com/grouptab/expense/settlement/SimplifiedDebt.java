package com.grouptab.expense.settlement;

import java.math.BigDecimal;

/**
 * A transfer the group still has to make: {@code from} pays {@code to}
 */
public record SimplifiedDebt(String from, String to, BigDecimal amount) {
}
