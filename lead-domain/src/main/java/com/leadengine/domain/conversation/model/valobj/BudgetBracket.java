package com.leadengine.domain.conversation.model.valobj;

import java.math.BigDecimal;

/**
 * 预算档位，回调 ID 为 budget_{index}。max 为 null 表示无上限。
 */
public enum BudgetBracket {

    UNDER_500K(0, BigDecimal.ZERO, new BigDecimal("500000")),
    FROM_500K_TO_1M(1, new BigDecimal("500000"), new BigDecimal("1000000")),
    FROM_1M_TO_2M(2, new BigDecimal("1000000"), new BigDecimal("2000000")),
    FROM_2M_TO_5M(3, new BigDecimal("2000000"), new BigDecimal("5000000")),
    ABOVE_5M(4, new BigDecimal("5000000"), null);

    private final int index;
    private final BigDecimal min;
    private final BigDecimal max;

    BudgetBracket(int index, BigDecimal min, BigDecimal max) {
        this.index = index;
        this.min = min;
        this.max = max;
    }

    public int getIndex() {
        return index;
    }

    public BigDecimal getMin() {
        return min;
    }

    public BigDecimal getMax() {
        return max;
    }

    public static BudgetBracket ofIndex(int index) {
        for (BudgetBracket bracket : values()) {
            if (bracket.index == index) {
                return bracket;
            }
        }
        return null;
    }

    /**
     * 金额落入的档位，区间左闭右开
     */
    public static BudgetBracket containing(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            return null;
        }
        for (BudgetBracket bracket : values()) {
            boolean aboveMin = amount.compareTo(bracket.min) >= 0;
            boolean belowMax = bracket.max == null || amount.compareTo(bracket.max) < 0;
            if (aboveMin && belowMax) {
                return bracket;
            }
        }
        return null;
    }
}
