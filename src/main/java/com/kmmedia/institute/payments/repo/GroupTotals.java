package com.kmmedia.institute.payments.repo;

import java.math.BigDecimal;

/**
 * Projection for {@code group by} aggregates over money columns.
 */
public interface GroupTotals {

    /**
     * @return grouping value, an enum constant of the grouped column
     */
    Object getGroupKey();

    long getRowCount();

    BigDecimal getAmountTotal();
}
