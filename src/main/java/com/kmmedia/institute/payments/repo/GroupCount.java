package com.kmmedia.institute.payments.repo;

/**
 * Projection for {@code group by} row counts.
 */
public interface GroupCount {

    Object getGroupKey();

    long getRowCount();
}
