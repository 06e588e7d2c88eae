package com.record.linkage.matching;

import com.record.linkage.core.model.Dataset;

/**
 * Composite columns derived before matching.
 * A column is only derived when the table lacks it and carries all of its sources.
 */
public final class ConvenienceColumns {

    public static final String STREET = "STREET";
    public static final String STREET_NAME = "STREET_NAME";
    public static final String STREET_NO = "STREET_NO";
    public static final String FULLNAME = "FULLNAME";
    public static final String FIRSTNAME = "FIRSTNAME";
    public static final String LASTNAME = "LASTNAME";

    private static final String SEPARATOR = " ";

    private ConvenienceColumns() {
    }

    /**
     * Adds {@code STREET} and {@code FULLNAME} where they can be derived.
     */
    public static Dataset derive(Dataset dataset) {
        Dataset result = dataset;
        if (!result.hasColumn(STREET)) {
            result = result.withConcatenatedColumn(STREET, SEPARATOR, STREET_NAME, STREET_NO);
        }
        if (!result.hasColumn(FULLNAME)) {
            result = result.withConcatenatedColumn(FULLNAME, SEPARATOR, FIRSTNAME, LASTNAME);
        }
        return result;
    }
}
