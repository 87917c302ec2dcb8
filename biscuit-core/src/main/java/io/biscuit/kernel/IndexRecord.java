package io.biscuit.kernel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One host record handed to the index: its locator and the canonical string of
 * each indexed column, in column order. A {@code null} value is not indexed.
 */
public record IndexRecord(RecordLocator locator, List<String> values) {
    public IndexRecord {
        if (locator == null) {
            throw new IllegalArgumentException("locator required");
        }
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("values required");
        }
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static IndexRecord of(RecordLocator locator, String... values) {
        var list = new ArrayList<String>(values.length);
        Collections.addAll(list, values);
        return new IndexRecord(locator, list);
    }
}
