package com.flagship.payments_engine.csv;

import lombok.Value;

/**
 * Counts of one pass over an input source.
 */
@Value
public class ReadSummary {
    long read;
    long malformed;

    public long getTotal() {
        return read + malformed;
    }
}
