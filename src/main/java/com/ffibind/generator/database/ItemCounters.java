package com.ffibind.generator.database;

import lombok.Value;

/**
 * Items added and duplicates ignored since the counters were last drained.
 */
@Value(staticConstructor = "of")
public class ItemCounters {

    int added;
    int ignored;

    public boolean isEmpty() {
        return added == 0 && ignored == 0;
    }
}
