package com.kotsin.advisor.store;

import com.kotsin.advisor.model.SignalCategory;

public class ConcurrentPartitionUpdateException extends RuntimeException {

    public ConcurrentPartitionUpdateException(SignalCategory category, int attempts) {
        super("Partition " + category.key() + " kept changing underneath; gave up after " + attempts + " attempts");
    }
}
