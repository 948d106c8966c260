package com.drivekb.error;

import java.time.Duration;

public class RetrievalTimeoutException extends RetrievalException {
    public RetrievalTimeoutException(String operation, Duration budget) {
        super(operation, "deadline of " + budget.toMillis() + " ms expired", null);
    }

    public RetrievalTimeoutException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }
}
