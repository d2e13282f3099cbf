package com.panwatch.exception;

import com.panwatch.domain.enums.DataSourceType;
import com.panwatch.domain.model.ExecutionLogEntry;
import java.util.List;

/** Raised by the router when no binding of a data type produced data. */
public class NoProviderAvailableException extends DataUnavailableException {

    private final DataSourceType type;

    public NoProviderAvailableException(DataSourceType type, List<ExecutionLogEntry> logs) {
        super("No provider available for data type " + type, logs);
        this.type = type;
    }

    public DataSourceType getType() {
        return type;
    }
}
