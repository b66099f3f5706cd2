package com.myorg.lhub.ingestion.telemetry;

import java.util.List;

public interface TimeSeriesStore {

    /** Writes all rows in one request, or none of them. */
    void bulkInsert(String table, List<?> rows) throws BulkWriteException;
}
