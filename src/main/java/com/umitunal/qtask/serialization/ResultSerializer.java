package com.umitunal.qtask.serialization;

import com.umitunal.qtask.core.JobState;
import com.umitunal.qtask.model.ResultRecord;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Storage format of result records in the result backend. A backend must be
 * reopened with the format it was written with.
 */
public enum ResultSerializer {
    /** Jackson JSON, readable with any JSON tooling. */
    JSON,
    /** Kryo binary, smaller records. */
    KRYO;

    public RecordCodec<ResultRecord> codec() {
        return switch (this) {
            case JSON -> new JsonCodec<>(ResultRecord.class);
            case KRYO -> new KryoCodec<>(ResultRecord.class, List.of(JobState.class, LinkedHashMap.class));
        };
    }
}
