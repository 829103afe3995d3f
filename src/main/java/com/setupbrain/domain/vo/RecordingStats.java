package com.setupbrain.domain.vo;

import lombok.Value;

/** Per-cycle counts from the setup recorder. */
@Value
public class RecordingStats {

    int created;
    int updated;
    int skipped;
    int failed;

    public static RecordingStats empty() {
        return new RecordingStats(0, 0, 0, 0);
    }

    public int getWrites() {
        return created + updated;
    }
}
