package com.setupbrain.domain.enums;

/** Outcome of comparing a detected setup against the recorder's last-known state. */
public enum RecordAction {
    CREATE,
    UPDATE,
    SKIP
}
