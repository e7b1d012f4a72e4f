package com.dds.app.ledger;

public enum DeletionOutcome {
    DELETED,
    DRY_RUN_SKIPPED,
    DELETE_FAILED
}
