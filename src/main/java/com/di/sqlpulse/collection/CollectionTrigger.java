package com.di.sqlpulse.collection;

/** What started a collection run. */
public enum CollectionTrigger {
    MANUAL,
    SCHEDULED
}
