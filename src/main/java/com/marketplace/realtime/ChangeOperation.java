package com.marketplace.realtime;

public enum ChangeOperation {
    CREATED,
    UPDATED,
    DELETED
}
