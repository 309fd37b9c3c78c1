package com.marketplace.notification;

/**
 * Visual style of a transient toast.
 */
public enum ToastLevel {
    DEFAULT,
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
