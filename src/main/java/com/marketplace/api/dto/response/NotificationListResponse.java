package com.marketplace.api.dto.response;

import java.util.List;

/**
 * Newest-first notifications plus the counters the badge needs.
 */
public record NotificationListResponse(List<NotificationResponse> notifications, int unreadCount, int total) {}
