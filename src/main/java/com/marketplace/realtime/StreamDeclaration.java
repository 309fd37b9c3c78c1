package com.marketplace.realtime;

import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Declares one logical stream a session subscribes to: which entity, which column scopes
 * it to the signed-in user, and which operations are of interest.
 *
 * <p>The filter value is not part of the declaration; it is bound from the session's
 * user id when the manager opens the handle.
 */
@Getter
@Builder
@ToString
public class StreamDeclaration {

    private final String id;
    private final EntityType entity;
    private final String filterField;

    /** Accepted operations. Empty means all operations. */
    @Singular
    private final Set<ChangeOperation> operations;

    public boolean accepts(ChangeOperation operation) {
        return operations.isEmpty() || operations.contains(operation);
    }

    public SubscriptionFilter filterFor(String userId) {
        return new SubscriptionFilter(filterField, userId);
    }
}
