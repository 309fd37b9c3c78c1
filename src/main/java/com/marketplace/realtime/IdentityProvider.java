package com.marketplace.realtime;

/** Supplies the signed-in user. {@code null} means there is no session. */
@FunctionalInterface
public interface IdentityProvider {

    String currentUserId();
}
