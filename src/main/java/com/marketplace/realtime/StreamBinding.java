package com.marketplace.realtime;

/** A stream declaration together with the listener that consumes its events. */
public record StreamBinding(StreamDeclaration declaration, ChangeEventListener listener) {}
