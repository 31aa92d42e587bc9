package com.flowhub.common.messaging;

@FunctionalInterface
public interface EventHandler<T> {

    void handle(T event);
}
