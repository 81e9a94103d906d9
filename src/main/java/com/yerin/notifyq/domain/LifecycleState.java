package com.yerin.notifyq.domain;

public interface LifecycleState {
    String value();
    EntityFamily family();
}
