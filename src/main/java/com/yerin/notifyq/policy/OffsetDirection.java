package com.yerin.notifyq.policy;

public enum OffsetDirection {
    AFTER_ANCHOR,
    BEFORE_ANCHOR
}
