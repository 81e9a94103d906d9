package com.yerin.notifyq.policy;

import com.yerin.notifyq.domain.LifecycleState;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 상태 wire 값에 대한 매칭 조건. 모르는 값이나 null 은 oneOf 에 매칭되지 않는다.
 */
public final class StatePattern {

    private enum Kind { ANY, ONE_OF, NONE_OF }

    private static final StatePattern ANY = new StatePattern(Kind.ANY, Set.of());

    private final Kind kind;
    private final Set<String> values;

    private StatePattern(Kind kind, Set<String> values) {
        this.kind = kind;
        this.values = values;
    }

    public static StatePattern any() {
        return ANY;
    }

    public static StatePattern oneOf(LifecycleState... states) {
        return new StatePattern(Kind.ONE_OF, wireValues(states));
    }

    public static StatePattern noneOf(LifecycleState... states) {
        return new StatePattern(Kind.NONE_OF, wireValues(states));
    }

    public boolean matches(String state) {
        switch (kind) {
            case ANY:
                return true;
            case ONE_OF:
                return state != null && values.contains(state);
            case NONE_OF:
                return state == null || !values.contains(state);
            default:
                return false;
        }
    }

    private static Set<String> wireValues(LifecycleState... states) {
        if (states.length == 0) throw new IllegalArgumentException("at least one state is required");
        return Arrays.stream(states).map(LifecycleState::value).collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String toString() {
        return kind == Kind.ANY ? "*" : kind.name().toLowerCase() + values;
    }
}
