package com.z254.butterfly.sentinel.scaling;

public enum ScalingDirection {
    UP,
    DOWN,
    /** No-op, never executed */
    MAINTAIN
}
