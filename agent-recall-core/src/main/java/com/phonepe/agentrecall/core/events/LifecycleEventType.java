package com.phonepe.agentrecall.core.events;

import lombok.Getter;
import lombok.experimental.UtilityClass;

@Getter
public enum LifecycleEventType {
    MEMORY_MUTATED(Values.MEMORY_MUTATED),
    AUDIT_WRITE_FAILED(Values.AUDIT_WRITE_FAILED),
    RECALL_FAILED(Values.RECALL_FAILED),
    DRIFT_DETECTED(Values.DRIFT_DETECTED),
    ;

    private final String type;

    LifecycleEventType(String type) {
        this.type = type;
    }

    @UtilityClass
    public static final class Values {
        public static final String MEMORY_MUTATED = "MEMORY_MUTATED";
        public static final String AUDIT_WRITE_FAILED = "AUDIT_WRITE_FAILED";
        public static final String RECALL_FAILED = "RECALL_FAILED";
        public static final String DRIFT_DETECTED = "DRIFT_DETECTED";
    }
}
