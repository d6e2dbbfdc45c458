package com.phonepe.agentrecall.core.session;

import com.phonepe.agentrecall.core.drift.DriftMetrics;
import lombok.Value;

@Value
public class DriftCheck {
    boolean alert;
    DriftMetrics metrics;
}
