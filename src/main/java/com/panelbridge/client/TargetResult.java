package com.panelbridge.client;

import lombok.Value;

/** Outcome of one target (door or plan) of a multi-target command. */
@Value
public class TargetResult {

    long targetId;
    boolean success;
    String error;

    public static TargetResult ok(long targetId) {
        return new TargetResult(targetId, true, null);
    }

    public static TargetResult failed(long targetId, String error) {
        return new TargetResult(targetId, false, error);
    }
}
