package com.panelbridge.client;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * Per-target results of a command. One target failing never prevents the others from running,
 * so callers inspect {@link #getFailures()} rather than catching.
 */
@Value
public class CommandResult {

    String command;
    List<TargetResult> results;

    public CommandResult(String command, List<TargetResult> results) {
        this.command = command;
        this.results = List.copyOf(results);
    }

    public boolean isAllSucceeded() {
        return results.stream().allMatch(TargetResult::isSuccess);
    }

    public List<TargetResult> getFailures() {
        return results.stream().filter(r -> !r.isSuccess()).collect(Collectors.toList());
    }

    public List<Long> getSucceededIds() {
        return results.stream()
                .filter(TargetResult::isSuccess)
                .map(TargetResult::getTargetId)
                .collect(Collectors.toList());
    }
}
