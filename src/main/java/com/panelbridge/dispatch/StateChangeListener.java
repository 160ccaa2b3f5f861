package com.panelbridge.dispatch;

@FunctionalInterface
public interface StateChangeListener {

    void onStateChange(StateChange change);
}
