package com.panelbridge.domain.enums;

/** The two known backend payload variants. Fixed once per stream connection. */
public enum PanelDialect {
    PROTECTOR_NET,
    ODYSSEY
}
