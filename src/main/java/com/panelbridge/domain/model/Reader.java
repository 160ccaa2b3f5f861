package com.panelbridge.domain.model;

import lombok.Value;

/** A card/PIN reader and the door it controls, scoped to the configured partition. */
@Value
public class Reader {

    int id;
    int doorId;
    String name;
}
