package com.panelbridge.domain.model;

import lombok.Value;

@Value
public class Partition {

    int id;
    String name;
}
