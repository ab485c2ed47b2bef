package com.supplychain.pipeline.domain;

import lombok.Value;

@Value
public class Coordinates {

    public static final Coordinates UNKNOWN = new Coordinates(0.0, 0.0);

    double lat;
    double lon;
}
