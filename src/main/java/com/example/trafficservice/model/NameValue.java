package com.example.trafficservice.model;

import lombok.Value;

/**
 * A header or query parameter as captured, duplicates and order preserved.
 */
@Value
public class NameValue {
    String name;
    String value;
}
