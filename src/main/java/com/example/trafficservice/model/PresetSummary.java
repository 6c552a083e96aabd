package com.example.trafficservice.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PresetSummary {
    private String id;
    private String name;
    private String description;
    private int ruleCount;
}
