package com.example.trafficservice.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RuleSnapshotInfo {
    private long version;
    private Instant loadedAt;
    private int enabledFilterRules;
    private int enabledHostRules;
    private int totalFilterRules;
    private int totalHostRules;
}
