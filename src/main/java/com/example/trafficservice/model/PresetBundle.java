package com.example.trafficservice.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk form of the preset catalogue ({@code presets.json}).
 *
 * <pre>
 * {
 *   "version": 1,
 *   "presets": [ { "id": "...", "name": "...", "description": "...", "rules": [ ... ] } ]
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
public class PresetBundle {

    public static final int SUPPORTED_VERSION = 1;

    private int version;

    private List<Entry> presets = new ArrayList<>();

    @Data
    @NoArgsConstructor
    public static class Entry {
        private String id;
        private String name;
        private String description;
        private List<FilterRule> rules = new ArrayList<>();
    }
}
