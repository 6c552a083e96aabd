package com.example.trafficservice.rule;

import com.example.trafficservice.config.RuleStoreProperties;
import com.example.trafficservice.exception.NotFoundException;
import com.example.trafficservice.exception.RuleValidationException;
import com.example.trafficservice.model.FilterRule;
import com.example.trafficservice.model.Preset;
import com.example.trafficservice.model.PresetBundle;
import com.example.trafficservice.model.PresetSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only catalogue of preset rule bundles, loaded and validated once at startup.
 */
@Component
@Slf4j
public class PresetCatalog {

    private final Map<String, Preset> presets;

    @Autowired
    public PresetCatalog(RuleStoreProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this(load(resourceLoader.getResource(properties.getPresetsLocation()), objectMapper));
    }

    public PresetCatalog(PresetBundle bundle) {
        this.presets = Collections.unmodifiableMap(validate(bundle));
        log.info("Loaded {} rule presets", presets.size());
    }

    public List<PresetSummary> list() {
        return presets.values().stream().map(Preset::toSummary).collect(Collectors.toList());
    }

    public Preset get(String presetId) {
        Preset preset = presets.get(presetId);
        if (preset == null) {
            throw NotFoundException.preset(presetId);
        }
        return preset.copy();
    }

    static PresetBundle load(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, PresetBundle.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read preset catalogue " + resource.getDescription(), e);
        }
    }

    private static Map<String, Preset> validate(PresetBundle bundle) {
        if (bundle.getVersion() != PresetBundle.SUPPORTED_VERSION) {
            throw new IllegalStateException("Unsupported preset catalogue version " + bundle.getVersion()
                + ", expected " + PresetBundle.SUPPORTED_VERSION);
        }

        Map<String, Preset> result = new LinkedHashMap<>();
        for (PresetBundle.Entry entry : bundle.getPresets()) {
            if (entry.getId() == null || entry.getId().isBlank()) {
                throw RuleValidationException.invalid("preset without id");
            }
            if (result.containsKey(entry.getId())) {
                throw RuleValidationException.duplicate("Preset", entry.getId());
            }

            Set<String> ruleIds = new HashSet<>();
            Preset.PresetBuilder preset = Preset.builder()
                .id(entry.getId())
                .name(entry.getName())
                .description(entry.getDescription());
            for (FilterRule rule : entry.getRules()) {
                RuleValidator.validate(rule);
                if (rule.getId() == null || !ruleIds.add(rule.getId())) {
                    throw RuleValidationException.invalid(
                        "preset '" + entry.getId() + "' has a rule with a missing or repeated id: " + rule.getId());
                }
                preset.rule(rule.toBuilder().build());
            }
            result.put(entry.getId(), preset.build());
        }
        return result;
    }
}
