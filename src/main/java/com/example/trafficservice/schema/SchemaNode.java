package com.example.trafficservice.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Inferred structure of a body or field, as a union over {@link SchemaKind}s.
 *
 * <p>Instances are immutable. {@link #merge(SchemaNode, SchemaNode)} is a join: the kinds are
 * unioned, object properties are merged recursively (a property is required only if every merged
 * sample had it) and array item schemas are merged. Examples come from the newer side.</p>
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"types", "format", "required", "properties", "items", "example"})
public final class SchemaNode {

    private final Set<SchemaKind> types;

    /**
     * Media type of an opaque body.
     */
    private final String format;

    private final Map<String, SchemaNode> properties;

    private final Set<String> required;

    private final SchemaNode items;

    private final JsonNode example;

    @JsonCreator
    public SchemaNode(@JsonProperty("types") Set<SchemaKind> types,
                      @JsonProperty("format") String format,
                      @JsonProperty("properties") Map<String, SchemaNode> properties,
                      @JsonProperty("required") Set<String> required,
                      @JsonProperty("items") SchemaNode items,
                      @JsonProperty("example") JsonNode example) {
        this.types = types == null || types.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.of(SchemaKind.UNKNOWN))
            : Collections.unmodifiableSet(EnumSet.copyOf(types));
        this.format = format;
        this.properties = properties == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.required = required == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new TreeSet<>(required));
        this.items = items;
        this.example = example;
    }

    public static SchemaNode of(SchemaKind kind, JsonNode example) {
        return new SchemaNode(EnumSet.of(kind), null, null, null, null, example);
    }

    public static SchemaNode absent() {
        return of(SchemaKind.ABSENT, null);
    }

    public static SchemaNode object(Map<String, SchemaNode> properties) {
        return new SchemaNode(EnumSet.of(SchemaKind.OBJECT), null, properties, properties.keySet(), null, null);
    }

    public static SchemaNode array(SchemaNode items) {
        return new SchemaNode(EnumSet.of(SchemaKind.ARRAY), null, null, null, items, null);
    }

    /**
     * Body that could not be read as structured data, kept as a blob of the given media type.
     */
    public static SchemaNode opaque(String mediaType, JsonNode example) {
        return new SchemaNode(EnumSet.of(SchemaKind.UNKNOWN), mediaType, null, null, null, example);
    }

    public boolean has(SchemaKind kind) {
        return types.contains(kind);
    }

    @JsonIgnore
    public boolean isAbsentOnly() {
        return types.size() == 1 && has(SchemaKind.ABSENT);
    }

    /**
     * More than one concrete kind was observed for this node.
     */
    @JsonIgnore
    public boolean isConflicting() {
        return types.stream().filter(SchemaKind::isConcrete).count() > 1;
    }

    @JsonIgnore
    public boolean isOpaque() {
        return has(SchemaKind.UNKNOWN);
    }

    /**
     * Joins two observations. When both carry an example the one from {@code newer} is kept.
     */
    public static SchemaNode merge(SchemaNode older, SchemaNode newer) {
        if (older == null) {
            return newer;
        }
        if (newer == null) {
            return older;
        }

        EnumSet<SchemaKind> types = EnumSet.copyOf(older.types);
        types.addAll(newer.types);

        Map<String, SchemaNode> properties = new LinkedHashMap<>(older.properties);
        newer.properties.forEach((name, schema) -> properties.merge(name, schema, SchemaNode::merge));

        Set<String> required;
        if (older.has(SchemaKind.OBJECT) && newer.has(SchemaKind.OBJECT)) {
            required = new TreeSet<>(older.required);
            required.retainAll(newer.required);
        } else if (older.has(SchemaKind.OBJECT)) {
            required = older.required;
        } else {
            required = newer.required;
        }

        return new SchemaNode(
            types,
            newer.format != null ? newer.format : older.format,
            properties,
            required,
            merge(older.items, newer.items),
            newer.example != null ? newer.example : older.example);
    }

    /**
     * Dotted paths ({@code items[].price}) of every node holding more than one concrete kind,
     * each followed by the kinds seen.
     */
    public List<String> describeConflicts() {
        List<String> conflicts = new ArrayList<>();
        collectConflicts("$", conflicts);
        return conflicts;
    }

    private void collectConflicts(String path, List<String> conflicts) {
        if (isConflicting()) {
            conflicts.add(path + " observed as " + typeLabel());
        }
        properties.forEach((name, child) -> child.collectConflicts(path + "." + name, conflicts));
        if (items != null) {
            items.collectConflicts(path + "[]", conflicts);
        }
    }

    /**
     * Kinds joined with {@code |}, e.g. {@code number|string}.
     */
    @JsonIgnore
    public String typeLabel() {
        return types.stream().map(SchemaKind::getValue).collect(Collectors.joining("|"));
    }
}
