package com.dynascope.core.mapping;

import com.dynascope.core.model.ElementAssociation;
import com.dynascope.core.model.SmallestTimestep;
import com.dynascope.core.model.TimestepRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Read-only index from element and node ids to their owning part.
 * <p>
 * Built once per run from every source that names an element together with its
 * part. Sources are added in order of trust: the first source to map an id wins
 * and later sources only fill gaps. When no source is available every lookup
 * answers "unknown part".
 */
public final class ElementPartMapper {

    private static final ElementPartMapper EMPTY = new ElementPartMapper(Map.of(), Map.of());

    private final Map<Long, Integer> elementParts;
    private final Map<Long, Integer> nodeParts;

    private ElementPartMapper(Map<Long, Integer> elementParts, Map<Long, Integer> nodeParts) {
        this.elementParts = elementParts;
        this.nodeParts = nodeParts;
    }

    public static ElementPartMapper empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public OptionalInt owningPart(long elementId) {
        Integer part = elementParts.get(elementId);
        return part == null ? OptionalInt.empty() : OptionalInt.of(part);
    }

    /** Part of the first element card that referenced the node. */
    public OptionalInt owningPartOfNode(long nodeId) {
        Integer part = nodeParts.get(nodeId);
        return part == null ? OptionalInt.empty() : OptionalInt.of(part);
    }

    public int elementCount() {
        return elementParts.size();
    }

    public boolean isEmpty() {
        return elementParts.isEmpty();
    }

    public static final class Builder {
        private final Map<Long, Integer> elementParts = new HashMap<>();
        private final Map<Long, Integer> nodeParts = new HashMap<>();

        private Builder() {}

        public Builder add(ElementAssociation association) {
            elementParts.putIfAbsent(association.elementId(), association.partId());
            for (Long node : association.nodes()) {
                nodeParts.putIfAbsent(node, association.partId());
            }
            return this;
        }

        public Builder add(SmallestTimestep row) {
            return put(row.elementId(), row.partId());
        }

        /** Only element controllers carry a part; contact ids are not element ids. */
        public Builder add(TimestepRecord record) {
            if (!record.hasController() || "contact".equals(record.elementType())) {
                return this;
            }
            return put(record.elementId(), record.partId());
        }

        public Builder put(long elementId, int partId) {
            if (partId > 0) {
                elementParts.putIfAbsent(elementId, partId);
            }
            return this;
        }

        public ElementPartMapper build() {
            if (elementParts.isEmpty() && nodeParts.isEmpty()) {
                return EMPTY;
            }
            return new ElementPartMapper(Collections.unmodifiableMap(new HashMap<>(elementParts)),
                    Collections.unmodifiableMap(new HashMap<>(nodeParts)));
        }
    }
}
