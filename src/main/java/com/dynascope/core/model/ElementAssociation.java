package com.dynascope.core.model;

import java.util.List;

/**
 * Element-to-part ownership read from an element card of the input deck.
 */
public record ElementAssociation(
    String elementType,
    long elementId,
    int partId,
    List<Long> nodes
) {

    public ElementAssociation {
        nodes = List.copyOf(nodes);
    }
}
