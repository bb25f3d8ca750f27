package com.dynascope.core.model;

import java.util.List;

/**
 * The contact interface table, emitted once per high-speed-printer log.
 */
public record ContactTable(List<ContactDefinition> contacts) implements RunRecord {

    public ContactTable {
        contacts = List.copyOf(contacts);
    }
}
