package com.dynascope.core.analysis;

import java.util.Map;

/**
 * Names of the numeric contact types printed in the contact summary.
 */
public final class ContactTypes {

    private static final Map<Integer, String> NAMES = Map.ofEntries(
            Map.entry(1, "Sliding Only"),
            Map.entry(2, "Tied"),
            Map.entry(3, "Surface to Surface"),
            Map.entry(4, "Single Surface"),
            Map.entry(5, "Nodes to Surface"),
            Map.entry(6, "Nodes Tied to Surface"),
            Map.entry(7, "Shell Edge Tied to Shell"),
            Map.entry(8, "Spotweld Nodes to Surface"),
            Map.entry(9, "Tie-Break"),
            Map.entry(10, "One-Way Surface to Surface"),
            Map.entry(13, "Automatic Single Surface"),
            Map.entry(14, "Eroding Surface to Surface"),
            Map.entry(15, "Eroding Single Surface"),
            Map.entry(25, "Automatic Surface to Surface (Offset)"),
            Map.entry(26, "Automatic Single Surface (Offset)"));

    private ContactTypes() {}

    public static String name(int type) {
        return NAMES.getOrDefault(type, "Type " + type);
    }

    /** Display name for a summary type column, marking automatic contacts that the number alone does not. */
    public static String describe(int type, String prefix) {
        String name = name(type);
        if ("a".equals(prefix) && !name.startsWith("Automatic")) {
            return "Automatic " + name;
        }
        return name;
    }
}
