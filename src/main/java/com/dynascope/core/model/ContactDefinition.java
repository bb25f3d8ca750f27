package com.dynascope.core.model;

import java.io.Serializable;

/**
 * One row of the contact summary.
 *
 * @param order       position in the input deck
 * @param interfaceId user interface id
 * @param typeCode    raw type column, for example {@code "a 13"}
 * @param typeNumber  numeric contact type
 * @param typePrefix  {@code "a"} for automatic, {@code "o"} for old-style, otherwise empty
 */
public record ContactDefinition(
    int order,
    int interfaceId,
    String typeCode,
    int typeNumber,
    String typePrefix,
    String title
) implements Serializable {}
