package com.dynascope.core.knowledge;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable catalogue of solver warning and error codes.
 * <p>
 * Loaded once from {@code knowledge/codes.json} on the classpath and shared
 * read-only by every analysis. Lookups never fail: a code missing from the
 * catalogue gets a generic {@link CodeEntry#uncatalogued(int)} entry.
 */
public final class KnowledgeBase {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBase.class);

    public static final String RESOURCE = "knowledge/codes.json";

    private final Map<Integer, CodeEntry> entries;

    private KnowledgeBase(Map<Integer, CodeEntry> entries) {
        this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
    }

    public static KnowledgeBase of(Collection<CodeEntry> entries) {
        Map<Integer, CodeEntry> byCode = new TreeMap<>();
        for (CodeEntry entry : entries) {
            byCode.put(entry.code(), entry);
        }
        return new KnowledgeBase(byCode);
    }

    /**
     * Loads the bundled catalogue.
     *
     * @throws IllegalStateException when the resource is missing from the classpath
     * @throws UncheckedIOException when the resource cannot be read or parsed
     */
    public static KnowledgeBase loadDefault(ObjectMapper objectMapper) {
        InputStream in = KnowledgeBase.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            throw new IllegalStateException("Knowledge base resource not found: " + RESOURCE);
        }
        try (in) {
            KnowledgeBase base = load(objectMapper, in);
            log.info("Knowledge base loaded: {} codes", base.size());
            return base;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    public static KnowledgeBase load(ObjectMapper objectMapper, InputStream in) throws IOException {
        List<CodeEntry> entries = objectMapper.readValue(in, new TypeReference<List<CodeEntry>>() {});
        return of(entries);
    }

    public CodeEntry lookup(int code) {
        CodeEntry entry = entries.get(code);
        return entry != null ? entry : CodeEntry.uncatalogued(code);
    }

    public boolean isCatalogued(int code) {
        return entries.containsKey(code);
    }

    /** True for codes whose category marks an element failure traced to a part. */
    public boolean isFailureCode(int code) {
        CodeEntry entry = entries.get(code);
        return entry != null && ("negative-volume".equals(entry.category()) || "numerical".equals(entry.category()));
    }

    /** All catalogued entries in code order. */
    public Collection<CodeEntry> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }
}
