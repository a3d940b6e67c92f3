package com.fileflow.adapter.out.persistence;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Descriptor of one persisted JSON document
 *
 * @param name    lock name guarding the document
 * @param path    file location
 * @param type    Jackson type of the document's content
 * @param empty   value used when the document does not exist yet
 * @param lenient applied to decoded content handed to readers; may leave out entries it cannot use
 * @param strict  applied to decoded content about to be rewritten; must keep every entry and
 *                throws StorageUnavailableException for one it cannot write back faithfully
 */
public record JsonDocument<T>(
        String name,
        String path,
        TypeReference<T> type,
        Supplier<T> empty,
        UnaryOperator<T> lenient,
        UnaryOperator<T> strict
) {

    public JsonDocument(String name, String path, TypeReference<T> type, Supplier<T> empty) {
        this(name, path, type, empty, UnaryOperator.identity(), UnaryOperator.identity());
    }

    /**
     * Same sanitizer for reads and rewrites
     */
    public JsonDocument(String name, String path, TypeReference<T> type, Supplier<T> empty,
                        UnaryOperator<T> sanitizer) {
        this(name, path, type, empty, sanitizer, sanitizer);
    }

    String temporaryPath() {
        return path + ".tmp";
    }
}
