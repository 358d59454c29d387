package com.example.nodelearn.document;

import java.util.Set;

/**
 * Extracts seed topics from an uploaded document.
 */
public interface DocumentParser {

    /**
     * @return seed topics in document order, first one being the most prominent
     * @throws com.example.nodelearn.error.DocumentParseException if the document is empty, unreadable
     *                                                            or of an unsupported type
     */
    Set<String> extractSeedTopics(byte[] document, String mimeType);
}
