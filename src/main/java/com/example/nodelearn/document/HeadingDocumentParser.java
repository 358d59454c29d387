package com.example.nodelearn.document;

import com.example.nodelearn.error.DocumentParseException;
import com.example.nodelearn.topic.TopicNormalizer;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Seed topics are taken from heading-like lines: short lines that do not read as sentences.
 * Plain text is decoded as UTF-8 or UTF-16 (by byte order mark); PDFs go through PDFBox.
 */
@Service
public class HeadingDocumentParser implements DocumentParser {

    private static final Logger log = LoggerFactory.getLogger(HeadingDocumentParser.class);

    private static final int MAX_HEADING_WORDS = 8;
    private static final String SENTENCE_END = ".!?;,";

    private final TopicNormalizer normalizer;

    @Value("${app.documents.max-seed-topics:12}")
    private int maxSeedTopics;

    public HeadingDocumentParser(TopicNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public Set<String> extractSeedTopics(byte[] document, String mimeType) {
        if (document == null || document.length == 0) {
            throw new DocumentParseException("Document is empty");
        }
        String text = extractText(document, mimeType);

        Set<String> seeds = new LinkedHashSet<>();
        Set<String> seenKeys = new HashSet<>();
        for (String line : text.split("\\R")) {
            if (seeds.size() >= maxSeedTopics) {
                break;
            }
            String candidate = cleanHeading(line);
            if (candidate == null) {
                continue;
            }
            String key = normalizer.canonicalKey(candidate);
            if (!key.isEmpty() && seenKeys.add(key)) {
                seeds.add(candidate);
            }
        }

        if (seeds.isEmpty()) {
            throw new DocumentParseException("No topics found in document");
        }
        log.debug("Extracted {} seed topics from {} document", seeds.size(), mimeType);
        return seeds;
    }

    String extractText(byte[] content, String mimeType) {
        String mt = mimeType == null ? "" : mimeType.toLowerCase(Locale.ROOT);
        if (mt.startsWith("text/") || mt.contains("markdown")) {
            Charset charset = StandardCharsets.UTF_8;
            int offset = 0;
            if (content.length >= 2) {
                int b0 = content[0] & 0xFF;
                int b1 = content[1] & 0xFF;
                if (b0 == 0xFE && b1 == 0xFF) {
                    charset = StandardCharsets.UTF_16BE;
                    offset = 2;
                } else if (b0 == 0xFF && b1 == 0xFE) {
                    charset = StandardCharsets.UTF_16LE;
                    offset = 2;
                }
            }
            if (offset == 0 && content.length >= 3
                    && (content[0] & 0xFF) == 0xEF && (content[1] & 0xFF) == 0xBB && (content[2] & 0xFF) == 0xBF) {
                offset = 3;
            }
            return new String(content, offset, content.length - offset, charset);
        }
        if (mt.equals("application/pdf")) {
            try (PDDocument doc = Loader.loadPDF(content)) {
                return new PDFTextStripper().getText(doc);
            } catch (IOException e) {
                log.warn("PDF extraction failed: {}", e.toString());
                throw new DocumentParseException("Unreadable PDF document", e);
            }
        }
        throw new DocumentParseException("Unsupported document type: " + mimeType);
    }

    private static String cleanHeading(String line) {
        String s = line.strip();
        // Markdown heading and list markers
        s = s.replaceFirst("^(#{1,6}|[-*+]|\\d+[.)])\\s+", "").strip();
        if (s.isEmpty()) {
            return null;
        }
        if (SENTENCE_END.indexOf(s.charAt(s.length() - 1)) >= 0) {
            return null;
        }
        if (s.split("\\s+").length > MAX_HEADING_WORDS) {
            return null;
        }
        return s;
    }
}
