package com.production.log_rag_service.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalizes text extracted from PDF pages before it is chunked and embedded.
 */
@Service
@Slf4j
public class TextCleaningService {

    private static final Pattern HEADER_FOOTER_PATTERN = Pattern.compile(
            "(?m)^\\s*(Page\\s*\\d+|\\d+\\s*of\\s*\\d+|©.*|All rights reserved.*|Confidential.*)\\s*$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t]+");

    private static final Pattern MULTIPLE_NEWLINES = Pattern.compile("\\n{3,}");

    // Control characters except \t \n \r
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private static final Pattern LINE_BREAK_HYPHENATION = Pattern.compile("-\\s*\\n\\s*");

    public String cleanText(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return "";
        }

        String text = dropLoneSurrogates(rawText);

        // NFKC resolves PDF ligatures such as U+FB01 into plain letters
        text = Normalizer.normalize(text, Normalizer.Form.NFKC);
        text = CONTROL_CHARS.matcher(text).replaceAll(" ");
        text = text.replace("\r\n", "\n").replace('\r', '\n');
        text = HEADER_FOOTER_PATTERN.matcher(text).replaceAll("");
        text = MULTIPLE_SPACES.matcher(text).replaceAll(" ");
        text = MULTIPLE_NEWLINES.matcher(text).replaceAll("\n\n");
        text = trimLines(text).trim();

        log.debug("Cleaned text: {} chars -> {} chars", rawText.length(), text.length());
        return text;
    }

    public String removeHyphenation(String text) {
        text = text.replace("\u00AD", "");
        return LINE_BREAK_HYPHENATION.matcher(text).replaceAll("");
    }

    public String normalizeQuotes(String text) {
        return text.replace('\u2018', '\'')
                .replace('\u2019', '\'')
                .replace('\u201C', '"')
                .replace('\u201D', '"')
                .replace('\u2013', '-')
                .replace('\u2014', '-');
    }

    public String fullClean(String rawText) {
        return normalizeQuotes(removeHyphenation(cleanText(rawText)));
    }

    private static String trimLines(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder result = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                result.append('\n');
            }
            result.append(lines[i].trim());
        }
        return result.toString();
    }

    /**
     * Broken PDF text layers can yield unpaired UTF-16 surrogates, which the
     * embedding endpoint rejects. Valid pairs are kept.
     */
    private static String dropLoneSurrogates(String text) {
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            boolean lone;
            if (Character.isHighSurrogate(ch)) {
                lone = i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1));
                if (!lone) {
                    if (sb != null) {
                        sb.append(ch).append(text.charAt(i + 1));
                    }
                    i++;
                    continue;
                }
            } else {
                lone = Character.isLowSurrogate(ch);
            }

            if (lone && sb == null) {
                sb = new StringBuilder(text.length());
                sb.append(text, 0, i);
            }
            if (!lone && sb != null) {
                sb.append(ch);
            }
        }
        return sb == null ? text : sb.toString();
    }
}
