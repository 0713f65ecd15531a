package dev.juridica.rag.retrieval;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recognizes greetings and thanks that do not need any legal context.
 */
class SmallTalkDetector {

    private static final Pattern GREETING = Pattern.compile(
            "\\b(bonjour|bonsoir|salut|coucou|ça va|ca va|merci|au revoir|hello|hi|hey|thanks|thank you|bye)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);

    private final int maxLength;

    SmallTalkDetector(int maxLength) {
        this.maxLength = maxLength;
    }

    boolean isSmallTalk(String query) {
        String normalized = query.strip().toLowerCase(Locale.ROOT);
        return normalized.length() < maxLength && GREETING.matcher(normalized).find();
    }
}
