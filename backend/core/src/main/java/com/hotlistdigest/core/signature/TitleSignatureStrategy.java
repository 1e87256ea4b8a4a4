package com.hotlistdigest.core.signature;

import com.hotlistdigest.core.model.NewsRecord;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

public final class TitleSignatureStrategy implements SignatureStrategy {
    public static final String PREFIX = "t:";

    private static final Pattern PUNCTUATION = Pattern.compile("\\p{P}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public Optional<String> signatureOf(NewsRecord record) {
        return Optional.of(PREFIX + normalizeTitle(record.title()));
    }

    public static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        String stripped = PUNCTUATION.matcher(title).replaceAll("");
        String collapsed = WHITESPACE.matcher(stripped).replaceAll(" ").trim();
        return collapsed.toLowerCase(Locale.ROOT);
    }
}
