package com.injuryelo.common.classifier;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonicalizes player names so feed spellings match registry seeds.
 *
 * <p>Steps, in order: strip diacritics, case-fold, turn hyphens into spaces, drop every
 * other punctuation character, collapse whitespace, then drop a trailing generational
 * suffix ({@code jr}, {@code sr}, {@code ii}, {@code iii}, {@code iv}) when at least two
 * name tokens remain. Alias resolution happens afterwards in {@link PlayerRegistry}.
 *
 * <p>Pure function. Never throws; {@code null} or blank input yields {@code ""}.
 */
public final class PlayerNameNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N} ]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Set<String> SUFFIXES = Set.of("jr", "sr", "ii", "iii", "iv");

    private PlayerNameNormalizer() {}

    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String folded = DIACRITICS.matcher(Normalizer.normalize(name, Normalizer.Form.NFD)).replaceAll("");
        folded = folded.toLowerCase(Locale.ROOT).replace('-', ' ');
        folded = PUNCTUATION.matcher(folded).replaceAll("");
        folded = WHITESPACE.matcher(folded.trim()).replaceAll(" ");

        List<String> tokens = Arrays.asList(folded.split(" "));
        if (tokens.size() > 2 && SUFFIXES.contains(tokens.get(tokens.size() - 1))) {
            return String.join(" ", tokens.subList(0, tokens.size() - 1));
        }
        return folded;
    }
}
