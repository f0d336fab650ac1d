package com.lorekeeper.core.curator;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Default agreement measure.
 * <p>
 * When both claims are a single number (optionally with a unit), disagreement is the relative
 * difference {@code |a-b| / max(|a|,|b|)}. Otherwise it is {@code 1 - Jaccard} over the sets of
 * lower-cased word tokens.
 */
@Component
public class TokenAgreementPolicy implements AgreementPolicy {

    private static final Pattern NUMERIC = Pattern.compile("^\\s*(-?\\d+(?:\\.\\d+)?)\\s*([\\p{L}°%/]*)\\s*$");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}.]+");

    @Override
    public double disagreement(String a, String b) {
        if (a == null || b == null) {
            return a == b ? 0.0 : 1.0;
        }
        Matcher ma = NUMERIC.matcher(a);
        Matcher mb = NUMERIC.matcher(b);
        if (ma.matches() && mb.matches() && ma.group(2).equalsIgnoreCase(mb.group(2))) {
            double x = Double.parseDouble(ma.group(1));
            double y = Double.parseDouble(mb.group(1));
            double scale = Math.max(Math.abs(x), Math.abs(y));
            return scale == 0.0 ? 0.0 : Math.min(1.0, Math.abs(x - y) / scale);
        }
        Set<String> ta = tokens(a);
        Set<String> tb = tokens(b);
        if (ta.isEmpty() && tb.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(ta);
        union.addAll(tb);
        Set<String> intersection = new HashSet<>(ta);
        intersection.retainAll(tb);
        return 1.0 - (double) intersection.size() / union.size();
    }

    static Set<String> tokens(String text) {
        return Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
                .map(t -> t.endsWith(".") ? t.substring(0, t.length() - 1) : t)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }
}
