package com.phonetic.matching.dm;

import com.phonetic.matching.encoder.Encoder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Daitch-Mokotoff Soundex: six-digit codes, several of them when a rule offers alternatives.
 *
 * <p>{@link #encode(String)} returns the first code only, {@link #soundex(String)} returns every
 * code joined with {@code |} in the order the branches were discovered.</p>
 */
public class DaitchMokotoffSoundex implements Encoder {

    private static final int MAX_LENGTH = 6;

    private final DaitchMokotoffRules rules;
    private final boolean folding;

    /**
     * Bundled rules with ASCII folding.
     */
    public DaitchMokotoffSoundex() {
        this(DaitchMokotoffRules.bundled(), true);
    }

    public DaitchMokotoffSoundex(DaitchMokotoffRules rules, boolean folding) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.folding = folding;
    }

    public boolean isFolding() {
        return folding;
    }

    @Override
    public String getName() {
        return "daitch-mokotoff";
    }

    @Override
    public String encode(String value) {
        Objects.requireNonNull(value, "value");
        return soundex(value, false).get(0);
    }

    /**
     * Every code of the value, {@code |}-separated.
     */
    public String soundex(String value) {
        Objects.requireNonNull(value, "value");
        return String.join("|", soundex(value, true));
    }

    private List<String> soundex(String value, boolean branching) {
        String input = cleanup(value);

        // branch text -> last replacement appended on that branch; first insertion wins
        Map<String, String> branches = new LinkedHashMap<>();
        branches.put("", null);

        char lastChar = '\0';
        for (int index = 0; index < input.length(); index++) {
            char ch = input.charAt(index);
            List<DaitchMokotoffRule> candidates = rules.rulesFor(ch);
            if (candidates == null) {
                continue;
            }

            String context = input.substring(index);
            for (DaitchMokotoffRule rule : candidates) {
                if (!rule.matches(context)) {
                    continue;
                }
                List<String> replacements = rule.replacements(context, lastChar == '\0');
                boolean force = (lastChar == 'm' && ch == 'n') || (lastChar == 'n' && ch == 'm');

                Map<String, String> next = new LinkedHashMap<>();
                for (Map.Entry<String, String> branch : branches.entrySet()) {
                    for (String replacement : replacements) {
                        String code = append(branch.getKey(), branch.getValue(), replacement, force);
                        next.putIfAbsent(code, replacement);
                        if (!branching) {
                            break;
                        }
                    }
                }
                branches = next;
                index += rule.pattern().length() - 1;
                break;
            }
            lastChar = ch;
        }

        List<String> codes = new ArrayList<>(branches.size());
        for (String code : branches.keySet()) {
            codes.add(pad(code));
        }
        return codes;
    }

    private static String append(String code, String lastReplacement, String replacement, boolean force) {
        boolean shouldAppend = lastReplacement == null || !lastReplacement.endsWith(replacement) || force;
        if (shouldAppend && code.length() < MAX_LENGTH) {
            String appended = code + replacement;
            return appended.length() > MAX_LENGTH ? appended.substring(0, MAX_LENGTH) : appended;
        }
        return code;
    }

    private String cleanup(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (Character.isWhitespace(ch)) {
                continue;
            }
            ch = Character.toLowerCase(ch);
            sb.append(folding ? rules.fold(ch) : ch);
        }
        return sb.toString();
    }

    private static String pad(String code) {
        StringBuilder sb = new StringBuilder(code);
        while (sb.length() < MAX_LENGTH) {
            sb.append('0');
        }
        return sb.toString();
    }
}
