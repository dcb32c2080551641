package de.mirkosertic.pwstrength.matcher;

import de.mirkosertic.pwstrength.CancellationToken;
import de.mirkosertic.pwstrength.model.DictionaryMatch;
import de.mirkosertic.pwstrength.model.L33tMatch;
import de.mirkosertic.pwstrength.model.Match;
import de.mirkosertic.pwstrength.scoring.PasswordScoring;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches dictionary words written with l33t substitutions, e.g. {@code p4$$w0rd} or {@code 1ov3}.
 *
 * <p>The password is translated back to plain characters and run through the given dictionary
 * matchers. A l33t character with several plain readings ({@code 1} for {@code i} or {@code l}) yields
 * one translation per reading. Only matches whose token actually contains a substituted character are
 * reported; the rest are found by the plain dictionary matchers anyway.</p>
 */
public final class L33tMatcher implements Matcher {

    /**
     * Plain character to the l33t characters that can stand for it.
     */
    private static final Map<Character, String> SUBSTITUTIONS = buildSubstitutionTable();

    private record MatchKey(String dictionaryName, int i, int j, String matchedWord) {
    }

    private final List<DictionaryMatcher> dictionaryMatchers;

    public L33tMatcher(final List<DictionaryMatcher> dictionaryMatchers) {
        this.dictionaryMatchers = List.copyOf(dictionaryMatchers);
    }

    private static Map<Character, String> buildSubstitutionTable() {
        final Map<Character, String> table = new LinkedHashMap<>();
        table.put('a', "4@");
        table.put('b', "8");
        table.put('c', "({[<");
        table.put('e', "3");
        table.put('g', "69");
        table.put('i', "1!|");
        table.put('l', "1|7");
        table.put('o', "0");
        table.put('s', "$5");
        table.put('t', "+7");
        table.put('x', "%");
        table.put('z', "2");
        return table;
    }

    @Override
    public List<Match> match(final String password, final CancellationToken cancel) {
        cancel.throwIfCancellationRequested();

        final Map<Character, String> relevant = relevantSubstitutions(password);
        if (relevant.isEmpty() || dictionaryMatchers.isEmpty()) {
            return List.of();
        }

        final Map<MatchKey, Match> matches = new LinkedHashMap<>();
        for (final Map<Character, Character> mapping : enumerateMappings(relevant)) {
            final String translated = translate(password, mapping);
            for (final DictionaryMatcher dictionaryMatcher : dictionaryMatchers) {
                for (final DictionaryMatch match : dictionaryMatcher.matchDictionary(translated, cancel)) {
                    final String token = password.substring(match.i(), match.j() + 1);
                    final Map<Character, Character> used = usedSubstitutions(token, mapping);
                    if (used.isEmpty()) {
                        continue;
                    }
                    final MatchKey key = new MatchKey(match.dictionaryName(), match.i(), match.j(), match.matchedWord());
                    matches.putIfAbsent(key, toL33tMatch(match, token, used));
                }
            }
        }
        return new ArrayList<>(matches.values());
    }

    private static L33tMatch toL33tMatch(final DictionaryMatch match, final String token,
                                         final Map<Character, Character> used) {
        final double l33tEntropy = l33tEntropy(token, used);
        // The dictionary matcher saw the translated text, so capitalization is scored again on the original
        final double uppercaseEntropy = PasswordScoring.uppercaseEntropy(token);
        return new L33tMatch(token, match.i(), match.j(),
                match.baseEntropy() + uppercaseEntropy + l33tEntropy,
                match.cardinality(), match.matchedWord(), match.rank(), match.dictionaryName(),
                match.baseEntropy(), uppercaseEntropy, l33tEntropy, used);
    }

    /**
     * Bits for the choice of substituted positions, at least one.
     */
    static double l33tEntropy(final String token, final Map<Character, Character> used) {
        double possibilities = 0;
        for (final Map.Entry<Character, Character> substitution : used.entrySet()) {
            final int subbed = count(token, substitution.getKey());
            final int unsubbed = count(token, substitution.getValue());
            possibilities += PasswordScoring.sumOfBinomials(subbed + unsubbed, Math.min(subbed, unsubbed));
        }
        final double entropy = PasswordScoring.log2(possibilities);
        // A single substitution (4pple) would otherwise score zero bits
        return entropy < 1 ? 1 : entropy;
    }

    private static int count(final String token, final char c) {
        int count = 0;
        for (int i = 0; i < token.length(); i++) {
            if (token.charAt(i) == c) {
                count++;
            }
        }
        return count;
    }

    /**
     * Substitutions restricted to the l33t characters present in the password.
     */
    static Map<Character, String> relevantSubstitutions(final String password) {
        final Map<Character, String> relevant = new LinkedHashMap<>();
        for (final Map.Entry<Character, String> entry : SUBSTITUTIONS.entrySet()) {
            final StringBuilder present = new StringBuilder();
            for (final char l33t : entry.getValue().toCharArray()) {
                if (password.indexOf(l33t) >= 0) {
                    present.append(l33t);
                }
            }
            if (!present.isEmpty()) {
                relevant.put(entry.getKey(), present.toString());
            }
        }
        return relevant;
    }

    /**
     * All l33t to plain mappings. A l33t character claimed by several plain characters forks every
     * mapping built so far.
     */
    static List<Map<Character, Character>> enumerateMappings(final Map<Character, String> table) {
        final List<Map<Character, Character>> mappings = new ArrayList<>();
        mappings.add(new LinkedHashMap<>());

        for (final Map.Entry<Character, String> entry : table.entrySet()) {
            final char plain = entry.getKey();
            for (final char l33t : entry.getValue().toCharArray()) {
                final List<Map<Character, Character>> forks = new ArrayList<>();
                for (final Map<Character, Character> mapping : mappings) {
                    if (mapping.containsKey(l33t)) {
                        final Map<Character, Character> fork = new LinkedHashMap<>(mapping);
                        fork.put(l33t, plain);
                        forks.add(fork);
                    } else {
                        mapping.put(l33t, plain);
                    }
                }
                mappings.addAll(forks);
            }
        }
        return mappings;
    }

    private static String translate(final String password, final Map<Character, Character> mapping) {
        final char[] chars = password.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            final Character plain = mapping.get(chars[i]);
            if (plain != null) {
                chars[i] = plain;
            }
        }
        return new String(chars);
    }

    private static Map<Character, Character> usedSubstitutions(final String token,
                                                               final Map<Character, Character> mapping) {
        final Map<Character, Character> used = new LinkedHashMap<>();
        for (final Map.Entry<Character, Character> entry : mapping.entrySet()) {
            if (token.indexOf(entry.getKey()) >= 0) {
                used.put(entry.getKey(), entry.getValue());
            }
        }
        return used;
    }
}
