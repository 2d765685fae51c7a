package com.example.manifestextract.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores header cells against target field aliases and binds fields to columns.
 *
 * <p>An exact alias scores 1.0. Containment of whole words in either direction (at least three characters) scores between 0.6 and 1.0 depending on
 * how much of the longer text the shorter one covers. Anything else only counts when token overlap or
 * edit-distance similarity reaches {@link #SIMILARITY_FLOOR}, and then scores below every containment
 * match.
 */
public class ColumnMatcher {

    static final double SIMILARITY_FLOOR = 0.85;

    private static final int MIN_CONTAINMENT_LENGTH = 3;
    private static final double CONTAINMENT_BASE = 0.6;
    private static final double FUZZY_WEIGHT = 0.6;

    public boolean matches(String normalizedCell, TargetField field) {
        return score(normalizedCell, field) > 0;
    }

    /**
     * Best score of the cell over all aliases of the field, or 0 when it matches none.
     */
    public double score(String normalizedCell, TargetField field) {
        if (normalizedCell == null || normalizedCell.isBlank()) {
            return 0;
        }
        double best = 0;
        for (String alias : normalizedAliases(field)) {
            best = Math.max(best, scoreAlias(normalizedCell, alias));
            if (best >= 1.0) {
                break;
            }
        }
        return best;
    }

    /**
     * Binds each field to at most one column and each column to at most one field. Pairs are taken by
     * descending score, then field declaration order, then leftmost column.
     *
     * @param normalizedCells header row, already normalized, indexed by column
     * @return field key to 0-based column index, in field declaration order
     */
    public Map<String, Integer> mapColumns(List<String> normalizedCells, List<TargetField> fields) {
        List<Pairing> pairings = new ArrayList<>();
        for (int f = 0; f < fields.size(); f++) {
            TargetField field = fields.get(f);
            for (int c = 0; c < normalizedCells.size(); c++) {
                double score = score(normalizedCells.get(c), field);
                if (score > 0) {
                    pairings.add(new Pairing(f, c, score));
                }
            }
        }
        pairings.sort(Comparator.comparingDouble(Pairing::score).reversed()
                .thenComparingInt(Pairing::fieldIndex)
                .thenComparingInt(Pairing::columnIndex));

        Map<Integer, Integer> columnByField = new LinkedHashMap<>();
        Set<Integer> usedColumns = new HashSet<>();
        for (Pairing pairing : pairings) {
            if (columnByField.containsKey(pairing.fieldIndex()) || usedColumns.contains(pairing.columnIndex())) {
                continue;
            }
            columnByField.put(pairing.fieldIndex(), pairing.columnIndex());
            usedColumns.add(pairing.columnIndex());
        }

        Map<String, Integer> mapping = new LinkedHashMap<>();
        for (int f = 0; f < fields.size(); f++) {
            Integer column = columnByField.get(f);
            if (column != null) {
                mapping.put(fields.get(f).key(), column);
            }
        }
        return mapping;
    }

    private Set<String> normalizedAliases(TargetField field) {
        Set<String> aliases = new LinkedHashSet<>();
        aliases.add(HeaderNormalizer.normalize(field.key()));
        for (String alias : field.aliases()) {
            String normalized = HeaderNormalizer.normalize(alias);
            if (!normalized.isBlank()) {
                aliases.add(normalized);
            }
        }
        aliases.remove("");
        return aliases;
    }

    private double scoreAlias(String cell, String alias) {
        if (cell.equals(alias)) {
            return 1.0;
        }
        int shorter = Math.min(cell.length(), alias.length());
        if (shorter >= MIN_CONTAINMENT_LENGTH && (containsWords(cell, alias) || containsWords(alias, cell))) {
            double coverage = (double) shorter / Math.max(cell.length(), alias.length());
            return CONTAINMENT_BASE + (1.0 - CONTAINMENT_BASE) * coverage;
        }
        double similarity = Math.max(tokenJaccard(cell, alias), editSimilarity(cell, alias));
        if (similarity >= SIMILARITY_FLOOR) {
            return FUZZY_WEIGHT * similarity;
        }
        return 0;
    }

    /**
     * Whether {@code part} occurs in {@code text} starting and ending on word boundaries.
     */
    static boolean containsWords(String text, String part) {
        int from = text.indexOf(part);
        while (from >= 0) {
            int end = from + part.length();
            boolean startsOnBoundary = from == 0 || !Character.isLetterOrDigit(text.charAt(from - 1));
            boolean endsOnBoundary = end == text.length() || !Character.isLetterOrDigit(text.charAt(end));
            if (startsOnBoundary && endsOnBoundary) {
                return true;
            }
            from = text.indexOf(part, from + 1);
        }
        return false;
    }

    private static double tokenJaccard(String a, String b) {
        Set<String> left = new HashSet<>(Arrays.asList(a.split(" ")));
        Set<String> right = new HashSet<>(Arrays.asList(b.split(" ")));
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        if (union.isEmpty()) {
            return 0;
        }
        left.retainAll(right);
        return (double) left.size() / union.size();
    }

    private static double editSimilarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 0;
        }
        return 1.0 - (double) levenshtein(a, b) / longest;
    }

    private static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private record Pairing(int fieldIndex, int columnIndex, double score) {
    }
}
