package com.ftsquery.text;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class StopWords {

    /** 标准停用词表，保持原始顺序 */
    public static final List<String> STANDARD = List.of(
        "$", "0", "1", "2", "3", "4", "5", "6", "7", "8", "9", "A", "B", "C", "D",
        "E", "F", "G", "H", "I", "J", "K", "L", "M", "N", "O", "P", "Q", "R", "S",
        "T", "U", "V", "W", "X", "Y", "Z", "about", "after", "all", "also", "an",
        "and", "another", "any", "are", "as", "at", "be", "because", "been",
        "before", "being", "between", "both", "but", "by", "came", "can", "come",
        "could", "did", "do", "does", "each", "else", "for", "from", "get", "got",
        "had", "has", "have", "he", "her", "here", "him", "himself", "his", "how",
        "if", "in", "into", "is", "it", "its", "just", "like", "make", "many", "me",
        "might", "more", "most", "much", "must", "my", "never", "no", "now", "of",
        "on", "only", "or", "other", "our", "out", "over", "re", "said", "same",
        "see", "should", "since", "so", "some", "still", "such", "take", "than",
        "that", "the", "their", "them", "then", "there", "these", "they", "this",
        "those", "through", "to", "too", "under", "up", "use", "very", "want", "was",
        "way", "we", "well", "were", "what", "when", "where", "which", "while",
        "who", "will", "with", "would", "you", "your"
    );

    private StopWords() {
    }

    /**
     * 按顺序合并标准停用词与附加停用词，返回不可变集合。
     */
    public static Set<String> of(boolean includeStandard, Collection<String> additional) {
        Set<String> words = new LinkedHashSet<>();
        if (includeStandard) {
            words.addAll(STANDARD);
        }
        if (additional != null) {
            for (String word : additional) {
                if (word != null) {
                    words.add(word);
                }
            }
        }
        return Collections.unmodifiableSet(words);
    }
}
