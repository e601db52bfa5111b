package me.golemcore.chronicle.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Jaccard similarity over lowercased, whitespace-separated word sets.
 */
public final class JaccardSimilarity {

    private JaccardSimilarity() {
    }

    /**
     * @return |A ∩ B| / |A ∪ B| of the two word sets, or 0.0 if either text has
     *         no words
     */
    public static double similarity(String left, String right) {
        Set<String> a = words(left);
        Set<String> b = words(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    static Set<String> words(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        Set<String> words = new HashSet<>(Arrays.asList(text.trim().toLowerCase(Locale.ROOT).split("\\s+")));
        words.remove("");
        return words;
    }
}
