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

package me.golemcore.recall.domain.classifier;

import me.golemcore.recall.domain.model.CorrectionCategory;
import me.golemcore.recall.domain.model.CorrectionSignal;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects whether a user message corrects the agent.
 *
 * <p>
 * Two weighted rule tables are evaluated top to bottom and every matching rule
 * accumulates its weight under its category:
 * <ul>
 * <li>strong signals weigh {@value #STRONG_WEIGHT} each; one is enough to
 * detect a correction</li>
 * <li>weak signals weigh {@value #WEAK_WEIGHT} each; two are needed</li>
 * </ul>
 * The reported category is the one with the highest accumulated weight. On a
 * tie the category that matched first in table order wins.
 */
public final class CorrectionDetector {

    static final double STRONG_WEIGHT = 0.4;
    static final double WEAK_WEIGHT = 0.15;

    private static final int MIN_MESSAGE_LENGTH = 3;

    private static final List<CorrectionRule> STRONG_RULES = List.of(
            strong("\\b(that'?s|it'?s) (wrong|incorrect|not right)\\b", CorrectionCategory.FACTUAL),
            strong("\\bactually,? (it'?s|the|that)\\b", CorrectionCategory.FACTUAL),
            strong("\\bstop (doing|saying|using|adding)\\b", CorrectionCategory.BEHAVIORAL),
            strong("\\b(never|don'?t ever)\\b", CorrectionCategory.BEHAVIORAL),
            strong("\\bthat'?s not (how|what) i\\b", CorrectionCategory.PROCEDURAL),
            strong("\\bi'?d (rather|prefer)\\b", CorrectionCategory.PREFERENCE),
            strong("\\bnot what i (asked|wanted|meant)\\b", CorrectionCategory.PROCEDURAL));

    private static final List<CorrectionRule> WEAK_RULES = List.of(
            weak("^no\\b", CorrectionCategory.FACTUAL),
            weak("\\bwrong\\b", CorrectionCategory.FACTUAL),
            weak("\\binstead\\b", CorrectionCategory.PREFERENCE),
            weak("\\bshould(n'?t)? (have|be)\\b", CorrectionCategory.PROCEDURAL),
            weak("\\balways\\b", CorrectionCategory.BEHAVIORAL),
            weak("\\bprefer\\b", CorrectionCategory.PREFERENCE),
            weak("\\b(incorrect|mistake|typo)\\b", CorrectionCategory.FACTUAL),
            weak("\\bplease don'?t\\b", CorrectionCategory.BEHAVIORAL),
            weak("\\b(again|already told you)\\b", CorrectionCategory.BEHAVIORAL));

    private CorrectionDetector() {
    }

    public static CorrectionSignal detect(String userMessage) {
        return detect(userMessage, null, null);
    }

    /**
     * Scores the latest user message.
     *
     * @param userMessage
     *            the message to inspect
     * @param previousAgentMessage
     *            what the agent said just before, carried into the signal
     * @param previousUserMessage
     *            the user's previous turn, currently unused by the rules
     */
    public static CorrectionSignal detect(String userMessage, String previousAgentMessage,
            String previousUserMessage) {
        if (userMessage == null || userMessage.trim().length() < MIN_MESSAGE_LENGTH) {
            return CorrectionSignal.none(userMessage, previousAgentMessage);
        }

        String normalized = userMessage.replace('’', '\'').toLowerCase(Locale.ROOT).trim();

        Map<CorrectionCategory, Double> weights = new LinkedHashMap<>();
        int strongMatches = accumulate(STRONG_RULES, normalized, weights);
        int weakMatches = accumulate(WEAK_RULES, normalized, weights);

        boolean detected = strongMatches >= 1 || weakMatches >= 2;
        if (!detected) {
            return CorrectionSignal.none(userMessage, previousAgentMessage);
        }

        double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        double confidence = Math.round(Math.min(1.0, total) * 100.0) / 100.0;

        CorrectionCategory category = null;
        double best = -1;
        for (Map.Entry<CorrectionCategory, Double> entry : weights.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                category = entry.getKey();
            }
        }

        return new CorrectionSignal(true, confidence, userMessage, previousAgentMessage, category);
    }

    private static int accumulate(List<CorrectionRule> rules, String text, Map<CorrectionCategory, Double> weights) {
        int matches = 0;
        for (CorrectionRule rule : rules) {
            if (rule.pattern().matcher(text).find()) {
                matches++;
                weights.merge(rule.category(), rule.weight(), Double::sum);
            }
        }
        return matches;
    }

    private static CorrectionRule strong(String regex, CorrectionCategory category) {
        return new CorrectionRule(Pattern.compile(regex), STRONG_WEIGHT, category);
    }

    private static CorrectionRule weak(String regex, CorrectionCategory category) {
        return new CorrectionRule(Pattern.compile(regex), WEAK_WEIGHT, category);
    }

    private record CorrectionRule(Pattern pattern, double weight, CorrectionCategory category) {
    }
}
