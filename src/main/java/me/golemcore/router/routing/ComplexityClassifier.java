package me.golemcore.router.routing;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.ComplexityScore;
import me.golemcore.router.domain.model.RequestCategory;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic triage of a request into the single-call or the multi-agent path.
 *
 * <p>
 * Pure and deterministic: the score depends on the text only. Scoring:
 * <ol>
 * <li>Base from word count: up to 12 words is 1, up to 30 is 2, up to 60 is
 * 3, up to 120 is 4, longer is 5.</li>
 * <li>+1 per kind of multi-step signal, at most +2: sequencing connectives
 * ("then", "after that", "followed by", "finally"), explicit steps ("step 1",
 * two or more numbered or bulleted lines), enumerations (two or more commas
 * plus "and"). A list inside a short question names things to look up, not
 * steps, so enumerations are not counted there.</li>
 * <li>Category by keyword set, first match wins: business strategy,
 * multi-file code, research, coding, creative. Business strategy, multi-file
 * code and research add +1.</li>
 * <li>A short single-sentence question ("what", "who", "how many", ...) with
 * none of the above is capped at 2 and categorised as factual.</li>
 * <li>A short question that also carries multi-step signals or an inherently
 * multi-step category is ambiguous and goes to the multi-agent path.</li>
 * </ol>
 * The multi-agent path is required when the clamped score reaches
 * {@code router.classifier.multi-agent-threshold} (3 by default), the category
 * is inherently multi-step, or the request is ambiguous.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ComplexityClassifier {

    static final int SIMPLE_QUESTION_MAX_WORDS = 12;
    static final int SIMPLE_QUESTION_CAP = 2;
    private static final int MAX_SIGNAL_BONUS = 2;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]+\\s+\\S");
    private static final Pattern QUESTION_START = Pattern.compile(
            "^(what|who|when|where|which|how much|how many|is|are|does|do|define)\\b");

    private static final Pattern SEQUENCING = Pattern.compile(
            "\\b(then|after that|afterwards|followed by|finally)\\b|\\bnext,");
    private static final Pattern EXPLICIT_STEP = Pattern.compile("\\bstep\\s*\\d+");
    private static final Pattern LIST_LINE = Pattern.compile("(?m)^\\s*(\\d+[.)]|[-*•])\\s+\\S");
    private static final Pattern AND_WORD = Pattern.compile("\\band\\b");

    private static final Map<RequestCategory, Pattern> CATEGORY_KEYWORDS = new LinkedHashMap<>();

    static {
        CATEGORY_KEYWORDS.put(RequestCategory.BUSINESS_STRATEGY, Pattern.compile(
                "\\b(strategy|strategic|business plan|marketing|market analysis|go-to-market|budget|roadmap"
                        + "|revenue model|competitive analysis)\\b"));
        CATEGORY_KEYWORDS.put(RequestCategory.MULTI_FILE_CODE, Pattern.compile(
                "\\b(refactor\\w*|multiple files|multi-file|codebase|project structure|full[- ]stack"
                        + "|across (the )?(files|modules|project)|(entire|whole) (app|application|project))\\b"));
        CATEGORY_KEYWORDS.put(RequestCategory.RESEARCH, Pattern.compile(
                "\\b(research|compare|comparison|analy[sz]e|analysis|investigate|evaluate|pros and cons)\\b"));
        CATEGORY_KEYWORDS.put(RequestCategory.CODING, Pattern.compile(
                "\\b(code|function|script|bug|debug|implement|compile|python|java|javascript|sql|regex)\\b"));
        CATEGORY_KEYWORDS.put(RequestCategory.CREATIVE, Pattern.compile(
                "\\b(write|draft|story|poem|essay|slogan|compose|lyrics)\\b"));
    }

    private final int multiAgentThreshold;

    public ComplexityClassifier(RouterProperties properties) {
        this.multiAgentThreshold = properties.getClassifier().getMultiAgentThreshold();
    }

    /**
     * Score a request.
     */
    public ComplexityScore analyze(String text) {
        if (text == null || text.isBlank()) {
            return new ComplexityScore(ComplexityScore.MIN, false, RequestCategory.GENERAL, false);
        }
        String trimmed = text.trim();
        String normalized = trimmed.toLowerCase(Locale.ROOT);
        int words = WHITESPACE.split(normalized).length;

        boolean simpleQuestion = isSimpleQuestion(normalized, words);
        int signals = countSignalKinds(trimmed, normalized, !simpleQuestion);
        RequestCategory keywordCategory = detectCategory(normalized);

        RequestCategory category = keywordCategory;
        if (category == null) {
            category = simpleQuestion ? RequestCategory.FACTUAL : RequestCategory.GENERAL;
        }
        int categoryBonus = category.isInherentlyMultiStep() || category == RequestCategory.RESEARCH ? 1 : 0;

        int value = baseFromLength(words) + Math.min(signals, MAX_SIGNAL_BONUS) + categoryBonus;
        boolean ambiguous = simpleQuestion && (signals > 0 || category.isInherentlyMultiStep());
        if (simpleQuestion && signals == 0 && categoryBonus == 0) {
            value = Math.min(value, SIMPLE_QUESTION_CAP);
        }
        value = Math.max(ComplexityScore.MIN, Math.min(ComplexityScore.MAX, value));

        boolean requiresMultiAgent = value >= multiAgentThreshold
                || category.isInherentlyMultiStep()
                || ambiguous;
        if (ambiguous) {
            log.debug("[Classifier] Ambiguous request resolved to multi-agent path (category={})", category);
        }
        return new ComplexityScore(value, requiresMultiAgent, category, ambiguous);
    }

    static int baseFromLength(int words) {
        if (words <= 12) {
            return 1;
        }
        if (words <= 30) {
            return 2;
        }
        if (words <= 60) {
            return 3;
        }
        if (words <= 120) {
            return 4;
        }
        return 5;
    }

    private int countSignalKinds(String original, String normalized, boolean countEnumerations) {
        int kinds = 0;
        if (SEQUENCING.matcher(normalized).find()) {
            kinds++;
        }
        if (EXPLICIT_STEP.matcher(normalized).find() || countListLines(original) >= 2) {
            kinds++;
        }
        if (countEnumerations && countCommas(normalized) >= 2 && AND_WORD.matcher(normalized).find()) {
            kinds++;
        }
        return kinds;
    }

    private RequestCategory detectCategory(String normalized) {
        for (Map.Entry<RequestCategory, Pattern> entry : CATEGORY_KEYWORDS.entrySet()) {
            if (entry.getValue().matcher(normalized).find()) {
                return entry.getKey();
            }
        }
        return null;
    }

    private boolean isSimpleQuestion(String normalized, int words) {
        return words <= SIMPLE_QUESTION_MAX_WORDS
                && QUESTION_START.matcher(normalized).find()
                && !SENTENCE_BREAK.matcher(normalized).find();
    }

    private static int countListLines(String text) {
        Matcher matcher = LIST_LINE.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static int countCommas(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == ',') {
                count++;
            }
        }
        return count;
    }
}
