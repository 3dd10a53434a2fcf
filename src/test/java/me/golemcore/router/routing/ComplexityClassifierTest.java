package me.golemcore.router.routing;

import me.golemcore.router.domain.model.ComplexityScore;
import me.golemcore.router.domain.model.RequestCategory;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityClassifierTest {

    private ComplexityClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ComplexityClassifier(new RouterProperties());
    }

    // ===== Simple requests =====

    @Test
    void shouldScoreShortFactualQuestionAsSimple() {
        ComplexityScore score = classifier.analyze("What is 2+2?");

        assertTrue(score.value() <= 2);
        assertFalse(score.requiresMultiAgent());
        assertEquals(RequestCategory.FACTUAL, score.category());
        assertFalse(score.ambiguous());
    }

    @Test
    void shouldKeepShortQuestionWithEnumerationOnDirectPath() {
        ComplexityScore score = classifier.analyze("Who wrote Hamlet, Macbeth, and Othello?");

        assertEquals(RequestCategory.FACTUAL, score.category());
        assertTrue(score.value() <= 2);
        assertFalse(score.ambiguous());
        assertFalse(score.requiresMultiAgent());
    }

    @Test
    void shouldScoreBlankTextAsMinimum() {
        ComplexityScore score = classifier.analyze("   ");

        assertEquals(ComplexityScore.MIN, score.value());
        assertFalse(score.requiresMultiAgent());
        assertEquals(RequestCategory.GENERAL, score.category());
    }

    @Test
    void shouldKeepShortCodingRequestOnDirectPath() {
        ComplexityScore score = classifier.analyze("Write a Python function that reverses a string");

        assertEquals(RequestCategory.CODING, score.category());
        assertEquals(1, score.value());
        assertFalse(score.requiresMultiAgent());
    }

    @Test
    void shouldAddBonusForResearchWithoutForcingMultiAgent() {
        ComplexityScore score = classifier.analyze("Compare PostgreSQL and MySQL for analytics workloads");

        assertEquals(RequestCategory.RESEARCH, score.category());
        assertEquals(2, score.value());
        assertFalse(score.requiresMultiAgent());
    }

    // ===== Multi-step requests =====

    @Test
    void shouldScoreMarketingStrategyAsComplex() {
        ComplexityScore score = classifier.analyze("Develop a full marketing strategy with budget, timeline, "
                + "and audience segmentation, then draft three ad variants");

        assertTrue(score.value() >= 4);
        assertTrue(score.requiresMultiAgent());
        assertEquals(RequestCategory.BUSINESS_STRATEGY, score.category());
    }

    @Test
    void shouldRouteMultiFileCodeToMultiAgent() {
        ComplexityScore score = classifier.analyze("Refactor the authentication module across the project");

        assertEquals(RequestCategory.MULTI_FILE_CODE, score.category());
        assertTrue(score.requiresMultiAgent());
    }

    @Test
    void shouldCountNumberedListAsMultiStep() {
        ComplexityScore score = classifier.analyze("Please do the following:\n1. Fetch the data\n2. Clean it\n"
                + "3. Plot it");

        assertEquals(3, score.value());
        assertTrue(score.requiresMultiAgent());
    }

    @Test
    void shouldScoreVeryLongTextAtMaximum() {
        ComplexityScore score = classifier.analyze("word ".repeat(130));

        assertEquals(ComplexityScore.MAX, score.value());
        assertTrue(score.requiresMultiAgent());
    }

    @Test
    void shouldClampScoreAtMaximum() {
        String text = "Build a business plan and marketing strategy, step 1 research, step 2 budget, and then "
                + "finally a roadmap. " + "Include every detail you can think of here. ".repeat(20);

        ComplexityScore score = classifier.analyze(text);

        assertEquals(ComplexityScore.MAX, score.value());
    }

    // ===== Ambiguity =====

    @Test
    void shouldResolveShortStrategyQuestionAsAmbiguous() {
        ComplexityScore score = classifier.analyze("What is the best marketing strategy?");

        assertTrue(score.ambiguous());
        assertTrue(score.requiresMultiAgent());
        assertEquals(RequestCategory.BUSINESS_STRATEGY, score.category());
    }

    @Test
    void shouldResolveShortQuestionWithSequencingAsAmbiguous() {
        ComplexityScore score = classifier.analyze("What do I install first, then configure?");

        assertTrue(score.ambiguous());
        assertTrue(score.requiresMultiAgent());
        assertEquals(2, score.value());
    }

    // ===== Threshold =====

    @Test
    void shouldHonourConfiguredThreshold() {
        RouterProperties properties = new RouterProperties();
        properties.getClassifier().setMultiAgentThreshold(5);
        ComplexityClassifier strict = new ComplexityClassifier(properties);

        ComplexityScore score = strict.analyze("Please do the following:\n1. Fetch the data\n2. Clean it\n"
                + "3. Plot it");

        assertEquals(3, score.value());
        assertFalse(score.requiresMultiAgent());
    }

    @Test
    void shouldMapWordCountToBase() {
        assertEquals(1, ComplexityClassifier.baseFromLength(12));
        assertEquals(2, ComplexityClassifier.baseFromLength(13));
        assertEquals(3, ComplexityClassifier.baseFromLength(60));
        assertEquals(4, ComplexityClassifier.baseFromLength(120));
        assertEquals(5, ComplexityClassifier.baseFromLength(121));
    }
}
