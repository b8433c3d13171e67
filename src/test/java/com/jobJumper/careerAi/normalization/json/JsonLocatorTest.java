package com.jobJumper.careerAi.normalization.json;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonLocatorTest {

    private final JsonLocator jsonLocator = new JsonLocator();

    @Test
    void locate_shouldFindObjectWrappedInProseAndFences() {
        LocateResult result = jsonLocator.locate(
                "Sure, here's the result:\n```json\n{\"score\": 72, \"summary\": \"Good fit\"}\n```");

        assertThat(result.isFound()).isTrue();
        assertThat(result.getValue().get("score").intValue()).isEqualTo(72);
        assertThat(result.getValue().get("summary").textValue()).isEqualTo("Good fit");
    }

    @Test
    void locate_shouldFailWhenNoBracesPresent() {
        LocateResult result = jsonLocator.locate("I could not produce a score for this job, sorry.");

        assertThat(result.isFound()).isFalse();
        assertThat(result.getError()).isEqualTo(ParseError.UNPARSABLE);
        assertThat(result.getValue().isMissingNode()).isTrue();
    }

    @Test
    void locate_shouldFailForNullOrBlankInput() {
        assertThat(jsonLocator.locate(null).getError()).isEqualTo(ParseError.UNPARSABLE);
        assertThat(jsonLocator.locate("   ").getError()).isEqualTo(ParseError.UNPARSABLE);
    }

    @Test
    void locate_shouldIgnoreBracesInsideStringLiterals() {
        LocateResult result = jsonLocator.locate(
                "Result: {\"summary\": \"use } carefully {\", \"score\": 5} and a stray } here");

        assertThat(result.isFound()).isTrue();
        assertThat(result.getValue().get("summary").textValue()).isEqualTo("use } carefully {");
        assertThat(result.getValue().get("score").intValue()).isEqualTo(5);
    }

    @Test
    void locate_shouldSkipUnparsableCandidateAndTryNextBrace() {
        LocateResult result = jsonLocator.locate("Fill in {name} first, then: {\"score\": 1}");

        assertThat(result.isFound()).isTrue();
        assertThat(result.getValue().get("score").intValue()).isEqualTo(1);
    }

    @Test
    void locate_shouldFailForTruncatedObject() {
        LocateResult result = jsonLocator.locate("{\"score\": 5, \"summary\": \"abc");

        assertThat(result.isFound()).isFalse();
        assertThat(result.getError()).isEqualTo(ParseError.UNPARSABLE);
    }

    @Test
    void locate_shouldNotReturnNestedObjectOfTruncatedRecord() {
        LocateResult jobFit = jsonLocator.locate("{\"keyInfo\": {\"title\": \"Engineer\"},"
                + " \"matchAnalysis\": {\"overallScore\": 80, \"summary\": \"Strong");
        LocateResult score = jsonLocator.locate("{\"score\": 72, \"detail\": {\"note\": \"x\"}, \"summary\": \"Good");

        assertThat(jobFit.isFound()).isFalse();
        assertThat(jobFit.getError()).isEqualTo(ParseError.UNPARSABLE);
        assertThat(score.isFound()).isFalse();
        assertThat(score.getValue().isMissingNode()).isTrue();
    }

    @Test
    void locate_shouldNotEnterRejectedSpan() {
        // closes, but is not valid JSON even leniently
        LocateResult result = jsonLocator.locate("{\"a\": {\"b\": 1}, oops oops} then {\"score\": 3}");

        assertThat(result.isFound()).isTrue();
        assertThat(result.getValue().get("score").intValue()).isEqualTo(3);
        assertThat(result.getValue().has("b")).isFalse();
    }

    @Test
    void locate_shouldTolerateCommonJsonDrift() {
        LocateResult result = jsonLocator.locate("{score: 5, 'summary': 'ok', // note\n \"gaps\": [\"a\",],}");

        assertThat(result.isFound()).isTrue();
        assertThat(result.getValue().get("score").intValue()).isEqualTo(5);
        assertThat(result.getValue().get("summary").textValue()).isEqualTo("ok");
        assertThat(result.getValue().get("gaps")).hasSize(1);
    }

    @Test
    void locate_shouldReturnOuterObjectWhenNested() {
        LocateResult result = jsonLocator.locate("{\"a\": {\"b\": {\"c\": 1}}, \"d\": 2}");

        assertThat(result.isFound()).isTrue();
        assertThat(result.getValue().get("d").intValue()).isEqualTo(2);
        assertThat(result.getValue().at("/a/b/c").intValue()).isEqualTo(1);
    }

    @Test
    void findBalancedEnd_shouldRespectEscapedQuotes() {
        String text = "{\"a\": \"x\\\"}\"}";

        assertThat(JsonLocator.findBalancedEnd(text, 0)).isEqualTo(text.length() - 1);
    }

    @Test
    void findBalancedEnd_shouldReturnMinusOneWhenUnclosed() {
        assertThat(JsonLocator.findBalancedEnd("{\"a\": {", 0)).isEqualTo(-1);
    }
}
