package com.jobJumper.careerAi.normalization.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FenceStripperTest {

    @Test
    void strip_shouldReturnEmptyStringForNullOrEmpty() {
        assertThat(FenceStripper.strip(null)).isEmpty();
        assertThat(FenceStripper.strip("")).isEmpty();
        assertThat(FenceStripper.cleanText(null)).isEmpty();
    }

    @Test
    void strip_shouldRemoveConversationalPreamble() {
        assertThat(FenceStripper.strip("Here is the improved summary: Experienced backend engineer."))
                .isEqualTo("Experienced backend engineer.");
        assertThat(FenceStripper.strip("Sure, here's the rewrite:\nBuilt a payments API."))
                .isEqualTo("Built a payments API.");
        assertThat(FenceStripper.strip("I have rewritten it for you: Shipped v2."))
                .isEqualTo("Shipped v2.");
        assertThat(FenceStripper.strip("Below is the letter:\n\nDear hiring team,"))
                .isEqualTo("Dear hiring team,");
    }

    @Test
    void strip_shouldRemoveRepeatedPreamble() {
        assertThat(FenceStripper.strip("Here is: Here is the text: hello")).isEqualTo("hello");
    }

    @Test
    void strip_shouldLeaveOpenerWithoutColonOnSameLine() {
        assertThat(FenceStripper.strip("Sure, I can help\nNext line: value"))
                .isEqualTo("Sure, I can help\nNext line: value");
    }

    @Test
    void strip_shouldRemoveCodeFences() {
        assertThat(FenceStripper.strip("```markdown\nDear team,\n```")).isEqualTo("Dear team,");
    }

    @Test
    void cleanText_shouldKeepCodeFences() {
        assertThat(FenceStripper.cleanText("```")).isEqualTo("```");
    }

    @Test
    void strip_shouldRemoveEmphasisMarkersAndKeepText() {
        assertThat(FenceStripper.strip("**Led** a team of *five* engineers"))
                .isEqualTo("Led a team of five engineers");
        assertThat(FenceStripper.strip("__bold__ and _italic_ words"))
                .isEqualTo("bold and italic words");
        assertThat(FenceStripper.strip("***x***")).isEqualTo("x");
        assertThat(FenceStripper.strip("**Java *and* Kotlin**")).isEqualTo("Java and Kotlin");
    }

    @Test
    void strip_shouldNotTouchIdentifiersOrArithmetic() {
        assertThat(FenceStripper.strip("rename user_account_id")).isEqualTo("rename user_account_id");
        assertThat(FenceStripper.strip("2 * 3 * 4 = 24")).isEqualTo("2 * 3 * 4 = 24");
    }

    @Test
    void strip_shouldNormalizeListMarkersToBullets() {
        assertThat(FenceStripper.strip("- first\n* second\n  - third\n• fourth"))
                .isEqualTo("• first\n• second\n• third\n• fourth");
    }

    @Test
    void strip_shouldNotTreatHyphenatedTextAsBullet() {
        assertThat(FenceStripper.strip("-5 degrees\n--- rule")).isEqualTo("-5 degrees\n--- rule");
    }

    @Test
    void strip_shouldBeIdempotent() {
        List<String> samples = List.of(
                "Sure, here's the result:\n```json\n{\"score\": 72}\n```",
                "Here is: **Here is the text:** - _a_",
                "****",
                "* * *",
                "*a **b** c*",
                "__init__ and _private_ and **bold**",
                "- - nested marker",
                "Below is  the  plan:\n* step *one*\n- step __two__",
                "   ",
                "plain text"
        );
        for (String sample : samples) {
            String once = FenceStripper.strip(sample);
            assertThat(FenceStripper.strip(once)).as("strip(strip(%s))", sample).isEqualTo(once);
            String cleaned = FenceStripper.cleanText(sample);
            assertThat(FenceStripper.cleanText(cleaned)).as("cleanText(cleanText(%s))", sample).isEqualTo(cleaned);
        }
    }
}
