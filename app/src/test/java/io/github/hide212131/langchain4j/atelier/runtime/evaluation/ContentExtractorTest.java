package io.github.hide212131.langchain4j.atelier.runtime.evaluation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContentExtractorTest {

    private final ContentExtractor extractor = new ContentExtractor();

    @Test
    @DisplayName("Prose before the JSON block is the deliverable")
    void proseBeforeJson() {
        String response = """
                # Tides

                The moon pulls the sea.

                ```json
                {"output": "ignored", "evaluation": {"overall_score": 7}}
                ```
                """;

        assertThat(extractor.extract(response)).isEqualTo("# Tides\n\nThe moon pulls the sea.");
    }

    @Test
    @DisplayName("A JSON-only response yields its narrative fields followed by the output")
    void jsonOnlyResponse() {
        String response = """
                ```json
                {
                  "analysis": "The opening is slow.",
                  "suggestions": ["Cut the first sentence", "Name the moon earlier"],
                  "output": "Revised text.",
                  "evaluation": {"overall_score": 7}
                }
                ```
                """;

        assertThat(extractor.extract(response)).isEqualTo(
                "The opening is slow.\n\n- Cut the first sentence\n- Name the moon earlier\n\nRevised text.");
    }

    @Test
    @DisplayName("Truncated JSON is read field by field")
    void truncatedJson() {
        String response = "```json\n{\"feedback\": \"Tighten the \\\"middle\\\" section.\", \"output\": \"The tide rose an";

        assertThat(extractor.extract(response)).isEqualTo("Tighten the \"middle\" section.\n\nThe tide rose an");
    }

    @Test
    void plainTextIsReturnedTrimmed() {
        assertThat(extractor.extract("  Just words.\n")).isEqualTo("Just words.");
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("   ")).isEmpty();
    }

    @Test
    @DisplayName("JSON without recognised keys is returned unchanged")
    void unrecognisedJson() {
        String response = "{\"evaluation\": {\"overall_score\": 7}}";

        assertThat(extractor.extract(response)).isEqualTo(response);
    }

    @Test
    void unescapeStopsAtDanglingBackslash() {
        assertThat(ContentExtractor.unescape("line\\nnext\\u0041\\")).isEqualTo("line\nnextA");
    }
}
