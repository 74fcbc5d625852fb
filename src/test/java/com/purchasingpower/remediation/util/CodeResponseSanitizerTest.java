package com.purchasingpower.remediation.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Code Response Sanitizer Tests")
class CodeResponseSanitizerTest {

    @Test
    @DisplayName("Should drop fences and surrounding explanation")
    void testClean_FencedAnswer() {
        String answer = """
                Here is the secure version:
                ```python
                cursor.execute("SELECT * FROM users WHERE id = %s", (user_id,))
                ```
                This uses a parameterized query.
                """;

        assertThat(CodeResponseSanitizer.clean(answer))
                .isEqualTo("cursor.execute(\"SELECT * FROM users WHERE id = %s\", (user_id,))");
    }

    @Test
    @DisplayName("Should keep code lines inside fences even if they look like prose")
    void testClean_ProseLikeCodeInsideFence() {
        String answer = "```\nThe_value = 1\nprint(The_value)\n```";

        assertThat(CodeResponseSanitizer.clean(answer)).isEqualTo("The_value = 1\nprint(The_value)");
    }

    @Test
    @DisplayName("Plain code should pass through unchanged")
    void testClean_PlainCode() {
        String code = "db.Query(\"SELECT 1 WHERE id = ?\", id)";

        assertThat(CodeResponseSanitizer.clean(code)).isEqualTo(code);
    }

    @Test
    @DisplayName("Should fall back to the original when everything looks like prose")
    void testClean_AllProse_ShouldReturnOriginal() {
        assertThat(CodeResponseSanitizer.clean("  This is all there is.  ")).isEqualTo("This is all there is.");
    }

    @Test
    @DisplayName("Null should become empty")
    void testClean_Null() {
        assertThat(CodeResponseSanitizer.clean(null)).isEmpty();
    }
}
