package com.gateflow.core.engine;

import com.gateflow.core.PipelineFixtures;
import com.gateflow.core.model.DataMode;
import com.gateflow.core.model.PipelineRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequestValidatorTest {

    private static PipelineRequest request(String domain, String feature, String url, String story,
                                           List<String> criteria) {
        return new PipelineRequest("GF-2026-00000000", domain, feature, url, story, criteria, null, null, null, null);
    }

    @Test
    void wellFormedRequestPasses() {
        assertDoesNotThrow(() -> RequestValidator.validate(PipelineFixtures.loginRequest()));
    }

    @Test
    @DisplayName("every violation is reported at once")
    void collectsAllViolations() {
        var bad = request(" ", "", "not a url", "", List.of());

        var e = assertThrows(InputValidationException.class, () -> RequestValidator.validate(bad));

        assertEquals(5, e.getViolations().size());
        assertTrue(e.getMessage().startsWith("Invalid pipeline request: "));
    }

    @Test
    void rejectsNonHttpUrls() {
        for (String url : List.of("ftp://example.com", "/relative/path", "https://", "example.com/login")) {
            var bad = request("docsearch", "login", url, "story", List.of("criterion"));
            assertEquals(List.of("url must be an absolute http(s) URL"), RequestValidator.violations(bad), url);
        }
    }

    @Test
    void rejectsSymbolOnlyKeyParts() {
        var bad = request("***", "login", PipelineFixtures.LOGIN_URL, "story", List.of("criterion"));
        assertEquals(List.of("domain must contain a letter or digit"), RequestValidator.violations(bad));
    }

    @Test
    void rejectsBlankCriterion() {
        var bad = request("docsearch", "login", PipelineFixtures.LOGIN_URL, "story", List.of("ok", " "));
        assertEquals(List.of("acceptance criteria must not be blank"), RequestValidator.violations(bad));
    }

    @Test
    void dataDrivenNeedsAPositiveCount() {
        var bad = new PipelineRequest("id", "docsearch", "search", PipelineFixtures.LOGIN_URL, "story",
                List.of("criterion"), new PipelineRequest.DataRequirements(DataMode.DATA_DRIVEN, 0, null),
                null, null, null);
        assertEquals(List.of("data-driven mode needs a record count of at least 1"), RequestValidator.violations(bad));
    }

    @Test
    void rejectsNegativeConstraints() {
        var bad = new PipelineRequest("id", "docsearch", "search", PipelineFixtures.LOGIN_URL, "story",
                List.of("criterion"), null, new PipelineRequest.Constraints(-1, 0, null), null, null);
        assertEquals(List.of("constraints must not be negative"), RequestValidator.violations(bad));
    }

    @Test
    void nullRequestIsRejected() {
        assertEquals(List.of("request is missing"), RequestValidator.violations(null));
    }
}
