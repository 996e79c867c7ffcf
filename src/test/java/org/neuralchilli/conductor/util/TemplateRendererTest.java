package org.neuralchilli.conductor.util;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRendererTest {

    @Test
    void shouldReplaceKnownPlaceholders() {
        String rendered = TemplateRenderer.render("Write about {topic} for {audience}",
                Map.of("topic", "queues", "audience", "ops"));

        assertThat(rendered).isEqualTo("Write about queues for ops");
    }

    @Test
    void shouldLeaveUnknownPlaceholdersUntouched() {
        String rendered = TemplateRenderer.render("Fetch {url} with {missing}", Map.of("url", "http://a"));

        assertThat(rendered).isEqualTo("Fetch http://a with {missing}");
    }

    @Test
    void shouldJoinCollectionsAndBlankNulls() {
        Map<String, Object> values = new HashMap<>();
        values.put("tags", List.of("a", "b"));
        values.put("note", null);

        assertThat(TemplateRenderer.render("Tags: {tags}. Note: {note}.", values))
                .isEqualTo("Tags: a, b. Note: .");
    }

    @Test
    void shouldKeepRegexCharactersInValues() {
        assertThat(TemplateRenderer.render("Cost {price}", Map.of("price", "$5\\unit")))
                .isEqualTo("Cost $5\\unit");
    }

    @Test
    void shouldIgnoreJsonBraces() {
        assertThat(TemplateRenderer.render("Return {\"facts\": []} about {topic}", Map.of("topic", "x")))
                .isEqualTo("Return {\"facts\": []} about x");
    }
}
