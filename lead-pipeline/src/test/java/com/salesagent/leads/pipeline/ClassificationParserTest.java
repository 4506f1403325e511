package com.salesagent.leads.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesagent.leads.model.BranchDecision;
import com.salesagent.leads.model.Classification;
import org.junit.jupiter.api.Test;

class ClassificationParserTest {

    private final ClassificationParser parser = new ClassificationParser(new ObjectMapper());

    @Test
    void parsesFencedJson() {
        String reply = """
            Here is the result:
            ```json
            {"call_category": "agreed_to_email", "email": "owner@bakery.example", "note": "wants details"}
            ```
            """;

        Classification c = parser.parse(reply);

        assertThat(c.decision()).isEqualTo(BranchDecision.AGREED_TO_EMAIL);
        assertThat(c.email()).isEqualTo("owner@bakery.example");
        assertThat(c.note()).isEqualTo("wants details");
        assertThat(c.ambiguous()).isFalse();
    }

    @Test
    void labelLookupIsLenient() {
        Classification c = parser.parse("{\"call_category\": \"Not-Interested\", \"note\": \"  \"}");

        assertThat(c.decision()).isEqualTo(BranchDecision.NOT_INTERESTED);
        assertThat(c.note()).isNull();
        assertThat(c.ambiguous()).isFalse();
    }

    @Test
    void unknownCategoryFallsBackToOther() {
        Classification c = parser.parse("{\"call_category\": \"maybe_later\"}");

        assertThat(c.decision()).isEqualTo(BranchDecision.OTHER);
        assertThat(c.ambiguous()).isTrue();
    }

    @Test
    void nonJsonReplyIsAmbiguousOther() {
        Classification c = parser.parse("The customer seemed happy.");

        assertThat(c.decision()).isEqualTo(BranchDecision.OTHER);
        assertThat(c.ambiguous()).isTrue();
        assertThat(c.email()).isNull();
    }

    @Test
    void malformedEmailIsDropped() {
        Classification c = parser.parse("{\"call_category\": \"agreed_to_email\", \"email\": \"owner at bakery\"}");

        assertThat(c.decision()).isEqualTo(BranchDecision.AGREED_TO_EMAIL);
        assertThat(c.email()).isNull();
    }
}
