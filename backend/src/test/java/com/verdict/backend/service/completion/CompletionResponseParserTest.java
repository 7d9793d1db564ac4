package com.verdict.backend.service.completion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.verdict.backend.exception.CompletionServiceException;
import com.verdict.backend.model.CompletionOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CompletionResponseParserTest {

    private final CompletionResponseParser parser = new CompletionResponseParser(new ObjectMapper());

    @Test
    void extractsObjectFromSurroundingProse() {
        CompletionReply reply = parser.parse("Here is my view: {\"score\": 0.5, \"analysis\": \"fine\"} Hope it helps.");

        assertThat(reply.isOk()).isTrue();
        assertThat(reply.payload().get("score").asDouble()).isEqualTo(0.5);
    }

    @Test
    void extractsObjectFromCodeFence() {
        CompletionReply reply = parser.parse("```json\n{\"action\": \"hold\", \"quantity\": 0}\n```");

        assertThat(reply.isOk()).isTrue();
        assertThat(reply.payload().get("action").asText()).isEqualTo("hold");
    }

    @Test
    void keepsNestedObjectsTogether() {
        CompletionReply reply = parser.parse("{\"outer\": {\"inner\": {\"x\": 1}}, \"y\": 2} trailing {\"z\": 3}");

        assertThat(reply.isOk()).isTrue();
        assertThat(reply.payload().path("outer").path("inner").path("x").asInt()).isEqualTo(1);
        assertThat(reply.payload().get("y").asInt()).isEqualTo(2);
        assertThat(reply.payload().has("z")).isFalse();
    }

    @Test
    void ignoresBracesInsideStrings() {
        String text = "{\"reasoning\": \"uses } and { and \\\" quotes\", \"score\": -0.2}";

        assertThat(parser.extractFirstObject(text)).contains(text);
        assertThat(parser.parse(text).payload().get("score").asDouble()).isEqualTo(-0.2);
    }

    @Test
    void textWithoutObjectIsParseFailure() {
        CompletionReply reply = parser.parse("I cannot answer that.");

        assertThat(reply.outcome()).isEqualTo(CompletionOutcome.PARSE_FAILED);
        assertThat(reply.payload()).isNull();
        assertThat(reply.rawText()).isEqualTo("I cannot answer that.");
    }

    @Test
    void malformedObjectIsParseFailure() {
        CompletionReply reply = parser.parse("{\"score\": 0.5,, }");

        assertThat(reply.outcome()).isEqualTo(CompletionOutcome.PARSE_FAILED);
        assertThat(reply.describeFailure()).startsWith("PARSE_FAILED: invalid JSON");
    }

    @Test
    void emptyReplyIsParseFailure() {
        assertThat(parser.parse("   ").outcome()).isEqualTo(CompletionOutcome.PARSE_FAILED);
        assertThat(parser.parse(null).outcome()).isEqualTo(CompletionOutcome.PARSE_FAILED);
    }

    @Test
    void serviceFailureIsReturnedNotThrown() {
        CompletionClient client = mock(CompletionClient.class);
        when(client.complete(anyString(), anyList())).thenThrow(new CompletionServiceException("timed out"));

        CompletionReply reply = parser.request(client, "debate", List.of(ChatMessage.user("hi")));

        assertThat(reply.outcome()).isEqualTo(CompletionOutcome.SERVICE_FAILED);
        assertThat(reply.describeFailure()).isEqualTo("SERVICE_FAILED: timed out");
    }
}
