package txgate.service;

import org.junit.jupiter.api.Test;
import txgate.config.JsonMapperFactory;
import txgate.exception.RequestBodyParseException;
import txgate.model.Credentials;
import txgate.model.TransactionItemRequest;
import txgate.model.TransactionRequest;

import static org.assertj.core.api.Assertions.*;

class RequestParserTest {

    private final RequestParser parser = new RequestParser(JsonMapperFactory.create());

    @Test
    void testWhenFullRequestParsedThenAllMembersCaptured() {
        // Act
        TransactionRequest request = parser.parse("""
                {
                  "credentials": {"user": "u", "password": "p"},
                  "transaction": [
                    {"query": "SELECT 1", "noFail": true},
                    {"statement": "S", "values": {"a": 1}},
                    {"statement": "S", "valuesBatch": [{"a": 1}]}
                  ]
                }
                """);

        // Assert
        assertThat(request.credentials()).isEqualTo(new Credentials("u", "p"));
        assertThat(request.size()).isEqualTo(3);

        TransactionItemRequest first = request.transaction().get(0);
        assertThat(first.query().textValue()).isEqualTo("SELECT 1");
        assertThat(first.statement()).isNull();
        assertThat(first.noFail()).isTrue();

        assertThat(request.transaction().get(1).values().get("a").intValue()).isEqualTo(1);
        assertThat(request.transaction().get(1).noFail()).isFalse();
        assertThat(request.transaction().get(2).valuesBatch().isArray()).isTrue();
    }

    @Test
    void testWhenMemberIsJsonNullThenTreatedAsAbsent() {
        TransactionRequest request = parser.parse("""
                {"credentials": null, "transaction": [{"query": "SELECT 1", "statement": null, "noFail": null}]}
                """);

        assertThat(request.credentials()).isNull();
        assertThat(request.transaction().get(0).statement()).isNull();
        assertThat(request.transaction().get(0).noFail()).isFalse();
    }

    @Test
    void testWhenBodyMissingThenParseError() {
        assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(RequestBodyParseException.class);
        assertThatThrownBy(() -> parser.parse("  ")).isInstanceOf(RequestBodyParseException.class);
    }

    @Test
    void testWhenJsonMalformedThenParseError() {
        assertThatThrownBy(() -> parser.parse("{\"transaction\": ["))
                .isInstanceOf(RequestBodyParseException.class)
                .hasMessageStartingWith("Malformed JSON");
    }

    @Test
    void testWhenRootNotObjectThenParseError() {
        assertThatThrownBy(() -> parser.parse("[1, 2]"))
                .isInstanceOf(RequestBodyParseException.class)
                .hasMessageContaining("JSON object");
    }

    @Test
    void testWhenTransactionMissingOrNotArrayThenParseError() {
        assertThatThrownBy(() -> parser.parse("{}"))
                .isInstanceOf(RequestBodyParseException.class)
                .hasMessageContaining("'transaction'");
        assertThatThrownBy(() -> parser.parse("{\"transaction\": {}}"))
                .isInstanceOf(RequestBodyParseException.class);
    }

    @Test
    void testWhenItemNotObjectThenParseErrorNamesIndex() {
        assertThatThrownBy(() -> parser.parse("{\"transaction\": [{\"query\": \"SELECT 1\"}, 5]}"))
                .isInstanceOf(RequestBodyParseException.class)
                .hasMessageContaining("transaction[1]");
    }

    @Test
    void testWhenNoFailNotBooleanThenParseError() {
        assertThatThrownBy(() -> parser.parse("{\"transaction\": [{\"query\": \"SELECT 1\", \"noFail\": \"yes\"}]}"))
                .isInstanceOf(RequestBodyParseException.class)
                .hasMessageContaining("noFail");
    }

    @Test
    void testWhenCredentialsIncompleteThenParseError() {
        assertThatThrownBy(() -> parser.parse("{\"credentials\": {\"user\": \"u\"}, \"transaction\": []}"))
                .isInstanceOf(RequestBodyParseException.class)
                .hasMessageContaining("credentials");
    }

    @Test
    void testWhenContentTrailsTheObjectThenMalformed() {
        assertThatThrownBy(() -> parser.parse("{\"transaction\": []} {\"transaction\": []}"))
                .isInstanceOf(RequestBodyParseException.class)
                .hasMessageStartingWith("Malformed JSON");
    }
}
