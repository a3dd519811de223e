package txgate.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import txgate.exception.FailureKind;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class GatewayResponseTest {

    @Test
    void testWhenSuccessThenOnlyRelevantMembersSerialized() {
        ObjectNode row = JsonNodeFactory.instance.objectNode().put("a", 1);
        GatewayResponse response = GatewayResponse.ok(List.of(
                ResponseItem.forQuery(List.of(row)),
                ResponseItem.forStatement(3),
                ResponseItem.forBatch(List.of(1, 0)),
                ResponseItem.forError("boom")));

        ObjectNode json = response.toJson();

        assertThat(json.get("success").booleanValue()).isTrue();
        assertThat(json.has("errorCode")).isFalse();
        assertThat(json.get("results")).hasSize(4);

        assertThat(json.get("results").get(0).get("resultSet").get(0).get("a").intValue()).isEqualTo(1);
        assertThat(json.get("results").get(0).has("rowsUpdated")).isFalse();
        assertThat(json.get("results").get(1).get("rowsUpdated").intValue()).isEqualTo(3);
        assertThat(json.get("results").get(2).get("rowsUpdatedBatch").toString()).isEqualTo("[1,0]");
        assertThat(json.get("results").get(3).get("success").booleanValue()).isFalse();
        assertThat(json.get("results").get(3).get("error").textValue()).isEqualTo("boom");
        assertThat(json.get("results").get(3).has("resultSet")).isFalse();
    }

    @Test
    void testWhenFailureThenEnvelopeHasIndexAndMessageOnly() {
        GatewayResponse response = GatewayResponse.failure(400, FailureKind.ENGINE, 2, "bad sql");

        ObjectNode json = response.toJson();

        assertThat(json.toString()).isEqualTo("{\"success\":false,\"errorCode\":2,\"message\":\"bad sql\"}");
        assertThat(response.getStatus()).isEqualTo(400);
    }

    @Test
    void testWhenUnauthorizedThenNoItemIndexAndConfiguredStatus() {
        GatewayResponse response = GatewayResponse.unauthorized(403);

        assertThat(response.getErrorCode()).isEqualTo(GatewayResponse.NO_ITEM);
        assertThat(response.getMessage()).isEqualTo("Authorization failed");
        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getFailureKind()).isEqualTo(FailureKind.AUTH);
    }
}
