package txgate.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import txgate.validation.ValidationException;

import static org.assertj.core.api.Assertions.*;

class TransactionItemTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void testWhenQueryWithoutValuesThenQueryWithNoParameters() throws Exception {
        TransactionItem item = TransactionItem.from(
                new TransactionItemRequest(json("\"SELECT 1\""), null, null, null, false));

        assertThat(item.getKind()).isEqualTo(ItemKind.QUERY);
        assertThat(item.getParameterMode()).isEqualTo(ParameterMode.NONE);
        assertThat(item.getSql()).isEqualTo("SELECT 1");
        assertThat(item.getValues()).isNull();
        assertThat(item.getValuesBatch()).isEmpty();
    }

    @Test
    void testWhenStatementWithValuesThenSingleMode() throws Exception {
        TransactionItem item = TransactionItem.from(
                new TransactionItemRequest(null, json("\"UPDATE t SET a = :a\""), json("{\"a\": 1}"), null, true));

        assertThat(item.getKind()).isEqualTo(ItemKind.STATEMENT);
        assertThat(item.getParameterMode()).isEqualTo(ParameterMode.SINGLE);
        assertThat(item.getValues().get("a").intValue()).isEqualTo(1);
        assertThat(item.isNoFail()).isTrue();
    }

    @Test
    void testWhenStatementWithBatchThenBatchMode() throws Exception {
        TransactionItem item = TransactionItem.from(new TransactionItemRequest(
                null, json("\"INSERT INTO t VALUES (:a)\""), null, json("[{\"a\": 1}, {\"a\": 2}]"), false));

        assertThat(item.getParameterMode()).isEqualTo(ParameterMode.BATCH);
        assertThat(item.getValuesBatch()).hasSize(2);
    }

    @Test
    void testWhenNeitherQueryNorStatementThenValidationError() {
        assertThatThrownBy(() -> TransactionItem.from(new TransactionItemRequest(null, null, null, null, false)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("exactly one of 'query' and 'statement'");
    }

    @Test
    void testWhenBothQueryAndStatementThenValidationError() throws Exception {
        assertThatThrownBy(() -> TransactionItem.from(
                new TransactionItemRequest(json("\"A\""), json("\"B\""), null, null, false)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void testWhenValuesAndBatchBothGivenThenValidationError() throws Exception {
        assertThatThrownBy(() -> TransactionItem.from(new TransactionItemRequest(
                null, json("\"S\""), json("{}"), json("[]"), false)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'values' and 'valuesBatch'");
    }

    @Test
    void testWhenBatchUsedWithQueryThenValidationError() throws Exception {
        assertThatThrownBy(() -> TransactionItem.from(new TransactionItemRequest(
                json("\"SELECT :a\""), null, null, json("[{\"a\": 1}]"), false)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("only be used with 'statement'");
    }

    @Test
    void testWhenSeveralProblemsThenAllReported() throws Exception {
        ValidationException error = catchThrowableOfType(() -> TransactionItem.from(new TransactionItemRequest(
                json("5"), null, json("[1]"), null, false)), ValidationException.class);

        assertThat(error.getErrors()).hasSize(2);
        assertThat(error.getErrors()).anyMatch(message -> message.contains("'query' must be a string"));
        assertThat(error.getErrors()).anyMatch(message -> message.contains("'values' must be an object"));
    }

    @Test
    void testWhenBatchEntryNotObjectThenValidationErrorNamesEntry() throws Exception {
        assertThatThrownBy(() -> TransactionItem.from(new TransactionItemRequest(
                null, json("\"S\""), null, json("[{}, 3]"), false)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("valuesBatch[1]");
    }
}
