package txgate.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import txgate.model.SqlValue;
import txgate.support.TestGateway;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ResultTranslatorTest {

    private final ResultTranslator translator = new ResultTranslator();
    private Connection connection;

    @BeforeEach
    void setUp() throws Exception {
        connection = DriverManager.getConnection(TestGateway.memoryUrl("results"), "sa", "");
    }

    @AfterEach
    void tearDown() throws Exception {
        connection.close();
    }

    private List<ObjectNode> query(String sql) throws Exception {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(sql)) {
            return translator.translateAll(resultSet);
        }
    }

    @Test
    void testWhenRowTranslatedThenColumnsKeepEngineOrder() throws Exception {
        List<ObjectNode> rows = query("SELECT 3 AS c, 1 AS a, 2 AS b");

        assertThat(rows).hasSize(1);
        List<String> names = new ArrayList<>();
        rows.get(0).fieldNames().forEachRemaining(names::add);
        assertThat(names).containsExactly("c", "a", "b");
    }

    @Test
    void testWhenScalarColumnsThenMappedToJsonTypes() throws Exception {
        ObjectNode row = query("""
                SELECT CAST(NULL AS INT) AS n,
                       CAST(42 AS BIGINT) AS i,
                       CAST(1.5 AS DOUBLE) AS r,
                       'hello' AS s,
                       TRUE AS b
                """).get(0);

        assertThat(row.get("n").isNull()).isTrue();
        assertThat(row.get("i").isIntegralNumber()).isTrue();
        assertThat(row.get("i").longValue()).isEqualTo(42L);
        assertThat(row.get("r").isFloatingPointNumber()).isTrue();
        assertThat(row.get("r").doubleValue()).isEqualTo(1.5);
        assertThat(row.get("s").textValue()).isEqualTo("hello");
        assertThat(row.get("b").longValue()).isEqualTo(1L);
    }

    @Test
    void testWhenBlobColumnThenBase64Encoded() throws Exception {
        ObjectNode row = query("SELECT X'00FF10' AS data").get(0);

        assertThat(row.get("data").textValue()).isEqualTo("AP8Q");
    }

    @Test
    void testWhenDecimalIntegralThenInteger() throws Exception {
        ObjectNode row = query("SELECT CAST(5.00 AS DECIMAL(10,2)) AS whole, CAST(2.25 AS DECIMAL(10,2)) AS part")
                .get(0);

        assertThat(row.get("whole").isIntegralNumber()).isTrue();
        assertThat(row.get("whole").longValue()).isEqualTo(5L);
        assertThat(row.get("part").doubleValue()).isEqualTo(2.25);
    }

    @Test
    void testWhenDuplicateColumnLabelsThenLastWins() throws Exception {
        ObjectNode row = query("SELECT 1 AS x, 2 AS x").get(0);

        assertThat(row.size()).isEqualTo(1);
        assertThat(row.get("x").longValue()).isEqualTo(2L);
    }

    @Test
    void testWhenNoRowsThenEmptyList() throws Exception {
        assertThat(query("SELECT x FROM (VALUES (1)) AS v(x) WHERE x = 0")).isEmpty();
    }

    @Test
    void testWhenValueConvertedThenJsonMatchesType() {
        assertThat(translator.toJson(SqlValue.ofNull()).isNull()).isTrue();
        assertThat(translator.toJson(SqlValue.ofInteger(-7)).longValue()).isEqualTo(-7L);
        assertThat(translator.toJson(SqlValue.ofText("é")).textValue()).isEqualTo("é");
        assertThat(translator.toJson(SqlValue.ofBlob(new byte[]{1, 2, 3, 4})).textValue()).isEqualTo("AQIDBA==");

        JsonNode nan = translator.toJson(SqlValue.ofReal(Double.NaN));
        assertThat(nan.textValue()).isEqualTo("NaN");
    }
}
