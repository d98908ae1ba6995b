package dev.devanks.aquascenic.poller.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.devanks.aquascenic.poller.codec.DocumentCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TypedValueJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static final String POOL_DOCUMENT = "{"
            + "\"name\": \"projects/hayward-europe/databases/(default)/documents/pools/pool-1\","
            + "\"fields\": {"
            + "\"present\": {\"booleanValue\": true},"
            + "\"main\": {\"mapValue\": {\"fields\": {"
            + "\"temperature\": {\"doubleValue\": 28.5},"
            + "\"version\": {\"stringValue\": \"1.20\"}"
            + "}}},"
            + "\"modules\": {\"mapValue\": {\"fields\": {"
            + "\"ph\": {\"mapValue\": {\"fields\": {\"current\": {\"integerValue\": \"740\"}}}}"
            + "}}},"
            + "\"timers\": {\"arrayValue\": {\"values\": [{\"integerValue\": \"1\"}, {\"nullValue\": null}]}},"
            + "\"updatedAt\": {\"timestampValue\": \"2024-05-01T10:00:00Z\"},"
            + "\"location\": {\"geoPointValue\": {\"latitude\": 41.4, \"longitude\": 2.1}}"
            + "},"
            + "\"createTime\": \"2023-01-01T00:00:00Z\","
            + "\"updateTime\": \"2024-05-01T10:00:00Z\""
            + "}";

    @Test
    @DisplayName("deserialize - document fields keep their variant")
    void deserialize_PoolDocument() throws Exception {
        FirestoreDocument document = mapper.readValue(POOL_DOCUMENT, FirestoreDocument.class);

        assertThat(document.getName()).endsWith("/pools/pool-1");
        assertThat(document.getUpdateTime()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(document.getFields().get("present")).isEqualTo(TypedValue.ofBoolean(true));
        assertThat(document.getFields().get("timers").asList())
                .containsExactly(TypedValue.ofInteger("1"), TypedValue.ofNull());
        assertThat(document.getFields().get("updatedAt").getKind()).isEqualTo(TypedValue.Kind.TIMESTAMP);

        TypedValue ph = document.getFields().get("modules").asMap().get("ph").asMap().get("current");
        assertThat(ph).isEqualTo(TypedValue.ofInteger("740"));

        TypedValue location = document.getFields().get("location");
        assertThat(location.getKind()).isEqualTo(TypedValue.Kind.UNRECOGNIZED);
        assertThat(location.getTag()).isEqualTo("geoPointValue");
    }

    @Test
    @DisplayName("deserialize + decode - unknown variants do not break the document")
    void deserializeAndDecode_Flattened() throws Exception {
        DocumentCodec codec = new DocumentCodec();
        FirestoreDocument document = mapper.readValue(POOL_DOCUMENT, FirestoreDocument.class);

        var flat = codec.flatten(codec.decodeDocument(document.getFields()));

        assertThat(flat)
                .containsEntry("main_temperature", 28.5)
                .containsEntry("modules_ph_current", 740L)
                .containsEntry("main_version", "1.20")
                .containsEntry("timers", java.util.Arrays.asList(1L, null))
                .doesNotContainKey("location");
    }

    @Test
    @DisplayName("serialize - patch body carries only the nested fields")
    void serialize_PatchBody() throws Exception {
        DocumentCodec codec = new DocumentCodec();
        FirestoreDocument patch = FirestoreDocument.builder()
                .fields(codec.buildNestedFields("modules.ph.status.high_value", "720"))
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(patch));

        JsonNode expected = mapper.readTree("{\"fields\": {\"modules\": {\"mapValue\": {\"fields\": {"
                        + "\"ph\": {\"mapValue\": {\"fields\": {"
                        + "\"status\": {\"mapValue\": {\"fields\": {"
                        + "\"high_value\": {\"stringValue\": \"720\"}"
                        + "}}}"
                        + "}}}"
                        + "}}}}}");
        assertThat(json).isEqualTo(expected);
    }

    @Test
    @DisplayName("serialize - null and list variants")
    void serialize_NullAndList() throws Exception {
        TypedValue value = TypedValue.ofArray(List.of(TypedValue.ofNull(), TypedValue.ofDouble(1.5)));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(value));

        assertThat(json).isEqualTo(mapper.readTree(
                "{\"arrayValue\": {\"values\": [{\"nullValue\": null}, {\"doubleValue\": 1.5}]}}"));
    }
}
