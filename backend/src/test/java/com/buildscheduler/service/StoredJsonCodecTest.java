package com.buildscheduler.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StoredJsonCodecTest {

    private final StoredJsonCodec codec = new StoredJsonCodec(new ObjectMapper());

    @Test
    void shouldReadTargetsInStoredOrder() {
        assertThat(codec.readTargets("[\"folder/B\", \"folder/A\", \"folder/B\"]"))
                .containsExactly("folder/B", "folder/A");
    }

    @Test
    void shouldReadTargetsFromObjectKeysAndPlainStrings() {
        assertThat(codec.readTargets("{\"A\": {}, \"B\": {}}")).containsExactly("A", "B");
        assertThat(codec.readTargets("\"legacy-job\"")).containsExactly("legacy-job");
    }

    @Test
    void shouldUnwrapDoubleEncodedConfigs() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        String once = mapper.writeValueAsString(Map.of("A", Map.of("X", "1")));
        String twice = mapper.writeValueAsString(once);

        assertThat(codec.readJobConfigs(twice)).containsEntry("A", Map.of("X", "1"));
    }

    @Test
    void shouldUnescapeEscapedJson() {
        String escaped = "{\\\"A\\\": {\\\"X\\\": \\\"1\\\"}}";

        assertThat(codec.readJobConfigs(escaped)).containsEntry("A", Map.of("X", "1"));
    }

    @Test
    void shouldTreatUnreadableValuesAsEmpty() {
        assertThat(codec.readJobConfigs("{not json")).isEmpty();
        assertThat(codec.readTargets(null)).isEmpty();
        assertThat(codec.readParameters("   ")).isEmpty();
    }

    @Test
    void shouldKeepBooleansAndNullsAndStringifyNumbers() {
        Map<String, Object> params = codec.readParameters("{\"FLAG\": true, \"COUNT\": 3, \"UNSET\": null}");

        assertThat(params).containsEntry("FLAG", true).containsEntry("COUNT", "3").containsEntry("UNSET", null);
    }

    @Test
    void writtenConfigsReadBackUnchanged() {
        Map<String, Map<String, Object>> configs = new LinkedHashMap<>();
        configs.put("folder/job/A", Map.of("X", "1"));
        configs.put("folder/job/B", Map.of());

        assertThat(codec.readJobConfigs(codec.write(configs))).isEqualTo(configs);
    }
}
