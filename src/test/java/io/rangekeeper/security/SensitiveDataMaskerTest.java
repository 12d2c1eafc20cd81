package io.rangekeeper.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.rangekeeper.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class SensitiveDataMaskerTest {

    @Test
    void masksSecretKeysFlagShapedValuesAndCiphertexts() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("submitted_flag", "anything");
        details.put("api_token", "abc");
        details.put("note", "FLAG{0123456789abcdef}");
        details.put("blob", "gcm1:AAAABBBBCCCC");
        details.put("nested", Map.of("list", List.of("FLAG{aaaaaaaaaaaa}", "plain")));
        details.put("key_id", 2);
        details.put("redacted", "FLAG{abc...xyz}");

        JsonNode masked = SensitiveDataMasker.masked(Jsons.mapper().valueToTree(details));

        Assertions.assertEquals("***", masked.path("submitted_flag").asText());
        Assertions.assertEquals("***", masked.path("api_token").asText());
        Assertions.assertEquals("***", masked.path("note").asText());
        Assertions.assertEquals("***", masked.path("blob").asText());
        Assertions.assertEquals("***", masked.path("nested").path("list").get(0).asText());
        Assertions.assertEquals("plain", masked.path("nested").path("list").get(1).asText());
        Assertions.assertEquals(2, masked.path("key_id").asInt());
        Assertions.assertEquals("FLAG{abc...xyz}", masked.path("redacted").asText());
    }

    @Test
    void redactorKeepsOnlyTheEdgesOfTheBody() {
        Assertions.assertEquals("FLAG{3f9...e7f}", FlagRedactor.redact("FLAG{3f9a1c_0b7e22_8c1d4e5f6a7b8c9d0e1f2a3b4c5d6e7f}"));
        Assertions.assertEquals("FLAG{***}", FlagRedactor.redact("FLAG{short}"));
        Assertions.assertEquals("abc...xyz", FlagRedactor.redact("abcdefghijklmnopxyz"));
        Assertions.assertEquals("", FlagRedactor.redact(null));
    }
}
