package io.rangekeeper.lifecycle;

import java.util.Map;

public record CreateRequest(String flagTemplate, Map<String, String> attributes) {
    public CreateRequest {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static CreateRequest defaults() {
        return new CreateRequest(null, Map.of());
    }
}
