package health.assist.api.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

final class RequestText {
    private RequestText() {
    }

    static List<String> cleanList(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
