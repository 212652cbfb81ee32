package health.assist.api;

import java.util.UUID;

final class RequestIds {
    private RequestIds() {
    }

    static String next() {
        return "ai_" + UUID.randomUUID().toString().replace("-", "");
    }
}
