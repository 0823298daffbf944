package org.iceforge.repocache.core.upstream;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Request/response shapes for passing arbitrary calls through to the upstream API. */
public final class UpstreamModels {
    private UpstreamModels() {}

    public record ForwardRequest(
            String method,
            String path,
            String query,
            Map<String, List<String>> headers,
            byte[] body
    ) {
        public ForwardRequest {
            Objects.requireNonNull(method, "method");
            Objects.requireNonNull(path, "path");
            headers = headers == null ? Map.of() : Map.copyOf(headers);
            body = body == null ? new byte[0] : body;
        }
    }

    public record ForwardResponse(
            int status,
            Map<String, List<String>> headers,
            byte[] body
    ) {
        public ForwardResponse {
            headers = headers == null ? Map.of() : Map.copyOf(headers);
            body = body == null ? new byte[0] : body;
        }
    }
}
