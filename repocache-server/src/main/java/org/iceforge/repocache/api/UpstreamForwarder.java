package org.iceforge.repocache.api;

import jakarta.servlet.http.HttpServletRequest;
import org.iceforge.repocache.core.upstream.UpstreamClient;
import org.iceforge.repocache.core.upstream.UpstreamModels;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a servlet request into an {@link UpstreamModels.ForwardRequest} and the upstream's answer
 * back into a response. Used for every path the cache does not serve itself.
 */
@Component
public class UpstreamForwarder {

    // recomputed by the servlet container for the response it writes
    private static final Set<String> HOP_BY_HOP = Set.of("transfer-encoding", "connection", "content-length", "keep-alive");

    private final UpstreamClient upstream;

    public UpstreamForwarder(UpstreamClient upstream) {
        this.upstream = Objects.requireNonNull(upstream);
    }

    public ResponseEntity<byte[]> forward(HttpServletRequest request) throws IOException {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, Collections.list(request.getHeaders(name)));
        }
        byte[] body = request.getInputStream().readAllBytes();

        UpstreamModels.ForwardResponse resp = upstream.forward(new UpstreamModels.ForwardRequest(
                request.getMethod(), request.getRequestURI(), request.getQueryString(), headers, body));

        HttpHeaders out = new HttpHeaders();
        resp.headers().forEach((name, values) -> {
            if (!HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT))) {
                out.addAll(name, values);
            }
        });
        return ResponseEntity.status(resp.status()).headers(out).body(resp.body());
    }
}
