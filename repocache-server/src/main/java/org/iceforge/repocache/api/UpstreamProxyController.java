package org.iceforge.repocache.api;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Objects;

/** Catch-all: anything not mapped more specifically goes straight to the upstream API. */
@RestController
public class UpstreamProxyController {

    private final UpstreamForwarder forwarder;

    public UpstreamProxyController(UpstreamForwarder forwarder) {
        this.forwarder = Objects.requireNonNull(forwarder);
    }

    @RequestMapping("/**")
    public ResponseEntity<byte[]> proxy(HttpServletRequest request) throws IOException {
        return forwarder.forward(request);
    }
}
