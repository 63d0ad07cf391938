package com.ybds.transport.ws;

import com.ybds.auth.RequestContext;
import io.undertow.server.HttpServerExchange;

import java.util.Deque;

/**
 * {@link RequestContext} view of an Undertow upgrade request.
 */
final class UndertowRequestContext implements RequestContext {

    private final HttpServerExchange exchange;

    UndertowRequestContext(HttpServerExchange exchange) {
        this.exchange = exchange;
    }

    @Override
    public String header(String name) {
        return exchange.getRequestHeaders().getFirst(name);
    }

    @Override
    public String queryParam(String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null ? null : values.peekFirst();
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(exchange.getSourceAddress());
    }
}
