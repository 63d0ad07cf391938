package com.ybds.transport.ws;

import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.xnio.IoUtils;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Transport} over an Undertow {@link WebSocketChannel}. Sends are issued
 * asynchronously and awaited up to the deadline; a missed deadline closes the channel.
 */
final class UndertowTransport implements Transport {

    private final WebSocketChannel channel;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    UndertowTransport(WebSocketChannel channel) {
        this.channel = channel;
    }

    @Override
    public void sendText(byte[] utf8, Duration deadline) throws IOException {
        ensureOpen();
        CompletableFuture<Void> done = new CompletableFuture<>();
        WebSockets.sendText(ByteBuffer.wrap(utf8), channel, completion(done));
        await(done, deadline, "text");
    }

    @Override
    public void sendPing(Duration deadline) throws IOException {
        ensureOpen();
        CompletableFuture<Void> done = new CompletableFuture<>();
        WebSockets.sendPing(ByteBuffer.allocate(0), channel, completion(done));
        await(done, deadline, "ping");
    }

    @Override
    public void sendClose(Duration deadline) throws IOException {
        ensureOpen();
        CompletableFuture<Void> done = new CompletableFuture<>();
        WebSockets.sendClose(CloseMessage.NORMAL_CLOSURE, "", channel, completion(done));
        await(done, deadline, "close");
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            IoUtils.safeClose(channel);
        }
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(channel.getSourceAddress());
    }

    private void ensureOpen() throws IOException {
        if (closed.get() || !channel.isOpen()) {
            throw new IOException("WebSocket channel is closed");
        }
    }

    private void await(CompletableFuture<Void> done, Duration deadline, String frame) throws IOException {
        try {
            done.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            close();
            throw new IOException("Timed out writing " + frame + " frame after " + deadline.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("Failed writing " + frame + " frame", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted writing " + frame + " frame");
        }
    }

    private static WebSocketCallback<Void> completion(CompletableFuture<Void> done) {
        return new WebSocketCallback<>() {
            @Override
            public void complete(WebSocketChannel channel, Void context) {
                done.complete(null);
            }

            @Override
            public void onError(WebSocketChannel channel, Void context, Throwable throwable) {
                done.completeExceptionally(throwable);
            }
        };
    }
}
