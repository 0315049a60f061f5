package com.agentdeploy.orchestrator.api;

import com.agentdeploy.orchestrator.api.dto.ErrorResponse;
import com.agentdeploy.orchestrator.api.dto.JobResponse;
import com.agentdeploy.orchestrator.model.JobRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Server-sent event streams of job snapshots.
 *
 * Change notifications arrive on the thread that committed the write, so
 * sends are handed to a small pool instead of blocking the processor on a
 * slow client. Each stream chains its sends, so events leave in the order
 * they were accepted.
 */
@Component
public class SnapshotStreams {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStreams.class);

    private final ObjectMapper    json;
    private final ExecutorService senders;

    public SnapshotStreams(ObjectMapper objectMapper) {
        this.json    = objectMapper;
        this.senders = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "sse-sender");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        senders.shutdownNow();
    }

    public Stream open(long timeoutMillis, Runnable onClose) {
        return new Stream(new SseEmitter(timeoutMillis), onClose);
    }

    /** One client connection. */
    public final class Stream {

        private final SseEmitter    emitter;
        private final Runnable      onClose;
        private final AtomicBoolean closed = new AtomicBoolean();
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        private Stream(SseEmitter emitter, Runnable onClose) {
            this.emitter = emitter;
            this.onClose = onClose;
            emitter.onCompletion(this::markClosed);
            emitter.onTimeout(this::markClosed);
            emitter.onError(e -> markClosed());
        }

        public SseEmitter emitter() {
            return emitter;
        }

        /** Event "snapshot", id = {@code eventId}, data = the job as JSON. */
        public void snapshot(String eventId, JobRecord job) {
            JobResponse body = JobResponse.from(job, json);
            enqueue(() -> emitter.send(SseEmitter.event()
                    .id(eventId)
                    .name("snapshot")
                    .data(body, MediaType.APPLICATION_JSON)));
        }

        /** Send a final named event, then end the response. */
        public void end(String eventName, ErrorResponse body) {
            enqueue(() -> emitter.send(SseEmitter.event().name(eventName).data(body, MediaType.APPLICATION_JSON)));
            complete();
        }

        public synchronized void complete() {
            tail = tail.thenRunAsync(() -> {
                if (!closed.get()) {
                    emitter.complete();
                }
            }, senders);
        }

        private void markClosed() {
            if (closed.compareAndSet(false, true)) {
                onClose.run();
            }
        }

        private synchronized void enqueue(Send send) {
            tail = tail.thenRunAsync(() -> {
                if (closed.get()) {
                    return;
                }
                try {
                    send.run();
                } catch (Exception e) {
                    log.debug("SSE send failed, closing stream: {}", e.getMessage());
                    markClosed();
                    emitter.completeWithError(e);
                }
            }, senders);
        }
    }

    @FunctionalInterface
    private interface Send {
        void run() throws Exception;
    }
}
