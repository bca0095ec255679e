package com.videre.tracker.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.videre.tracker.config.StreamSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.Executor;
import java.util.function.Predicate;

/**
 * Writes NDJSON responses: one complete JSON value per line, flushed line by line.
 */
@Component
public class NdjsonStreamer {
    private static final Logger log = LoggerFactory.getLogger(NdjsonStreamer.class);

    public static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final ObjectMapper mapper;
    private final StreamSettings settings;
    private final Executor liveExecutor;

    public NdjsonStreamer(ObjectMapper mapper, StreamSettings settings,
                          @Qualifier("liveExecutor") Executor liveExecutor) {
        this.mapper = mapper;
        this.settings = settings;
        this.liveExecutor = liveExecutor;
    }

    public static HttpHeaders ndjsonHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(NDJSON);
        headers.set("X-Content-Type-Options", "nosniff");
        headers.setCacheControl("no-cache");
        // nginx and similar proxies buffer unless told otherwise
        headers.set("X-Accel-Buffering", "no");
        return headers;
    }

    /** Drain mode: writes every item of a finite, possibly lazily produced sequence. */
    public <T> ResponseEntity<StreamingResponseBody> drain(String name, Iterable<T> items) {
        StreamingResponseBody body = out -> writeAll(name, items, out);
        return ResponseEntity.ok().headers(ndjsonHeaders()).body(body);
    }

    /** Subscribe mode: re-emits every matching feed item until the client goes away. */
    public <T> ResponseEntity<ResponseBodyEmitter> subscribe(String name, LiveFeed<T> feed, Predicate<? super T> filter) {
        ResponseBodyEmitter emitter = new ResponseBodyEmitter(settings.getLiveTimeoutMs());
        LiveStreamSession<T> session = new LiveStreamSession<>(name, mapper, new EmitterSink(emitter),
                liveExecutor, filter, settings.getMaxPending());
        emitter.onCompletion(session::detach);
        emitter.onTimeout(session::close);
        emitter.onError(ex -> {
            log.debug("[Stream][{}] transport error: {}", name, ex.getMessage());
            session.detach();
        });
        session.open(feed);
        return ResponseEntity.ok().headers(ndjsonHeaders()).body(emitter);
    }

    <T> void writeAll(String name, Iterable<T> items, OutputStream out) {
        int written = 0;
        try {
            for (T item : items) {
                byte[] json;
                try {
                    json = mapper.writeValueAsBytes(item);
                } catch (JsonProcessingException ex) {
                    log.warn("[Stream][{}] skipped item {} that failed to serialize: {}", name, written, ex.getOriginalMessage());
                    continue;
                }
                out.write(json);
                out.write('\n');
                out.flush();
                written++;
            }
            log.debug("[Stream][{}] drained {} items", name, written);
        } catch (IOException ex) {
            log.debug("[Stream][{}] client went away after {} items: {}", name, written, ex.getMessage());
        }
    }

    private static final class EmitterSink implements LiveStreamSession.LineSink {
        private final ResponseBodyEmitter emitter;

        private EmitterSink(ResponseBodyEmitter emitter) {
            this.emitter = emitter;
        }

        @Override
        public void send(byte[] line) throws IOException {
            emitter.send(line, MediaType.APPLICATION_OCTET_STREAM);
        }

        @Override
        public void complete() {
            emitter.complete();
        }
    }
}
