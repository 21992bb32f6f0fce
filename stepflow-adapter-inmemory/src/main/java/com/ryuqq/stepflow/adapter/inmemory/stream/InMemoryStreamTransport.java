package com.ryuqq.stepflow.adapter.inmemory.stream;

import com.ryuqq.stepflow.core.model.StreamEvent;
import com.ryuqq.stepflow.core.spi.StreamTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link StreamTransport} SPI for testing and reference purposes.
 *
 * <p>Each stream keeps a bounded event history and a list of wire subscribers. Subscribers
 * receive JSON lines produced by {@link WireMessageEncoder}; a new subscriber first receives
 * the history, then live events, with no gap between the two.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Streams:</strong> ConcurrentHashMap&lt;String, StreamState&gt; - one entry per stream id</li>
 *   <li><strong>History:</strong> ArrayDeque&lt;StreamEvent&gt; - oldest events dropped beyond the limit</li>
 *   <li><strong>Subscribers:</strong> CopyOnWriteArrayList&lt;Consumer&lt;String&gt;&gt; - wire listeners</li>
 * </ul>
 *
 * <p><strong>Ordering:</strong> publish, history append and fan-out for one stream happen under
 * that stream's monitor, so every subscriber observes events in publish order.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryStreamTransport transport = new InMemoryStreamTransport();
 * transport.createStream("stream-1", "session-1");
 * StreamSubscription subscription = transport.subscribe("stream-1", line -&gt; System.out.println(line));
 * transport.publishEvent("stream-1", event);
 * subscription.cancel();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryStreamTransport implements StreamTransport {

    /**
     * Default number of events retained per stream.
     */
    public static final int DEFAULT_MAX_HISTORY = 1000;

    private static final Logger log = LoggerFactory.getLogger(InMemoryStreamTransport.class);

    private final ConcurrentHashMap<String, StreamState> streams = new ConcurrentHashMap<>();
    private final WireMessageEncoder encoder;
    private final int maxHistory;
    private final Clock clock;

    public InMemoryStreamTransport() {
        this(new WireMessageEncoder(), DEFAULT_MAX_HISTORY, Clock.systemUTC());
    }

    /**
     * Constructor.
     *
     * @param encoder wire encoder
     * @param maxHistory events retained per stream (must be positive)
     * @param clock clock used for error message timestamps
     * @throws IllegalArgumentException if an argument is null or maxHistory is not positive
     */
    public InMemoryStreamTransport(WireMessageEncoder encoder, int maxHistory, Clock clock) {
        if (encoder == null) {
            throw new IllegalArgumentException("encoder cannot be null");
        }
        if (maxHistory <= 0) {
            throw new IllegalArgumentException("maxHistory must be positive (current: " + maxHistory + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.encoder = encoder;
        this.maxHistory = maxHistory;
        this.clock = clock;
    }

    @Override
    public void createStream(String streamId, String sessionId) {
        requireId(streamId, "streamId");
        requireId(sessionId, "sessionId");
        StreamState existing = streams.putIfAbsent(streamId, new StreamState(streamId, sessionId));
        if (existing != null) {
            throw new IllegalStateException("Stream already exists: " + streamId);
        }
        log.debug("Stream created: {} (session={})", streamId, sessionId);
    }

    @Override
    public void destroyStream(String streamId) {
        StreamState removed = streams.remove(streamId);
        if (removed != null) {
            removed.subscribers.clear();
            log.debug("Stream destroyed: {}", streamId);
        }
    }

    @Override
    public void publishEvent(String streamId, StreamEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        StreamState state = requireStream(streamId);
        String line = encoder.encode(event);
        synchronized (state) {
            state.history.addLast(event);
            while (state.history.size() > maxHistory) {
                state.history.removeFirst();
            }
            deliver(state, line);
        }
    }

    /**
     * Sends an {@code error} wire message to the subscribers of a stream.
     *
     * @param streamId target stream
     * @param message error text
     * @throws IllegalStateException if the stream does not exist
     */
    public void publishError(String streamId, String message) {
        StreamState state = requireStream(streamId);
        String line = encoder.encodeError(state.sessionId, message, clock.instant());
        synchronized (state) {
            deliver(state, line);
        }
    }

    /**
     * Subscribes to a stream's wire messages, replaying retained history first.
     *
     * @param streamId stream to follow
     * @param listener receives one JSON line per message
     * @return subscription handle
     * @throws IllegalStateException if the stream does not exist
     */
    public StreamSubscription subscribe(String streamId, Consumer<String> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        StreamState state = requireStream(streamId);
        synchronized (state) {
            for (StreamEvent event : state.history) {
                listener.accept(encoder.encode(event));
            }
            state.subscribers.add(listener);
        }
        return () -> state.subscribers.remove(listener);
    }

    public List<StreamEvent> getEventHistory(String streamId) {
        StreamState state = streams.get(streamId);
        if (state == null) {
            return List.of();
        }
        synchronized (state) {
            return new ArrayList<>(state.history);
        }
    }

    public boolean streamExists(String streamId) {
        return streams.containsKey(streamId);
    }

    public int activeStreamCount() {
        return streams.size();
    }

    private void deliver(StreamState state, String line) {
        for (Consumer<String> subscriber : state.subscribers) {
            try {
                subscriber.accept(line);
            } catch (RuntimeException e) {
                log.warn("Stream subscriber failed on {}", state.streamId, e);
            }
        }
    }

    private StreamState requireStream(String streamId) {
        StreamState state = streamId == null ? null : streams.get(streamId);
        if (state == null) {
            throw new IllegalStateException("Stream not found: " + streamId);
        }
        return state;
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }

    private static final class StreamState {
        private final String streamId;
        private final String sessionId;
        private final Deque<StreamEvent> history = new ArrayDeque<>();
        private final List<Consumer<String>> subscribers = new CopyOnWriteArrayList<>();

        private StreamState(String streamId, String sessionId) {
            this.streamId = streamId;
            this.sessionId = sessionId;
        }
    }
}
