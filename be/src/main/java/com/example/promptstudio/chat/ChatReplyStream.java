package com.example.promptstudio.chat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Paced delivery of an assistant reply, one word-chunk per tick, followed by a deferred commit.
 * <p>
 * The commit (persisting the assistant message) runs once, only after every chunk was delivered, and
 * never after {@link #cancel()} won the race. State moves
 * {@code READY -> STREAMING -> COMMITTING -> COMPLETED}; cancellation moves {@code READY} or
 * {@code STREAMING} to {@code CANCELLED}; a failing listener or commit ends in {@code FAILED}.
 * </p>
 */
public class ChatReplyStream {

    private static final Logger log = LoggerFactory.getLogger(ChatReplyStream.class);

    public enum State { READY, STREAMING, COMMITTING, COMPLETED, CANCELLED, FAILED }

    /** Receives chunks on the scheduler thread. */
    public interface Listener {

        void onChunk(String chunk);

        void onComplete();

        void onError(Throwable error);
    }

    private final String sessionId;
    private final List<String> chunks;
    private final Runnable commit;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final AtomicReference<State> state = new AtomicReference<>(State.READY);
    private final CompletableFuture<State> finished = new CompletableFuture<>();

    private volatile ScheduledFuture<?> ticker;
    private int nextChunk;

    public ChatReplyStream(String sessionId, String reply, Runnable commit, ScheduledExecutorService scheduler, Duration interval) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.chunks = chunk(Objects.requireNonNull(reply, "reply"));
        this.commit = Objects.requireNonNull(commit, "commit");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    /** Splits the reply on spaces; every chunk is a word followed by one space. */
    static List<String> chunk(String reply) {
        List<String> words = new ArrayList<>();
        for (String word : reply.split(" ")) {
            words.add(word + " ");
        }
        return words;
    }

    public List<String> chunks() {
        return List.copyOf(chunks);
    }

    public State state() {
        return state.get();
    }

    /** Completes with the terminal state. */
    public CompletableFuture<State> finished() {
        return finished;
    }

    public void start(Listener listener) {
        Objects.requireNonNull(listener, "listener");
        if (!state.compareAndSet(State.READY, State.STREAMING)) {
            throw new IllegalStateException("Chat reply stream for session " + sessionId + " already " + state.get());
        }
        long millis = interval.toMillis();
        ticker = scheduler.scheduleAtFixedRate(() -> tick(listener), millis, millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Stops the stream before its commit. Returns false when the reply is already being committed or has ended.
     */
    public boolean cancel() {
        if (state.compareAndSet(State.STREAMING, State.CANCELLED) || state.compareAndSet(State.READY, State.CANCELLED)) {
            stopTicker();
            finished.complete(State.CANCELLED);
            log.info("Chat reply stream cancelled sessionId={} deliveredChunks={}", sessionId, nextChunk);
            return true;
        }
        return false;
    }

    private void tick(Listener listener) {
        if (state.get() != State.STREAMING) {
            stopTicker();
            return;
        }
        try {
            if (nextChunk < chunks.size()) {
                listener.onChunk(chunks.get(nextChunk++));
                return;
            }
            if (!state.compareAndSet(State.STREAMING, State.COMMITTING)) {
                return;
            }
            stopTicker();
            commit.run();
            state.set(State.COMPLETED);
            finished.complete(State.COMPLETED);
        } catch (RuntimeException e) {
            fail(listener, e);
            return;
        }
        log.debug("Chat reply committed sessionId={} chunks={}", sessionId, chunks.size());
        listener.onComplete();
    }

    private void fail(Listener listener, RuntimeException error) {
        State current = state.get();
        if ((current != State.STREAMING && current != State.COMMITTING) || !state.compareAndSet(current, State.FAILED)) {
            log.debug("Ignoring stream error after {} sessionId={}: {}", state.get(), sessionId, error.getMessage());
            return;
        }
        stopTicker();
        log.warn("Chat reply stream failed sessionId={} state={} error={}", sessionId, current, error.getMessage());
        try {
            listener.onError(error);
        } finally {
            finished.complete(State.FAILED);
        }
    }

    private void stopTicker() {
        ScheduledFuture<?> current = ticker;
        if (current != null) {
            current.cancel(false);
        }
    }
}
