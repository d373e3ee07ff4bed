package com.linlay.agentchat.session;

import com.linlay.agentchat.agent.AgentLifecycleStore;
import com.linlay.agentchat.agent.ParallelAgent;
import com.linlay.agentchat.event.RawSessionEvent;
import com.linlay.agentchat.event.SessionEvent;
import com.linlay.agentchat.event.SessionEventNormalizer;
import com.linlay.agentchat.event.SubagentEventReducer;
import com.linlay.agentchat.stream.ToolBlockingPolicy;
import com.linlay.agentchat.termination.BackgroundTermination;
import com.linlay.agentchat.termination.BackgroundTerminationExecutor;
import com.linlay.agentchat.termination.KeyPress;
import com.linlay.agentchat.termination.PressCounter;
import com.linlay.agentchat.termination.TerminationDecision;
import com.linlay.agentchat.termination.TerminationResult;
import com.linlay.agentchat.transcript.ChatMessage;
import com.linlay.agentchat.transcript.TranscriptService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives the turns of one chat session: prompt submission, event intake, cancellation and background
 * agent termination.
 * <p>
 * Finished assistant messages take the agent snapshot of their turn. Callbacks scheduled during a turn carry
 * the stream generation and are skipped once the turn was cancelled.
 */
@Service
public class ChatTurnCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ChatTurnCoordinator.class);

    private final SessionEventNormalizer normalizer;
    private final SubagentEventReducer reducer;
    private final AgentLifecycleStore store;
    private final TranscriptService transcript;
    private final BackgroundTerminationExecutor terminationExecutor;
    private final AgentSessionClient client;
    private final Clock clock;
    private final PressCounter pressCounter = new PressCounter();

    private String streamingMessageId;
    private long turnGeneration;

    public ChatTurnCoordinator(
            SessionEventNormalizer normalizer,
            SubagentEventReducer reducer,
            AgentLifecycleStore store,
            TranscriptService transcript,
            BackgroundTerminationExecutor terminationExecutor,
            AgentSessionClient client,
            Clock clock
    ) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.reducer = Objects.requireNonNull(reducer, "reducer must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.transcript = Objects.requireNonNull(transcript, "transcript must not be null");
        this.terminationExecutor = Objects.requireNonNull(terminationExecutor, "terminationExecutor must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void setActiveSessionId(String sessionId) {
        reducer.setActiveSessionId(sessionId);
    }

    /**
     * Appends the prompt and an empty streaming assistant message, then opens a new stream and run.
     */
    public synchronized Turn startTurn(String prompt) {
        if (!StringUtils.hasText(prompt)) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
        if (store.streamState().isStreaming()) {
            throw new IllegalStateException("A turn is already streaming: " + streamingMessageId);
        }
        transcript.append(ChatMessage.user(newMessageId(), prompt, clock.instant()));
        ChatMessage assistant = ChatMessage.streamingAssistant(newMessageId(), clock.instant());
        transcript.append(assistant);

        turnGeneration = store.startStream(assistant.id(), false);
        long runId = reducer.beginRun();
        streamingMessageId = assistant.id();
        log.info("Turn started messageId={}, runId={}, generation={}", assistant.id(), runId, turnGeneration);
        return new Turn(assistant.id(), turnGeneration, runId);
    }

    /**
     * @return true when the event changed the session state
     */
    public synchronized boolean onEvent(RawSessionEvent raw) {
        Optional<SessionEvent> normalized = normalizer.normalize(raw);
        if (normalized.isEmpty()) {
            return false;
        }
        SessionEvent event = normalized.get();
        if (event instanceof SessionEvent.MessageDelta delta) {
            if (isForeignSession(event)) {
                log.debug("Drop message.delta of foreign sessionId={}", event.sessionId());
                return false;
            }
            return applyDelta(delta);
        }
        if (event instanceof SessionEvent.MessageCompleted || event instanceof SessionEvent.SessionErrored) {
            if (isForeignSession(event)) {
                log.debug("Drop turn end of foreign sessionId={}", event.sessionId());
                return false;
            }
            if (event instanceof SessionEvent.SessionErrored errored) {
                log.warn("Session {} reported error: {}", errored.sessionId(), errored.message());
            }
            return queueCompletion();
        }
        if (event instanceof SessionEvent.SessionStarted started) {
            if (reducer.activeSessionId() == null) {
                reducer.setActiveSessionId(started.sessionId());
            }
            return false;
        }
        if (event instanceof SessionEvent.PermissionRequested permission) {
            log.info("Permission requested requestId={}, tool={}", permission.requestId(), permission.toolName());
            return false;
        }
        if (event instanceof SessionEvent.SessionIdle idle) {
            log.debug("Session {} idle reason={}", idle.sessionId(), idle.reason());
            return false;
        }
        return reducer.reduce(event);
    }

    /**
     * Stops the current turn at once, then awaits the runtime abort. Whatever the abort outcome, the
     * interrupted message finally takes the latest agent snapshot.
     */
    public Mono<Void> cancelTurn() {
        String messageId;
        synchronized (this) {
            if (!store.streamState().isStreaming() || streamingMessageId == null) {
                return Mono.empty();
            }
            messageId = streamingMessageId;
            streamingMessageId = null;
            long generation = store.cancelStream();
            reducer.endRun();
            transcript.update(messageId, message -> message.interrupt(store.agents()));
            log.info("Turn cancelled messageId={}, generation={}", messageId, generation);
        }
        return Mono.defer(() -> {
                    Mono<Void> abort = client.abort();
                    return abort == null ? Mono.<Void>empty() : abort;
                })
                .onErrorResume(error -> {
                    log.warn("Runtime abort failed for messageId={}", messageId, error);
                    return Mono.empty();
                })
                .then(Mono.fromRunnable(() ->
                        transcript.update(messageId, message -> message.withParallelAgents(store.agents()))));
    }

    /**
     * Handles a key press of the background termination protocol. On a confirmed press the two-phase
     * termination is started right away; the interruption is applied to the lifecycle store in one step.
     */
    public synchronized TerminationPress onTerminationKey(KeyPress key) {
        if (!BackgroundTermination.isTerminationKey(key)) {
            return new TerminationPress(TerminationDecision.none(), Mono.empty());
        }
        BackgroundTermination.PressEvaluation evaluation =
                BackgroundTermination.evaluatePress(pressCounter, store.activeBackgroundAgents().size());
        TerminationDecision decision = evaluation.decision();
        if (decision.action() != TerminationDecision.Action.TERMINATE) {
            return new TerminationPress(decision, Mono.empty());
        }
        Mono<TerminationResult> result = terminationExecutor
                .execute(store::agents, client::abortBackgroundAgents, store::interruptActiveBackground)
                .cache();
        result.subscribe();
        return new TerminationPress(decision, result);
    }

    public int pressCount() {
        return pressCounter.get();
    }

    public boolean shouldDeferComposerSubmit() {
        return ToolBlockingPolicy.shouldDeferComposerSubmit(
                store.streamState().isStreaming(), reducer.runningAskQuestionTools());
    }

    public boolean shouldDispatchQueuedMessage() {
        return ToolBlockingPolicy.shouldDispatchQueuedMessage(
                store.streamState().isStreaming(), reducer.runningAskQuestionTools());
    }

    public synchronized String streamingMessageId() {
        return streamingMessageId;
    }

    /**
     * Events of another session never touch the live turn. Before any session is bound, everything is
     * accepted.
     */
    private boolean isForeignSession(SessionEvent event) {
        String activeSessionId = reducer.activeSessionId();
        return activeSessionId != null && !activeSessionId.equals(event.sessionId());
    }

    private boolean applyDelta(SessionEvent.MessageDelta delta) {
        if (streamingMessageId == null || !store.isCurrentGeneration(turnGeneration)) {
            log.debug("Drop message.delta outside of a live turn messageId={}", delta.messageId());
            return false;
        }
        store.markStreamingMeta();
        return transcript.update(streamingMessageId, message -> message.appendContent(delta.delta()));
    }

    private boolean queueCompletion() {
        if (streamingMessageId == null || !store.isCurrentGeneration(turnGeneration)) {
            return false;
        }
        String messageId = streamingMessageId;
        store.deferCompletion(() -> completeTurn(messageId));
        return true;
    }

    private synchronized void completeTurn(String messageId) {
        if (!messageId.equals(streamingMessageId)) {
            return;
        }
        List<ParallelAgent> snapshot = store.finishStream();
        transcript.update(messageId, message -> message.complete(snapshot));
        streamingMessageId = null;
        if (reducer.isRunSettled()) {
            reducer.endRun();
        }
        log.info("Turn completed messageId={}, agents={}", messageId, snapshot.size());
    }

    private static String newMessageId() {
        return "msg_" + UUID.randomUUID().toString().replace("-", "");
    }

    public record Turn(String messageId, long generation, long runId) {
    }

    /**
     * @param result termination outcome; empty unless the press confirmed termination
     */
    public record TerminationPress(TerminationDecision decision, Mono<TerminationResult> result) {
    }
}
