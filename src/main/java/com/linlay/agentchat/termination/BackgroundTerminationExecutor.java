package com.linlay.agentchat.termination;

import com.linlay.agentchat.agent.AgentTransitions;
import com.linlay.agentchat.agent.ParallelAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs a confirmed background termination in two phases.
 * <ol>
 *     <li>Check the snapshot for active background agents; without any, the abort callback is not invoked.</li>
 *     <li>Await the runtime abort callback. If it fails, the snapshot taken before the call is returned untouched.</li>
 *     <li>Re-read the live snapshot, since it may have moved during the await, and interrupt the background
 *     agents that are still active.</li>
 * </ol>
 */
@Component
public class BackgroundTerminationExecutor {

    private static final Logger log = LoggerFactory.getLogger(BackgroundTerminationExecutor.class);

    private final Clock clock;

    public BackgroundTerminationExecutor(Clock clock) {
        this.clock = clock;
    }

    public Mono<TerminationResult> execute(
            Supplier<List<ParallelAgent>> liveAgents,
            Supplier<Mono<Void>> abortCallback
    ) {
        return execute(liveAgents, abortCallback,
                () -> AgentTransitions.interruptActiveBackground(liveAgents.get(), clock.millis()));
    }

    /**
     * @param interrupt applied once the abort succeeded; it re-reads the live agents and interrupts the
     *                  active background ones atomically
     */
    public Mono<TerminationResult> execute(
            Supplier<List<ParallelAgent>> liveAgents,
            Supplier<Mono<Void>> abortCallback,
            Supplier<AgentTransitions.InterruptResult> interrupt
    ) {
        return Mono.defer(() -> {
            List<ParallelAgent> initialAgents = List.copyOf(liveAgents.get());
            if (AgentTransitions.activeBackground(initialAgents).isEmpty()) {
                return Mono.just(TerminationResult.noop(initialAgents));
            }

            Mono<Void> abort = Mono.defer(() -> {
                Mono<Void> invoked = abortCallback == null ? null : abortCallback.get();
                return invoked == null ? Mono.<Void>empty() : invoked;
            });

            return abort
                    .then(Mono.fromSupplier(() -> {
                        AgentTransitions.InterruptResult result = interrupt.get();
                        log.info("Background agents interrupted ids={}", result.interruptedIds());
                        return TerminationResult.terminated(result.agents(), result.interruptedIds());
                    }))
                    .onErrorResume(error -> {
                        log.warn("Background agent abort failed, local state left unchanged", error);
                        return Mono.just(TerminationResult.failed(initialAgents, error));
                    });
        });
    }
}
