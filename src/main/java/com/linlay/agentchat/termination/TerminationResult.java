package com.linlay.agentchat.termination;

import com.linlay.agentchat.agent.ParallelAgent;

import java.util.List;

public record TerminationResult(
        Status status,
        List<ParallelAgent> agents,
        List<String> interruptedIds,
        Throwable error
) {

    public TerminationResult {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        agents = agents == null ? List.of() : List.copyOf(agents);
        interruptedIds = interruptedIds == null ? List.of() : List.copyOf(interruptedIds);
    }

    public static TerminationResult noop(List<ParallelAgent> agents) {
        return new TerminationResult(Status.NOOP, agents, List.of(), null);
    }

    public static TerminationResult terminated(List<ParallelAgent> agents, List<String> interruptedIds) {
        return new TerminationResult(Status.TERMINATED, agents, interruptedIds, null);
    }

    public static TerminationResult failed(List<ParallelAgent> agents, Throwable error) {
        return new TerminationResult(Status.FAILED, agents, List.of(), error);
    }

    public enum Status {
        NOOP,
        TERMINATED,
        FAILED
    }
}
