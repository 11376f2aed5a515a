package ticketsync.server.support;

import ticketsync.server.agent.AgentAck;
import ticketsync.server.agent.AgentClient;
import ticketsync.server.agent.AgentInvocationException;
import ticketsync.server.agent.AgentPreconditionException;
import ticketsync.server.agent.AgentRequest;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Agent client that records requests and fails a configurable number of times.
 */
public class FakeAgentClient implements AgentClient {

    private final List<AgentRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private volatile String failureMessage = "Gateway returned 503: unavailable";
    private volatile String preconditionMessage;

    /** Fail the next {@code times} calls with a transport error */
    public FakeAgentClient failNext(int times, String message) {
        failuresLeft.set(times);
        failureMessage = message;
        return this;
    }

    public FakeAgentClient alwaysFail(String message) {
        return failNext(Integer.MAX_VALUE, message);
    }

    public FakeAgentClient missingToken(String message) {
        preconditionMessage = message;
        return this;
    }

    @Override
    public AgentAck invoke(AgentRequest request) {
        requests.add(request);
        if (preconditionMessage != null) {
            throw new AgentPreconditionException(preconditionMessage);
        }
        if (failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new AgentInvocationException(failureMessage);
        }
        return new AgentAck("child-" + requests.size());
    }

    public int calls() {
        return requests.size();
    }

    public List<AgentRequest> requests() {
        return requests;
    }
}
