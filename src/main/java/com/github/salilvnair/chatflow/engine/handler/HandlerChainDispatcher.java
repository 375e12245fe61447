package com.github.salilvnair.chatflow.engine.handler;

import com.github.salilvnair.chatflow.engine.session.EngineSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Component
public class HandlerChainDispatcher {

    private final HandlerChain chain;

    public HandlerChainDispatcher(HandlerChain chain) {
        this.chain = chain;
        log.info(
                "ChatFlow handler chain: {}",
                chain.handlers().stream().map(FlowHandler::name).collect(Collectors.joining(" -> "))
        );
    }

    /**
     * Gives the event to the first handler claiming the current state.
     *
     * @return the handler's replies, or empty when no handler claims the state or the
     *         claiming handler passed
     */
    public Optional<HandlerOutcome.Handled> dispatch(EngineSession session) {
        for (FlowHandler handler : chain.handlers()) {
            if (!handler.claims(session.getState())) {
                continue;
            }
            HandlerOutcome outcome = handler.handle(session);
            if (outcome instanceof HandlerOutcome.Handled) {
                session.setHandledBy(handler.name());
                return Optional.of((HandlerOutcome.Handled) outcome);
            }
            log.debug("Handler {} passed userId={} state={}", handler.name(), session.getUserId(), session.getState());
            return Optional.empty();
        }
        return Optional.empty();
    }
}
