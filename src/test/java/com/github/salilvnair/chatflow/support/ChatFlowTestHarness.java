package com.github.salilvnair.chatflow.support;

import com.github.salilvnair.chatflow.config.ChatFlowDeliveryConfig;
import com.github.salilvnair.chatflow.config.ChatFlowSessionConfig;
import com.github.salilvnair.chatflow.delivery.OutboundDeliveryPipeline;
import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.delivery.gateway.SendOutcome;
import com.github.salilvnair.chatflow.delivery.ratelimit.DeliveryRateLimiter;
import com.github.salilvnair.chatflow.delivery.retry.ExponentialBackoffRetryPolicy;
import com.github.salilvnair.chatflow.domain.DocumentParser;
import com.github.salilvnair.chatflow.domain.NotificationScheduler;
import com.github.salilvnair.chatflow.domain.RegexIdentifierValidator;
import com.github.salilvnair.chatflow.domain.TaxComputationService;
import com.github.salilvnair.chatflow.engine.command.GlobalCommandInterceptor;
import com.github.salilvnair.chatflow.engine.core.DefaultConversationalEngine;
import com.github.salilvnair.chatflow.engine.core.UserLockRegistry;
import com.github.salilvnair.chatflow.engine.factory.EnginePipelineFactory;
import com.github.salilvnair.chatflow.engine.handler.HandlerChain;
import com.github.salilvnair.chatflow.engine.handler.HandlerChainDispatcher;
import com.github.salilvnair.chatflow.engine.handler.flow.ConnectCaHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.CreditCheckHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.DocumentUploadHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.ModuleSwitchHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.MultiGstinHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.NilFilingHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.NotificationSettingsHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.SessionExpiryHandler;
import com.github.salilvnair.chatflow.engine.model.EngineResult;
import com.github.salilvnair.chatflow.engine.model.InboundEvent;
import com.github.salilvnair.chatflow.engine.model.InboundEventType;
import com.github.salilvnair.chatflow.engine.session.InMemorySessionRepository;
import com.github.salilvnair.chatflow.engine.session.SessionRepository;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.steps.GlobalCommandStep;
import com.github.salilvnair.chatflow.engine.steps.HandlerChainStep;
import com.github.salilvnair.chatflow.engine.steps.IdleResumeStep;
import com.github.salilvnair.chatflow.engine.steps.StateTransitionStep;
import com.github.salilvnair.chatflow.engine.transition.StateTransitionCore;
import com.github.salilvnair.chatflow.engine.transition.rules.GstTransitions;
import com.github.salilvnair.chatflow.engine.transition.rules.ItrTransitions;
import com.github.salilvnair.chatflow.engine.transition.rules.MenuTransitions;
import com.github.salilvnair.chatflow.i18n.MessageCatalog;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import com.github.salilvnair.chatflow.template.ThymeleafTemplateRenderer;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.mockito.Mockito.mock;

/**
 * The full engine wired by hand: real pipeline, handlers, transition tables and catalog,
 * mocked domain facades, an in-memory session repository and a delivery pipeline whose
 * gateway records what it was asked to send.
 */
public final class ChatFlowTestHarness {

    public final MutableClock clock = new MutableClock(TestConstants.T0);
    public final ChatFlowSessionConfig sessionConfig = new ChatFlowSessionConfig();
    public final ChatFlowDeliveryConfig deliveryConfig = new ChatFlowDeliveryConfig();
    public final TaxComputationService taxService = mock(TaxComputationService.class);
    public final DocumentParser documentParser = mock(DocumentParser.class);
    public final NotificationScheduler notificationScheduler = mock(NotificationScheduler.class);
    public final InMemoryDeadLetterStore deadLetters = new InMemoryDeadLetterStore();
    public final List<OutboundPayload> sent = new CopyOnWriteArrayList<>();
    public final ReplyComposer replies;
    public final SessionRepository sessions;
    public final OutboundDeliveryPipeline delivery;
    public final DefaultConversationalEngine engine;

    public ChatFlowTestHarness() {
        this(null);
    }

    public ChatFlowTestHarness(SessionRepository sessionRepository) {
        deliveryConfig.setAutoStart(false);
        replies = new ReplyComposer(new MessageCatalog(), new ThymeleafTemplateRenderer());
        RegexIdentifierValidator validator = new RegexIdentifierValidator();

        HandlerChain chain = HandlerChain.of(
                new SessionExpiryHandler(replies),
                new ModuleSwitchHandler(replies),
                new NilFilingHandler(replies, taxService),
                new DocumentUploadHandler(replies, documentParser),
                new CreditCheckHandler(replies, taxService, notificationScheduler),
                new MultiGstinHandler(replies, validator),
                new NotificationSettingsHandler(replies, notificationScheduler),
                new ConnectCaHandler(replies, notificationScheduler)
        );
        StateTransitionCore core = new StateTransitionCore(List.of(
                new MenuTransitions(replies),
                new GstTransitions(validator, taxService, replies),
                new ItrTransitions(validator, taxService, replies, clock)
        ), replies);

        EnginePipelineFactory factory = new EnginePipelineFactory(List.of(
                new StateTransitionStep(core),
                new HandlerChainStep(new HandlerChainDispatcher(chain)),
                new IdleResumeStep(sessionConfig, replies),
                new GlobalCommandStep(new GlobalCommandInterceptor(), replies)
        ), List.of());
        factory.init();

        sessions = sessionRepository == null ? new InMemorySessionRepository(sessionConfig, clock) : sessionRepository;
        delivery = new OutboundDeliveryPipeline(
                (recipient, payload) -> {
                    sent.add(payload);
                    return new SendOutcome.Delivered(UUID.randomUUID().toString());
                },
                new ExponentialBackoffRetryPolicy(1000, 60_000),
                deadLetters,
                DeliveryRateLimiter.from(deliveryConfig.getRateLimit()),
                deliveryConfig,
                clock
        );
        engine = new DefaultConversationalEngine(factory, sessions, new UserLockRegistry(), delivery,
                replies, sessionConfig, clock);
    }

    public EngineResult text(String body) {
        return text(TestConstants.USER_ID, body);
    }

    public EngineResult text(String userId, String body) {
        return engine.process(textEvent(userId, body));
    }

    public EngineResult media(String mediaRef) {
        return engine.process(InboundEvent.builder()
                .messageId(UUID.randomUUID().toString())
                .senderId(TestConstants.USER_ID)
                .type(InboundEventType.DOCUMENT)
                .mediaRef(mediaRef)
                .timestamp(clock.instant())
                .build());
    }

    public InboundEvent textEvent(String userId, String body) {
        return InboundEvent.builder()
                .messageId(UUID.randomUUID().toString())
                .senderId(userId)
                .type(InboundEventType.TEXT)
                .text(body)
                .timestamp(clock.instant())
                .build();
    }

    public ChatSession session() {
        return sessions.load(TestConstants.USER_ID).orElseThrow();
    }

    /** Text of every reply in the result, joined. */
    public static String replyText(EngineResult result) {
        StringBuilder out = new StringBuilder();
        for (OutboundPayload payload : result.replies()) {
            if (payload instanceof OutboundPayload.Text text) {
                out.append(text.body()).append('\n');
            }
        }
        return out.toString();
    }
}
