package com.github.salilvnair.chatflow.config;

import com.github.salilvnair.chatflow.delivery.dead.DeadLetterStore;
import com.github.salilvnair.chatflow.delivery.dead.JpaDeadLetterStore;
import com.github.salilvnair.chatflow.delivery.gateway.CloudApiMessagingGateway;
import com.github.salilvnair.chatflow.delivery.gateway.LoggingMessagingGateway;
import com.github.salilvnair.chatflow.delivery.gateway.MessagingGateway;
import com.github.salilvnair.chatflow.delivery.ratelimit.DeliveryRateLimiter;
import com.github.salilvnair.chatflow.delivery.retry.ExponentialBackoffRetryPolicy;
import com.github.salilvnair.chatflow.delivery.retry.RetryPolicy;
import com.github.salilvnair.chatflow.domain.DocumentParser;
import com.github.salilvnair.chatflow.domain.IdentifierValidator;
import com.github.salilvnair.chatflow.domain.LoggingNotificationScheduler;
import com.github.salilvnair.chatflow.domain.NotificationScheduler;
import com.github.salilvnair.chatflow.domain.RegexIdentifierValidator;
import com.github.salilvnair.chatflow.domain.TaxComputationService;
import com.github.salilvnair.chatflow.domain.UnconfiguredDocumentParser;
import com.github.salilvnair.chatflow.domain.UnconfiguredTaxComputationService;
import com.github.salilvnair.chatflow.engine.handler.HandlerChain;
import com.github.salilvnair.chatflow.engine.handler.flow.ConnectCaHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.CreditCheckHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.DocumentUploadHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.ModuleSwitchHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.MultiGstinHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.NilFilingHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.NotificationSettingsHandler;
import com.github.salilvnair.chatflow.engine.handler.flow.SessionExpiryHandler;
import com.github.salilvnair.chatflow.engine.session.InMemorySessionRepository;
import com.github.salilvnair.chatflow.engine.session.SessionRepository;
import com.github.salilvnair.chatflow.repo.DeadLetterRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Default collaborators. Each one backs off when the host application defines its own.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class ChatFlowBeanConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock chatFlowClock() {
        return Clock.systemUTC();
    }

    /** Order matters: the first handler that claims the current state wins. */
    @Bean
    @ConditionalOnMissingBean
    public HandlerChain handlerChain(SessionExpiryHandler sessionExpiry,
                                     ModuleSwitchHandler moduleSwitch,
                                     NilFilingHandler nilFiling,
                                     DocumentUploadHandler documentUpload,
                                     CreditCheckHandler creditCheck,
                                     MultiGstinHandler multiGstin,
                                     NotificationSettingsHandler notificationSettings,
                                     ConnectCaHandler connectCa) {
        return HandlerChain.of(sessionExpiry, moduleSwitch, nilFiling, documentUpload,
                creditCheck, multiGstin, notificationSettings, connectCa);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionRepository sessionRepository(ChatFlowSessionConfig config, Clock clock) {
        return new InMemorySessionRepository(config, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public IdentifierValidator identifierValidator() {
        return new RegexIdentifierValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentParser documentParser() {
        return new UnconfiguredDocumentParser();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaxComputationService taxComputationService() {
        return new UnconfiguredTaxComputationService();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationScheduler notificationScheduler() {
        return new LoggingNotificationScheduler();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy deliveryRetryPolicy(ChatFlowDeliveryConfig config) {
        ChatFlowDeliveryConfig.Retry retry = config.getRetry();
        return new ExponentialBackoffRetryPolicy(retry.getBackoffBase(), retry.getBackoffMax());
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryRateLimiter deliveryRateLimiter(ChatFlowDeliveryConfig config) {
        return DeliveryRateLimiter.from(config.getRateLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterStore deadLetterStore(DeadLetterRepository repository) {
        return new JpaDeadLetterStore(repository);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessagingGateway messagingGateway(ChatFlowGatewayConfig config) {
        if (config.isEnabled()) {
            log.info("ChatFlow gateway: Cloud API phoneNumberId={}", config.getPhoneNumberId());
            return new CloudApiMessagingGateway(config);
        }
        log.info("ChatFlow gateway disabled, outbound messages are only logged");
        return new LoggingMessagingGateway();
    }
}
