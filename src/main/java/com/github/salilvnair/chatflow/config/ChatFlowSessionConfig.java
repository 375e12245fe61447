package com.github.salilvnair.chatflow.config;

import com.github.salilvnair.chatflow.engine.state.Language;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "chatflow.session")
@Getter
@Setter
public class ChatFlowSessionConfig {

    private int stackDepth = 8;
    private Duration ttl = Duration.ofHours(24);
    private Duration idleResumeAfter = Duration.ofMinutes(30);
    private int maxConflictRetries = 3;
    private int recentEventIds = 32;
    private Language defaultLanguage = Language.EN;
}
