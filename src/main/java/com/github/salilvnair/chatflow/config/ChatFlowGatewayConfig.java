package com.github.salilvnair.chatflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "chatflow.gateway")
@Getter
@Setter
public class ChatFlowGatewayConfig {

    private boolean enabled = false;
    private String baseUrl = "https://graph.facebook.com/v20.0";
    private String phoneNumberId;
    private String accessToken;
    private String verifyToken;
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(15);
}
