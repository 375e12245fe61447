package com.github.salilvnair.chatflow.delivery.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.chatflow.config.ChatFlowGatewayConfig;
import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Sends through the WhatsApp Cloud API messages endpoint.
 * 2xx is delivered; 408, 429, 5xx and I/O errors are transient; other statuses are permanent.
 */
@Slf4j
public class CloudApiMessagingGateway implements MessagingGateway {

    private final ChatFlowGatewayConfig config;
    private final HttpClient httpClient;

    public CloudApiMessagingGateway(ChatFlowGatewayConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.getConnectTimeout()).build());
    }

    CloudApiMessagingGateway(ChatFlowGatewayConfig config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public SendOutcome send(String recipient, OutboundPayload payload) {
        HttpRequest request = HttpRequest.newBuilder(endpoint())
                .timeout(config.getReadTimeout())
                .header("Authorization", "Bearer " + config.getAccessToken())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(recipient, payload), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        }
        catch (IOException e) {
            return new SendOutcome.TransientFailure("I/O error: " + e.getMessage(), null);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new SendOutcome.TransientFailure("interrupted", null);
        }
        return classify(response.statusCode(), response.body(), response.headers().firstValue("Retry-After"));
    }

    static SendOutcome classify(int status, String body, Optional<String> retryAfterHeader) {
        if (status >= 200 && status < 300) {
            JsonNode id = JsonUtil.parseOrNull(body).path("messages").path(0).path("id");
            return new SendOutcome.Delivered(id.isMissingNode() ? null : id.asText());
        }
        String reason = "HTTP " + status + errorDetail(body);
        if (status == 408 || status == 429 || status >= 500) {
            return new SendOutcome.TransientFailure(reason, retryAfterHeader.flatMap(CloudApiMessagingGateway::seconds).orElse(null));
        }
        return new SendOutcome.PermanentFailure(reason);
    }

    static String requestBody(String recipient, OutboundPayload payload) {
        ObjectNode root = JsonUtil.object();
        root.put("messaging_product", "whatsapp");
        root.put("to", recipient);
        if (payload instanceof OutboundPayload.Media media) {
            String type = media.kind() == OutboundPayload.MediaKind.IMAGE ? "image" : "document";
            root.put("type", type);
            ObjectNode node = root.putObject(type);
            String ref = media.mediaRef();
            node.put(ref.startsWith("http://") || ref.startsWith("https://") ? "link" : "id", ref);
            if (media.caption() != null) {
                node.put("caption", media.caption());
            }
        }
        else {
            root.put("type", "text");
            root.putObject("text").put("body", ((OutboundPayload.Text) payload).body());
        }
        return JsonUtil.toJson(root);
    }

    private URI endpoint() {
        String base = config.getBaseUrl().endsWith("/") ? config.getBaseUrl() : config.getBaseUrl() + "/";
        return URI.create(base + config.getPhoneNumberId() + "/messages");
    }

    private static String errorDetail(String body) {
        JsonNode message = JsonUtil.parseOrNull(body).path("error").path("message");
        return message.isMissingNode() || message.isNull() ? "" : " " + message.asText();
    }

    private static Optional<Duration> seconds(String header) {
        try {
            return Optional.of(Duration.ofSeconds(Long.parseLong(header.trim())));
        }
        catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header: {}", header);
            return Optional.empty();
        }
    }
}
