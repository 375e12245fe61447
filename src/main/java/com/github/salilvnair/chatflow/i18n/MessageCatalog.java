package com.github.salilvnair.chatflow.i18n;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.chatflow.engine.state.Language;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Localised message templates loaded from {@code chatflow/messages.json}
 * ({@code key -> language code -> template}). Missing translations fall back to English,
 * missing keys to the key itself.
 */
@Slf4j
@Component
public class MessageCatalog {

    public static final String DEFAULT_LOCATION = "chatflow/messages.json";

    private final Map<String, Map<String, String>> templates;

    public MessageCatalog() {
        this(load(DEFAULT_LOCATION));
    }

    public MessageCatalog(Map<String, Map<String, String>> templates) {
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
        log.info("Loaded {} message templates", this.templates.size());
    }

    public String template(String key, Language language) {
        Map<String, String> byLanguage = templates.get(key);
        if (byLanguage == null) {
            log.warn("Missing message template key={}", key);
            return key;
        }
        String code = language == null ? Language.EN.code() : language.code();
        String template = byLanguage.get(code);
        if (template == null) {
            template = byLanguage.get(Language.EN.code());
        }
        return template == null ? key : template;
    }

    public boolean contains(String key) {
        return templates.containsKey(key);
    }

    static Map<String, Map<String, String>> load(String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            return new ObjectMapper().readValue(in, new TypeReference<Map<String, Map<String, String>>>() {});
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to load message catalog " + location, e);
        }
    }
}
