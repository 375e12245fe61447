package com.github.salilvnair.chatflow.template;

import com.github.salilvnair.chatflow.engine.state.ChatSession;
import org.springframework.stereotype.Component;
import org.thymeleaf.context.Context;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders catalog templates. Templates use {@code {{name}}} placeholders, which are
 * rewritten to Thymeleaf TEXT-mode inline expressions before processing.
 */
@Component
public class ThymeleafTemplateRenderer {

    private static final Pattern VAR_PATTERN = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");

    private final SpringTemplateEngine templateEngine;

    public ThymeleafTemplateRenderer() {
        StringTemplateResolver resolver = new StringTemplateResolver();
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCacheable(false);

        SpringTemplateEngine engine = new SpringTemplateEngine();
        engine.setTemplateResolver(resolver);
        engine.setEnableSpringELCompiler(true);
        this.templateEngine = engine;
    }

    public String render(String template, ChatSession session, Map<String, Object> variables) {
        String raw = template == null ? "" : template;
        if (raw.isBlank() || !VAR_PATTERN.matcher(raw).find()) {
            return raw;
        }
        Context context = new Context();
        context.setVariables(buildVariables(session, variables));
        String rendered = templateEngine.process(normalizeTemplate(raw), context);
        return rendered == null ? "" : rendered;
    }

    public Map<String, Object> buildVariables(ChatSession session, Map<String, Object> variables) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (session != null) {
            merged.put("userId", session.getUserId());
            merged.put("state", session.getState().name());
            merged.put("language", session.getLanguage().code());
            for (Map.Entry<String, Object> entry : session.getData().entrySet()) {
                if (entry.getKey() != null) {
                    merged.putIfAbsent(entry.getKey(), entry.getValue());
                }
            }
        }
        if (variables != null) {
            merged.putAll(variables);
        }
        return merged;
    }

    private String normalizeTemplate(String template) {
        Matcher matcher = VAR_PATTERN.matcher(template);
        StringBuffer out = new StringBuffer();
        while (matcher.find()) {
            String replacement = "[[${" + matcher.group(1).trim() + "}]]";
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
