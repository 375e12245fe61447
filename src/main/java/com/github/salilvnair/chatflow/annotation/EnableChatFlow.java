package com.github.salilvnair.chatflow.annotation;

import com.github.salilvnair.chatflow.config.ChatFlowAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ChatFlowAutoConfiguration.class)
public @interface EnableChatFlow {
}
