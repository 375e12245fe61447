package com.github.salilvnair.chatflow.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@AutoConfiguration
@AutoConfigurationPackage(basePackages = "com.github.salilvnair.chatflow")
@ComponentScan(basePackages = "com.github.salilvnair.chatflow")
@EntityScan(basePackages = "com.github.salilvnair.chatflow.entity")
@EnableJpaRepositories(basePackages = "com.github.salilvnair.chatflow.repo")
@EnableScheduling
public class ChatFlowAutoConfiguration {
}
