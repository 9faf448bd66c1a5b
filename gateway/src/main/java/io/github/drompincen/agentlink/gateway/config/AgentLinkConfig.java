package io.github.drompincen.agentlink.gateway.config;

import io.github.drompincen.agentlink.runtime.config.ClientSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AgentLinkConfig {

    @Bean
    ClientSettings clientSettings(AgentLinkProperties properties) {
        return properties.toClientSettings();
    }
}
