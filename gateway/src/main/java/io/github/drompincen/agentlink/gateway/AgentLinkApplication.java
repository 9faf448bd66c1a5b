package io.github.drompincen.agentlink.gateway;

import io.github.drompincen.agentlink.gateway.config.AgentLinkProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.agentlink")
@EnableConfigurationProperties(AgentLinkProperties.class)
public class AgentLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentLinkApplication.class, args);
    }
}
