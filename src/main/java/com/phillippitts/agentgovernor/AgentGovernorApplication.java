package com.phillippitts.agentgovernor;

import com.phillippitts.agentgovernor.config.properties.GovernanceProperties;
import com.phillippitts.agentgovernor.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        GovernanceProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class AgentGovernorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentGovernorApplication.class, args);
    }

}
