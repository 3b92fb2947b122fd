package com.example.hipagent;

import com.example.hipagent.config.HipAgentProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class HipAgentApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(HipAgentApplication.class, args);
        if (context.getBean(HipAgentProperties.class).evaluation().enabled()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
