package com.openforge.devgauge;

import com.openforge.devgauge.llm.LlmProperties;
import com.openforge.devgauge.memory.MemoryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({LlmProperties.class, MemoryProperties.class})
public class DevGaugeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DevGaugeApplication.class, args);
    }
}
