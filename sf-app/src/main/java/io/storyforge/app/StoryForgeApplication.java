package io.storyforge.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "io.storyforge")
@ConfigurationPropertiesScan
public class StoryForgeApplication {
    public static void main(String[] args) {
        SpringApplication.run(StoryForgeApplication.class, args);
    }
}
