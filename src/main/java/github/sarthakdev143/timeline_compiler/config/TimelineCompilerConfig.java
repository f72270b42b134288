package github.sarthakdev143.timeline_compiler.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TimelineCompilerProperties.class)
public class TimelineCompilerConfig {
}
