package github.sarthakdev143.timeline_compiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TimelineCompilerApplication {

	public static void main(String[] args) {
		SpringApplication.run(TimelineCompilerApplication.class, args);
	}

}
