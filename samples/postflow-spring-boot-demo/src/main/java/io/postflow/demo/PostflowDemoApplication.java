package io.postflow.demo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Long-running dispatcher process. Polls for due schedules and publishes them to every
 * platform enabled under {@code postflow.platforms.*}.
 * <p>
 * Run with: mvn install -DskipTests && mvn -f samples/postflow-spring-boot-demo/pom.xml spring-boot:run
 * <p>
 * Posts and media live in the application's own {@code posts} and {@code media_files}
 * tables; schedules and platform connections are written to the postflow tables by the
 * authoring side.
 */
@SpringBootApplication
public class PostflowDemoApplication {

    public static void main(String[] args) {
        SpringApplication.run(PostflowDemoApplication.class, args);
    }
}
