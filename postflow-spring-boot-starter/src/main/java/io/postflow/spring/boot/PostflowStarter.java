package io.postflow.spring.boot;

import io.postflow.Postflow;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;

/**
 * Starts polling once the application is ready, so the first tick never races context
 * startup. Shutdown is handled by the {@link Postflow} bean's destroy method.
 */
public class PostflowStarter implements ApplicationListener<ApplicationReadyEvent> {

    private final Postflow postflow;

    public PostflowStarter(Postflow postflow) {
        this.postflow = postflow;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        postflow.start();
    }
}
