package com.elssolution.tuyaexporter.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    private volatile boolean stopping = false; // mute noise while shutting down

    @PostConstruct
    void registerAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.info("Global uncaught handler installed");
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        stopping = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (stopping) {
            log.debug("Uncaught in {} during shutdown: {}", t.getName(), e.toString());
            return;
        }
        log.error("Uncaught in {} ({}) -> {}", t.getName(), classify(t), e.toString(), e);
    }

    private String classify(Thread t) {
        String name = (t.getName() == null ? "" : t.getName());
        if (name.startsWith(SchedulingConfig.FETCH_THREAD_PREFIX)) return "FETCH";
        if (name.startsWith(SchedulingConfig.POLL_THREAD_PREFIX)) return "POLL";
        return "OTHER";
    }
}
