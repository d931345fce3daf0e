package com.ledger.order.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * Rebuilds the read models from the event store once the application has started.
 */
@Slf4j
@RequiredArgsConstructor
public class StartupReplayRunner implements ApplicationRunner {

    private final EventReplayService replayService;

    @Override
    public void run(ApplicationArguments args) {
        ReplayReport report = replayService.replayAllEvents();
        if (!report.isComplete()) {
            log.warn("Startup replay left read models partial: failed={}, total={}",
                    report.failures().size(), report.total());
        }
    }
}
