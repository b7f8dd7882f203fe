package com.hockeyfeed.backend.scraping;

import java.time.Duration;
import org.springframework.stereotype.Component;

@Component
public class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        long ms = Math.max(0, duration.toMillis());
        if (ms > 0) {
            Thread.sleep(ms);
        }
    }
}
