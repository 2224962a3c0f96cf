package com.campaign.canon.run;

import java.time.Duration;

/**
 * Waits between stage retries. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
