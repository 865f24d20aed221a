package com.kmg.classifier.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
public class TimeService {
    private final Clock clock;

    @Autowired
    public TimeService() {
        this(Clock.systemUTC());
    }

    public TimeService(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }
}
