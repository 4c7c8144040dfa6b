package com.marketwatch.tracker.scrape.service;

import com.marketwatch.tracker.scrape.model.SchedulerState;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.Locale;

@ResponseStatus(HttpStatus.CONFLICT)
public class CycleAlreadyRunningException extends RuntimeException {
    public CycleAlreadyRunningException(SchedulerState state) {
        super("A scrape cycle is already " + state.name().toLowerCase(Locale.ROOT));
    }
}
