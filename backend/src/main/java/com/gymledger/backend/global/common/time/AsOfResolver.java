package com.gymledger.backend.global.common.time;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;

import org.springframework.stereotype.Component;

/**
 * Defaults an omitted "as of" instant at the web boundary. Services never read
 * the clock for lifecycle decisions; they receive the resolved value.
 */
@Component
public class AsOfResolver {

    private final Clock clock;

    public AsOfResolver(Clock clock) {
        this.clock = clock;
    }

    public OffsetDateTime resolve(OffsetDateTime requested) {
        return requested != null ? requested : OffsetDateTime.now(clock);
    }

    public LocalDate resolveDate(LocalDate requested) {
        return requested != null ? requested : LocalDate.now(clock);
    }
}
