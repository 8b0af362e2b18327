package com.my.notegraph.adapter.out.clock;

import com.my.notegraph.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.Instant;

/**
 * 왜: 시스템 시간을 주입형으로 제공해 에코 윈도우 만료를 테스트에서 고정할 수 있도록 하기 위함.
 */
public class SystemClockAdapter implements ClockPort {

    private final Clock clock;

    private SystemClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static SystemClockAdapter system() {
        return new SystemClockAdapter(Clock.systemUTC());
    }

    public static SystemClockAdapter of(Clock clock) {
        return new SystemClockAdapter(clock);
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
