package com.my.notegraph.domain.port.out;

import java.time.Instant;

/**
 * 왜: 현재 시각을 주입형으로 분리하여 에코 윈도우 만료를 테스트에서 제어하기 위함.
 */
public interface ClockPort {
    Instant now();
}
