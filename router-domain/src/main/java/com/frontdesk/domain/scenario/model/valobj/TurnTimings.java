package com.frontdesk.domain.scenario.model.valobj;

/**
 * 单回合耗时拆分（毫秒）。
 */
public record TurnTimings(long match, long render, long tts, long total) {

    public static final TurnTimings ZERO = new TurnTimings(0L, 0L, 0L, 0L);
}
