package com.nori.tc.throughput.outcome;

/**
 * 테스트 러너에 보고되는 최종 분류.
 *
 * - PASS : 통과
 * - FAIL : 측정 실패(bitrate 미달, 전송 실패)
 * - ERROR: 인프라 에러(설정 거부, attach 실패, 측정 타임아웃)
 */
public enum Verdict {
    PASS,
    FAIL,
    ERROR
}
