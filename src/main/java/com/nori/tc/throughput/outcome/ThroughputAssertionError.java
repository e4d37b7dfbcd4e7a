package com.nori.tc.throughput.outcome;

/**
 * FAIL 판정을 테스트 러너에 "실패"로 전달하기 위한 AssertionError.
 * (AssertionError 이외의 예외는 러너가 "에러"로 분류한다.)
 */
public class ThroughputAssertionError extends AssertionError {

    private final transient Outcome.Failed outcome;

    public ThroughputAssertionError(Outcome.Failed outcome) {
        super(outcome.describe());
        this.outcome = outcome;
    }

    public Outcome.Failed getOutcome() {
        return outcome;
    }
}
