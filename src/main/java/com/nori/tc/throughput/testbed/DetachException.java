package com.nori.tc.throughput.testbed;

/**
 * teardown 중 정리 실패. 결과를 바꾸지 않고 경고로만 남긴다.
 */
public class DetachException extends TestBedException {

    public DetachException(String message) {
        super(message);
    }

    public DetachException(String message, Throwable cause) {
        super(message, cause);
    }
}
