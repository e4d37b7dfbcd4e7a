package com.nori.tc.throughput.testbed;

/**
 * test bed 협력자(configurator, endpoint, traffic tool)가 던지는 예외의 공통 부모.
 */
public class TestBedException extends RuntimeException {

    public TestBedException(String message) {
        super(message);
    }

    public TestBedException(String message, Throwable cause) {
        super(message, cause);
    }
}
