package com.nori.tc.throughput.testbed;

/**
 * configurator가 시나리오 설정을 거부했다.
 * - attach 이전에 발생하므로 detach 대상이 없다.
 * - 재시도하지 않는다(설정은 결정적이라고 가정).
 */
public class ConfigurationException extends TestBedException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
