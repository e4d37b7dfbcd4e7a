package com.nori.tc.throughput;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * tc-throughput-e2e
 *
 * - 시뮬레이션 test bed 위에서 throughput 시나리오 suite를 실행한다.
 * - 실행 대상/타임아웃/test bed 설정은 tc.throughput.* (application.yml)
 */
@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.nori.tc.throughput")
public class TcThroughputE2eApplication {

    public static void main(String[] args) {
        SpringApplication.run(TcThroughputE2eApplication.class, args);
    }
}
