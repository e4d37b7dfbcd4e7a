package com.nori.tc.throughput.testbed;

import com.nori.tc.throughput.scenario.ScenarioParameters;

/**
 * 시나리오 파라미터를 base station / core network 설정으로 반영한다.
 *
 * 계약:
 * - 같은 파라미터로 두 번 호출해도 결과 설정은 같아야 한다(누적 부작용 없음).
 * - 거부 시 ConfigurationException.
 */
public interface Configurator {

    void apply(ScenarioParameters parameters);
}
