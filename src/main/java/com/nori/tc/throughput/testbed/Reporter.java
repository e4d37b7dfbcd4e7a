package com.nori.tc.throughput.testbed;

import com.nori.tc.throughput.outcome.Outcome;
import com.nori.tc.throughput.scenario.ArtifactPolicy;

/**
 * 실행 후 아티팩트(로그, pcap 등) 수집 요청을 받는다.
 */
public interface Reporter {

    Reporter NOOP = (policy, outcome) -> { };

    void collectArtifacts(ArtifactPolicy policy, Outcome outcome);
}
