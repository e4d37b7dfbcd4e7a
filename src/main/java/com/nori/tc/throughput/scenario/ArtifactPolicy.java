package com.nori.tc.throughput.scenario;

/**
 * 아티팩트(로그/pcap) 보존 정책.
 *
 * @param alwaysDownload 결과와 무관하게 항상 수집
 * @param searchLogs     실패(또는 에러) 시 로그를 수집하여 검색 대상으로 남긴다
 */
public record ArtifactPolicy(boolean alwaysDownload, boolean searchLogs) {

    /**
     * teardown 시점에 reporter에게 수집을 요청해야 하는지 판단한다.
     *
     * @param passed 지금까지 확정된 결과가 PASS인지
     */
    public boolean shouldCollect(boolean passed) {
        return alwaysDownload || (!passed && searchLogs);
    }
}
