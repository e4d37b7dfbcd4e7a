package com.nori.tc.throughput.sim;

import com.nori.tc.throughput.logging.StructuredLog;
import com.nori.tc.throughput.outcome.Outcome;
import com.nori.tc.throughput.scenario.ArtifactPolicy;
import com.nori.tc.throughput.testbed.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 수집할 실제 아티팩트가 없는 시뮬레이션 test bed용 reporter.
 * 수집 요청과 결과 요약만 남긴다.
 */
public class LoggingArtifactReporter implements Reporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingArtifactReporter.class);

    @Override
    public void collectArtifacts(ArtifactPolicy policy, Outcome outcome) {
        log.info(StructuredLog.event("artifacts_requested",
                "alwaysDownload", policy.alwaysDownload(),
                "searchLogs", policy.searchLogs(),
                "verdict", outcome.verdict(),
                "detail", outcome.describe(),
                "warnings", outcome.warnings()));
    }
}
