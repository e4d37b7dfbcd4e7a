package com.nori.tc.throughput.suite;

import com.nori.tc.throughput.outcome.Verdict;

import java.util.List;
import java.util.Objects;

/**
 * suite 전체 집계.
 *
 * exit code: 실패/에러가 하나도 없으면 0, 아니면 1
 */
public record SuiteSummary(List<ScenarioResult> results) {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;

    public SuiteSummary {
        results = List.copyOf(Objects.requireNonNull(results, "results must not be null"));
    }

    public long count(Verdict verdict) {
        return results.stream().filter(r -> r.outcome().verdict() == verdict).count();
    }

    public int exitCode() {
        return (count(Verdict.FAIL) == 0 && count(Verdict.ERROR) == 0) ? EXIT_OK : EXIT_FAILED;
    }
}
