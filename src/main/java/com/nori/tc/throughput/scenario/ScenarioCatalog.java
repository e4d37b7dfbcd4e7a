package com.nori.tc.throughput.scenario;

import com.nori.tc.throughput.logging.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * ScenarioCatalog
 *
 * 역할:
 * - throughput 시나리오 전체를 선언적 테이블로 보관한다.
 * - 각 family(ANDROID / SMOKE / ZMQ / RF)의 radio 행 × protocol × direction 조합을 펼쳐서
 *   ScenarioDefinition 목록을 만든다.
 * - 실행 로직은 없다. 실행은 OrchestrationSequencer 하나가 담당한다.
 *
 * family별 고정값:
 * - ANDROID: UE 1대, 최소 sample rate, SHORT, HIGH, TA 자동/TAC auto, 항상 아티팩트 수집, 로그 검색 없음
 * - SMOKE  : UE 4대, test bed 기본 sample rate, SHORT, LOW, TA 0/TAC 0, 로그 검색, bitrate 검증 없음(tolerance 0)
 * - ZMQ    : UE 4대, test bed 기본 sample rate, SHORT, HIGH, TA 0/TAC 0, 로그 검색
 * - RF     : UE 4대, UDP만, LONG, HIGH, TA 자동/TAC auto, 항상 아티팩트 수집
 */
public final class ScenarioCatalog {

    private static final Logger log = LoggerFactory.getLogger(ScenarioCatalog.class);

    public static final long LOW_BITRATE_BPS = 1_000_000L;
    public static final long HIGH_BITRATE_BPS = 15_000_000L;

    private static final int SINGLE_UE = 1;
    private static final int FOUR_UES = 4;

    // ─── radio 테이블 ────────────────────────────────────────────────────────

    private static final List<Radio> ANDROID_RADIOS = List.of(
            new Radio(3, 15, 10),
            new Radio(78, 30, 20)
    );

    private static final List<ZmqRow> SMOKE_ROWS = List.of(
            new ZmqRow(new Radio(3, 15, 20), LOW_BITRATE_BPS, true),
            new ZmqRow(new Radio(41, 30, 20), LOW_BITRATE_BPS, true)
    );

    private static final List<ZmqRow> ZMQ_ROWS = List.of(
            new ZmqRow(new Radio(3, 15, 5), HIGH_BITRATE_BPS, false),
            new ZmqRow(new Radio(3, 15, 10), HIGH_BITRATE_BPS, false),
            new ZmqRow(new Radio(3, 15, 20), HIGH_BITRATE_BPS, false),
            new ZmqRow(new Radio(3, 15, 50), HIGH_BITRATE_BPS, true),
            new ZmqRow(new Radio(41, 30, 10), HIGH_BITRATE_BPS, false),
            new ZmqRow(new Radio(41, 30, 20), HIGH_BITRATE_BPS, false),
            new ZmqRow(new Radio(41, 30, 50), HIGH_BITRATE_BPS, true)
    );

    private static final List<Radio> RF_RADIOS = List.of(
            new Radio(3, 15, 10),
            new Radio(41, 30, 10)
    );

    private final Map<String, ScenarioDefinition> byId;
    private final Map<ScenarioCategory, List<ScenarioDefinition>> byCategory;

    /**
     * @param sampleRates      ANDROID family의 최소 sample rate 조회용
     * @param defaultTolerance 별도 지정이 없는 family의 bitrate tolerance
     */
    public ScenarioCatalog(SampleRateTable sampleRates, double defaultTolerance) {
        Objects.requireNonNull(sampleRates, "sampleRates must not be null");

        Map<ScenarioCategory, List<ScenarioDefinition>> tmp = new EnumMap<>(ScenarioCategory.class);
        tmp.put(ScenarioCategory.ANDROID, android(sampleRates, defaultTolerance));
        tmp.put(ScenarioCategory.SMOKE, zmq(ScenarioCategory.SMOKE, SMOKE_ROWS, 0.0));
        tmp.put(ScenarioCategory.ZMQ, zmq(ScenarioCategory.ZMQ, ZMQ_ROWS, defaultTolerance));
        tmp.put(ScenarioCategory.RF, rf(defaultTolerance));

        Map<String, ScenarioDefinition> ids = new LinkedHashMap<>();
        for (List<ScenarioDefinition> defs : tmp.values()) {
            for (ScenarioDefinition def : defs) {
                if (ids.putIfAbsent(def.id(), def) != null) {
                    throw new IllegalStateException("duplicate scenario id: " + def.id());
                }
            }
        }

        this.byId = Collections.unmodifiableMap(ids);
        this.byCategory = Collections.unmodifiableMap(tmp);

        log.info(StructuredLog.event("scenario_catalog_ready",
                "total", byId.size(),
                "android", tmp.get(ScenarioCategory.ANDROID).size(),
                "smoke", tmp.get(ScenarioCategory.SMOKE).size(),
                "zmq", tmp.get(ScenarioCategory.ZMQ).size(),
                "rf", tmp.get(ScenarioCategory.RF).size()));
    }

    // ─── 조회 ─────────────────────────────────────────────────────────────────

    public List<ScenarioDefinition> all() {
        return List.copyOf(byId.values());
    }

    public List<ScenarioDefinition> byCategory(ScenarioCategory category) {
        return byCategory.getOrDefault(category, List.of());
    }

    public ScenarioDefinition get(String id) {
        return byId.get(id);
    }

    /**
     * 분류 + id 정규식으로 실행 대상을 고른다.
     *
     * @param categories 비어 있으면 전체 분류
     * @param idPattern  null/blank면 필터 없음. 부분 일치(find) 기준.
     */
    public List<ScenarioDefinition> select(Set<ScenarioCategory> categories, String idPattern) {
        Set<ScenarioCategory> wanted = (categories == null || categories.isEmpty())
                ? EnumSet.allOf(ScenarioCategory.class)
                : EnumSet.copyOf(categories);
        Pattern pattern = (idPattern == null || idPattern.isBlank()) ? null : Pattern.compile(idPattern.trim());

        List<ScenarioDefinition> out = new ArrayList<>();
        for (ScenarioDefinition def : byId.values()) {
            if (!wanted.contains(def.category())) continue;
            if (pattern != null && !pattern.matcher(def.id()).find()) continue;
            out.add(def);
        }
        return out;
    }

    // ─── family 전개 ─────────────────────────────────────────────────────────

    private static List<ScenarioDefinition> android(SampleRateTable sampleRates, double tolerance) {
        List<ScenarioDefinition> out = new ArrayList<>();
        for (Radio radio : ANDROID_RADIOS) {
            for (TrafficProtocol protocol : TrafficProtocol.values()) {
                for (TrafficDirection direction : TrafficDirection.values()) {
                    ScenarioParameters p = radio.apply(ScenarioParameters.builder())
                            .sampleRateHz(sampleRates.minimumForBandwidth(radio.bandwidthMHz()))
                            .duration(DurationTier.SHORT)
                            .protocol(protocol)
                            .targetBitrateBps(HIGH_BITRATE_BPS)
                            .direction(direction)
                            .timingAdvance(ScenarioParameters.TIMING_ADVANCE_AUTO)
                            .timeAlignmentCalibration(TimeAlignmentCalibration.AUTO)
                            .artifactPolicy(new ArtifactPolicy(true, false))
                            .bitrateToleranceFraction(tolerance)
                            .build();
                    out.add(new ScenarioDefinition(
                            id(ScenarioCategory.ANDROID, radio.id(), protocol, direction),
                            ScenarioCategory.ANDROID, SINGLE_UE, p));
                }
            }
        }
        return Collections.unmodifiableList(out);
    }

    private static List<ScenarioDefinition> zmq(ScenarioCategory category, List<ZmqRow> rows, double tolerance) {
        List<ScenarioDefinition> out = new ArrayList<>();
        for (ZmqRow row : rows) {
            for (TrafficProtocol protocol : TrafficProtocol.values()) {
                for (TrafficDirection direction : TrafficDirection.values()) {
                    ScenarioParameters p = row.radio().apply(ScenarioParameters.builder())
                            .sampleRateHz(null)
                            .duration(DurationTier.SHORT)
                            .targetBitrateBps(row.bitrateBps())
                            .protocol(protocol)
                            .direction(direction)
                            .timingAdvance(0)
                            .timeAlignmentCalibration(TimeAlignmentCalibration.of(0))
                            .artifactPolicy(new ArtifactPolicy(row.alwaysDownloadArtifacts(), true))
                            .bitrateToleranceFraction(tolerance)
                            .build();
                    out.add(new ScenarioDefinition(
                            id(category, row.id(), protocol, direction),
                            category, FOUR_UES, p));
                }
            }
        }
        return Collections.unmodifiableList(out);
    }

    private static List<ScenarioDefinition> rf(double tolerance) {
        List<ScenarioDefinition> out = new ArrayList<>();
        for (Radio radio : RF_RADIOS) {
            for (TrafficDirection direction : TrafficDirection.values()) {
                ScenarioParameters p = radio.apply(ScenarioParameters.builder())
                        .sampleRateHz(null)
                        .duration(DurationTier.LONG)
                        .protocol(TrafficProtocol.UDP)
                        .targetBitrateBps(HIGH_BITRATE_BPS)
                        .direction(direction)
                        .timingAdvance(ScenarioParameters.TIMING_ADVANCE_AUTO)
                        .timeAlignmentCalibration(TimeAlignmentCalibration.AUTO)
                        .artifactPolicy(new ArtifactPolicy(true, false))
                        .bitrateToleranceFraction(tolerance)
                        .build();
                out.add(new ScenarioDefinition(
                        id(ScenarioCategory.RF, radio.id(), TrafficProtocol.UDP, direction),
                        ScenarioCategory.RF, FOUR_UES, p));
            }
        }
        return Collections.unmodifiableList(out);
    }

    private static String id(ScenarioCategory category, String rowId, TrafficProtocol protocol, TrafficDirection direction) {
        return category.name().toLowerCase(Locale.ROOT) + "/" + rowId
                + "-" + protocol.name().toLowerCase(Locale.ROOT)
                + "-" + direction.name().toLowerCase(Locale.ROOT);
    }

    // ─── 테이블 행 타입 ──────────────────────────────────────────────────────

    private record Radio(int band, int scsKHz, int bandwidthMHz) {

        ScenarioParameters.Builder apply(ScenarioParameters.Builder b) {
            return b.band(band).subcarrierSpacingKHz(scsKHz).bandwidthMHz(bandwidthMHz);
        }

        String id() {
            return "band:" + band + "-scs:" + scsKHz + "-bandwidth:" + bandwidthMHz;
        }
    }

    private record ZmqRow(Radio radio, long bitrateBps, boolean alwaysDownloadArtifacts) {

        String id() {
            return radio.id() + "-bitrate:" + bitrateBps + "-artifacts:" + alwaysDownloadArtifacts;
        }
    }
}
