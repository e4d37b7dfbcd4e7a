package com.nori.tc.throughput.logging;

import java.time.Duration;
import java.util.Collection;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * StructuredLog
 *
 * 목적:
 * - 시나리오/단계 로그를 "event=... key=value" 한 줄 형식으로 통일한다.
 * - 로그 수집기에서 scenarioId, phase 단위로 grep/집계할 수 있어야 한다.
 *
 * 값 인코딩 규칙:
 * - Double/Float: 소수점 4자리까지, Locale.ROOT (shortfall, bitrate Mbps 등)
 * - Duration: 밀리초 정수 + "ms" (예: 20000ms)
 * - Collection: 쉼표로 이어붙인 뒤 공백이 있으면 quote
 * - 공백/따옴표/백슬래시/=/제어문자 포함 시 "..."로 감싸고 escape
 *
 * 예:
 * - StructuredLog.event("attach_completed", "scenarioId", "band:3-scs:15", "ueId", "ue-1")
 *   -> event=attach_completed scenarioId=band:3-scs:15 ueId=ue-1
 */
public final class StructuredLog {

    private StructuredLog() {
        // utility class
    }

    public static String event(String event, Object... kv) {
        StringBuilder sb = new StringBuilder(160);
        append(sb, "event", event);
        appendAll(sb, kv);
        return sb.toString();
    }

    public static String kv(Object... kv) {
        StringBuilder sb = new StringBuilder(128);
        appendAll(sb, kv);
        return sb.toString();
    }

    private static void appendAll(StringBuilder sb, Object[] kv) {
        if (kv == null) {
            return;
        }
        // 홀수 개면 마지막 key는 값이 없으므로 버린다.
        int usable = kv.length - (kv.length % 2);
        for (int i = 0; i < usable; i += 2) {
            append(sb, String.valueOf(kv[i]), kv[i + 1]);
        }
    }

    private static void append(StringBuilder sb, String key, Object value) {
        if (key == null || key.isBlank()) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(key).append('=').append(quoteIfNeeded(render(value)));
    }

    static String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return String.valueOf(d);
            }
            String s = String.format(Locale.ROOT, "%.4f", d);
            // 불필요한 trailing zero 제거: 0.2000 -> 0.2, 3.0000 -> 3
            s = s.replaceAll("0+$", "");
            return s.endsWith(".") ? s.substring(0, s.length() - 1) : s;
        }
        if (value instanceof Duration duration) {
            return duration.toMillis() + "ms";
        }
        if (value instanceof Collection<?> items) {
            StringJoiner joiner = new StringJoiner(",");
            for (Object item : items) {
                joiner.add(render(item));
            }
            return joiner.toString();
        }
        return String.valueOf(value);
    }

    private static String quoteIfNeeded(String s) {
        boolean plain = !s.isEmpty();
        for (int i = 0; i < s.length() && plain; i++) {
            char c = s.charAt(i);
            plain = !(Character.isWhitespace(c) || c == '"' || c == '\\' || c == '=' || c < 0x20);
        }
        if (plain) {
            return s;
        }

        StringBuilder out = new StringBuilder(s.length() + 8).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format(Locale.ROOT, "\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }
}
