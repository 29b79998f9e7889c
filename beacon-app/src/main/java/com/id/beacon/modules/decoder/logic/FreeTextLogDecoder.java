package com.id.beacon.modules.decoder.logic;

import com.id.beacon.model.BeaconLogRecord;
import com.id.beacon.model.BeaconTelemetryBatch;
import com.id.beacon.model.BeaconTelemetryDialect;
import com.id.beacon.modules.decoder.model.DecodeResult;
import com.id.beacon.modules.decoder.model.TelemetrySignal;
import com.id.beacon.utils.BeaconTelemetryBatchBuilder;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Syslog-style text lines: {@code <timestamp> <host> <process>[<pid>]: <message>}, where the timestamp
 * is either an ISO-8601 instant or an RFC 3164 {@code MMM d HH:mm:ss} stamp. RFC 3164 stamps carry no
 * year; the current UTC year is assumed.
 */
@Component
public class FreeTextLogDecoder implements TelemetryDialectDecoder {

    private static final Pattern LINE = Pattern.compile(
            "^(?<ts>\\d{4}-\\d{2}-\\d{2}[T ]\\S+|[A-Z][a-z]{2} +\\d{1,2} \\d{2}:\\d{2}:\\d{2})"
                    + "\\s+(?<host>\\S+)"
                    + "\\s+(?<process>[^\\s\\[\\]:]+)(?:\\[(?<pid>\\d+)])?:"
                    + "\\s?(?<message>.*)$");

    private static final Pattern SEVERITY = Pattern.compile(
            "^\\[?(?<level>TRACE|DEBUG|INFO|NOTICE|WARN|WARNING|ERR|ERROR|CRIT|CRITICAL|ALERT|EMERG|FATAL)]?(?=[\\s:]|$)",
            Pattern.CASE_INSENSITIVE);

    // RFC 3164 stamp with the assumed year appended
    private static final DateTimeFormatter RFC3164_WITH_YEAR = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("MMM d HH:mm:ss uuuu")
            .toFormatter(Locale.ENGLISH);

    private final Clock clock;

    public FreeTextLogDecoder(Clock clock) {
        this.clock = clock;
    }

    @Override
    public BeaconTelemetryDialect dialect() {
        return BeaconTelemetryDialect.FREE_TEXT_LOG;
    }

    @Override
    public DecodeResult decode(byte[] payload, TelemetrySignal signal) {
        if (!signal.accepts(TelemetrySignal.LOGS)) {
            return DecodeResult.failure(dialect(), "free text only carries logs");
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload))
                    .toString();
        } catch (CharacterCodingException e) {
            return DecodeResult.failure(dialect(), "payload is not UTF-8 text");
        }

        BeaconTelemetryBatchBuilder builder = BeaconTelemetryBatch.builder(dialect());
        int lineNo = 0;
        for (String line : text.split("\\r?\\n")) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            Matcher m = LINE.matcher(line.strip());
            if (!m.matches()) {
                return DecodeResult.failure(dialect(), "line " + lineNo + " is not a syslog-style record");
            }
            Long timestamp = parseTimestamp(m.group("ts"));
            if (timestamp == null) {
                return DecodeResult.failure(dialect(), "line " + lineNo + " has an unparseable timestamp");
            }

            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("host", m.group("host"));
            attributes.put("process", m.group("process"));
            if (m.group("pid") != null) {
                attributes.put("pid", m.group("pid"));
            }
            String message = m.group("message");

            builder.addLog(BeaconLogRecord.builder()
                    .timestamp(timestamp)
                    .severity(severity(message))
                    .body(message)
                    .attributes(attributes)
                    .tenantId(ClusterIdResolver.resolve(attributes))
                    .build());
        }
        return DecodeResult.success(builder.build());
    }

    static String severity(String message) {
        Matcher m = SEVERITY.matcher(message);
        return m.find() ? m.group("level").toUpperCase(Locale.ROOT) : "";
    }

    // nanoseconds since epoch, or null when unparseable
    private Long parseTimestamp(String raw) {
        Instant instant;
        try {
            if (Character.isDigit(raw.charAt(0))) {
                instant = parseIso(raw.replace(' ', 'T'));
            } else {
                int year = Instant.now(clock).atZone(ZoneOffset.UTC).getYear();
                instant = LocalDateTime.parse(raw.replaceAll(" +", " ") + " " + year, RFC3164_WITH_YEAR)
                        .toInstant(ZoneOffset.UTC);
            }
        } catch (DateTimeParseException e) {
            return null;
        }
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    private static Instant parseIso(String raw) {
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC);
        }
    }
}
