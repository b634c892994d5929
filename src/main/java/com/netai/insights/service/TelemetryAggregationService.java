package com.netai.insights.service;

import com.netai.insights.config.AggregationConfig;
import com.netai.insights.config.MetricsConfig;
import com.netai.insights.model.AggregationReport;
import com.netai.insights.model.BatchSummary;
import com.netai.insights.model.DevicePerformance;
import com.netai.insights.model.HourlyTraffic;
import com.netai.insights.model.PerformanceIssues;
import com.netai.insights.model.ProblematicDevice;
import com.netai.insights.model.ReportProvenance;
import com.netai.insights.model.SecurityEventSummary;
import com.netai.insights.model.TelemetryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Group-by analytics over a telemetry batch. Every method is a pure function of its input:
 * records whose grouping key is null are left out of that grouping, and null metric values are
 * skipped by means, maxima and sums. Equal sort keys are ordered by grouping key so the same batch
 * always yields the same report.
 */
@Service
public class TelemetryAggregationService {

    private static final Logger log = LoggerFactory.getLogger(TelemetryAggregationService.class);

    private static final String SECURITY_CATEGORY = "security";

    private final AggregationConfig config;
    private final MetricsConfig metricsConfig;

    public TelemetryAggregationService(AggregationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public AggregationReport aggregate(List<TelemetryRecord> batch) {
        log.info("Aggregating {} telemetry records", batch.size());

        AggregationReport report = AggregationReport.builder()
                .summary(buildSummary(batch))
                .devicePerformance(devicePerformance(batch))
                .hourlyTraffic(hourlyTraffic(batch))
                .performanceIssues(performanceIssues(batch))
                .problematicDevices(problematicDevices(batch))
                .securitySummary(securitySummary(batch))
                .provenance(provenance(batch))
                .build();

        metricsConfig.recordAggregationRun("full");
        log.info("Aggregation complete: {} devices, {} hourly buckets, {} security groups",
                report.getDevicePerformance().size(), report.getHourlyTraffic().size(),
                report.getSecuritySummary().size());
        return report;
    }

    public List<DevicePerformance> devicePerformance(List<TelemetryRecord> batch) {
        Map<DeviceLocationKey, List<TelemetryRecord>> groups = batch.stream()
                .filter(r -> r.getDeviceId() != null && r.getDeviceType() != null && r.getLocation() != null)
                .collect(Collectors.groupingBy(
                        r -> new DeviceLocationKey(r.getDeviceId(), r.getDeviceType(), r.getLocation()),
                        TreeMap::new, Collectors.toList()));

        List<DevicePerformance> rows = new ArrayList<>();
        groups.forEach((key, records) -> {
            long successCount = records.stream().filter(r -> Boolean.TRUE.equals(r.getSuccess())).count();
            rows.add(DevicePerformance.builder()
                    .deviceId(key.deviceId())
                    .deviceType(key.deviceType())
                    .location(key.location())
                    .eventCount(records.size())
                    .avgLatency(mean(records, TelemetryRecord::getLatencyMs))
                    .maxLatency(max(records, TelemetryRecord::getLatencyMs))
                    .avgCpu(mean(records, TelemetryRecord::getCpuUtilization))
                    .avgMemory(mean(records, TelemetryRecord::getMemoryUtilization))
                    .avgThroughput(mean(records, TelemetryRecord::getThroughputMbps))
                    .totalRetransmissions(sum(records, TelemetryRecord::getTcpRetransmissions))
                    .avgPacketLoss(mean(records, TelemetryRecord::getPacketLoss))
                    .successCount(successCount)
                    .successRate(successCount * 100.0 / records.size())
                    .build());
        });

        // groups are already in key order; a stable sort keeps it for equal latencies
        rows.sort(Comparator.comparing(DevicePerformance::getAvgLatency,
                Comparator.nullsLast(Comparator.<Double>reverseOrder())));
        return rows;
    }

    public List<HourlyTraffic> hourlyTraffic(List<TelemetryRecord> batch) {
        ZoneId zone = ZoneId.of(config.getZoneId());
        Map<HourKey, List<TelemetryRecord>> groups = batch.stream()
                .filter(r -> r.getTimestamp() != null && r.getDeviceType() != null)
                .collect(Collectors.groupingBy(
                        r -> new HourKey(r.getTimestamp().atZone(zone).getHour(), r.getDeviceType()),
                        TreeMap::new, Collectors.toList()));

        List<HourlyTraffic> rows = new ArrayList<>();
        groups.forEach((key, records) -> rows.add(HourlyTraffic.builder()
                .hour(key.hour())
                .deviceType(key.deviceType())
                .eventCount(records.size())
                .avgLatency(mean(records, TelemetryRecord::getLatencyMs))
                .avgThroughput(mean(records, TelemetryRecord::getThroughputMbps))
                .totalBytesSent(sumLong(records, TelemetryRecord::getBytesSent))
                .totalBytesReceived(sumLong(records, TelemetryRecord::getBytesReceived))
                .build()));
        return rows;
    }

    public PerformanceIssues performanceIssues(List<TelemetryRecord> batch) {
        long highLatency = batch.stream().filter(this::highLatency).count();
        long highCpu = batch.stream().filter(this::highCpu).count();
        long highPacketLoss = batch.stream().filter(this::highPacketLoss).count();
        long highRetransmissions = batch.stream().filter(this::highRetransmissions).count();

        return PerformanceIssues.builder()
                .highLatencyCount(highLatency)
                .highCpuCount(highCpu)
                .highPacketLossCount(highPacketLoss)
                .highRetransmissionCount(highRetransmissions)
                .totalIssues(highLatency + highCpu + highPacketLoss + highRetransmissions)
                .build();
    }

    /**
     * Devices ranked by the number of their records exceeding any performance threshold.
     */
    public List<ProblematicDevice> problematicDevices(List<TelemetryRecord> batch) {
        Predicate<TelemetryRecord> anyIssue = ((Predicate<TelemetryRecord>) this::highLatency)
                .or(this::highCpu)
                .or(this::highPacketLoss)
                .or(this::highRetransmissions);

        Map<DeviceKey, Long> counts = batch.stream()
                .filter(anyIssue)
                .filter(r -> r.getDeviceId() != null && r.getDeviceType() != null)
                .collect(Collectors.groupingBy(
                        r -> new DeviceKey(r.getDeviceId(), r.getDeviceType()),
                        TreeMap::new, Collectors.counting()));

        return counts.entrySet().stream()
                .sorted(Map.Entry.<DeviceKey, Long>comparingByValue().reversed())
                .limit(config.getTopProblematicDevices())
                .map(e -> ProblematicDevice.builder()
                        .deviceId(e.getKey().deviceId())
                        .deviceType(e.getKey().deviceType())
                        .issueCount(e.getValue())
                        .build())
                .toList();
    }

    public List<SecurityEventSummary> securitySummary(List<TelemetryRecord> batch) {
        Map<EventKey, List<TelemetryRecord>> groups = batch.stream()
                .filter(TelemetryAggregationService::isSecurityEvent)
                .filter(r -> r.getEventType() != null && r.getDeviceType() != null)
                .collect(Collectors.groupingBy(
                        r -> new EventKey(r.getEventType(), r.getDeviceType()),
                        TreeMap::new, Collectors.toList()));

        List<SecurityEventSummary> rows = new ArrayList<>();
        groups.forEach((key, records) -> rows.add(SecurityEventSummary.builder()
                .eventType(key.eventType())
                .deviceType(key.deviceType())
                .count(records.size())
                .avgAnomalyScore(mean(records, TelemetryRecord::getAnomalyScore))
                .build()));

        rows.sort(Comparator.comparingLong(SecurityEventSummary::getCount).reversed());
        return rows;
    }

    public BatchSummary summarize(List<TelemetryRecord> batch) {
        BatchSummary summary = buildSummary(batch);
        metricsConfig.recordAggregationRun("summary");
        return summary;
    }

    private BatchSummary buildSummary(List<TelemetryRecord> batch) {
        int total = batch.size();
        long successes = batch.stream().filter(r -> Boolean.TRUE.equals(r.getSuccess())).count();
        long highAnomalies = batch.stream()
                .filter(r -> r.getAnomalyScore() != null && r.getAnomalyScore() > config.getSummaryAnomalyThreshold())
                .count();

        Map<String, Long> byDeviceType = batch.stream()
                .filter(r -> r.getDeviceType() != null)
                .collect(Collectors.groupingBy(TelemetryRecord::getDeviceType, TreeMap::new, Collectors.counting()));

        Map<String, BatchSummary.LatencyStats> latency = new TreeMap<>();
        batch.stream()
                .filter(r -> r.getDeviceType() != null && r.getLatencyMs() != null)
                .collect(Collectors.groupingBy(TelemetryRecord::getDeviceType,
                        Collectors.summarizingDouble(TelemetryRecord::getLatencyMs)))
                .forEach((type, stats) -> latency.put(type, BatchSummary.LatencyStats.builder()
                        .avg(round2(stats.getAverage()))
                        .max(round2(stats.getMax()))
                        .min(round2(stats.getMin()))
                        .build()));

        return BatchSummary.builder()
                .totalRecords(total)
                .successRate(total > 0 ? round2(successes * 100.0 / total) : 0.0)
                .recordsByDeviceType(byDeviceType)
                .latencyByDeviceType(latency)
                .highAnomalyCount(highAnomalies)
                .highAnomalyPercentage(total > 0 ? round2(highAnomalies * 100.0 / total) : 0.0)
                .provenance(provenance(batch))
                .build();
    }

    public ReportProvenance provenance(List<TelemetryRecord> batch) {
        return ReportProvenance.builder()
                .recordsAnalyzed(batch.size())
                .distinctDevices(batch.stream().map(TelemetryRecord::getDeviceId).filter(Objects::nonNull).distinct().count())
                .earliestTimestamp(batch.stream().map(TelemetryRecord::getTimestamp).filter(Objects::nonNull)
                        .min(Comparator.naturalOrder()).orElse(null))
                .latestTimestamp(batch.stream().map(TelemetryRecord::getTimestamp).filter(Objects::nonNull)
                        .max(Comparator.naturalOrder()).orElse(null))
                .generatedAt(Instant.now())
                .build();
    }

    /**
     * Security category, a failure or denial event type, or any error code.
     */
    static boolean isSecurityEvent(TelemetryRecord r) {
        if (SECURITY_CATEGORY.equals(r.getEventCategory())) {
            return true;
        }
        if (r.getEventType() != null) {
            String type = r.getEventType().toLowerCase(Locale.ROOT);
            if (type.contains("fail") || type.contains("deny")) {
                return true;
            }
        }
        return r.getErrorCode() != null && !r.getErrorCode().isBlank();
    }

    private boolean highLatency(TelemetryRecord r) {
        return r.getLatencyMs() != null && r.getLatencyMs() > config.getHighLatencyMs();
    }

    private boolean highCpu(TelemetryRecord r) {
        return r.getCpuUtilization() != null && r.getCpuUtilization() > config.getHighCpuPct();
    }

    private boolean highPacketLoss(TelemetryRecord r) {
        return r.getPacketLoss() != null && r.getPacketLoss() > config.getHighPacketLoss();
    }

    private boolean highRetransmissions(TelemetryRecord r) {
        return r.getTcpRetransmissions() != null && r.getTcpRetransmissions() > config.getHighRetransmissions();
    }

    private static Double mean(List<TelemetryRecord> records, Function<TelemetryRecord, Double> metric) {
        double sum = 0.0;
        int n = 0;
        for (TelemetryRecord r : records) {
            Double v = metric.apply(r);
            if (v != null) {
                sum += v;
                n++;
            }
        }
        return n == 0 ? null : sum / n;
    }

    private static Double max(List<TelemetryRecord> records, Function<TelemetryRecord, Double> metric) {
        return records.stream().map(metric).filter(Objects::nonNull).max(Double::compare).orElse(null);
    }

    private static double sum(List<TelemetryRecord> records, Function<TelemetryRecord, Double> metric) {
        return records.stream().map(metric).filter(Objects::nonNull).mapToDouble(Double::doubleValue).sum();
    }

    private static long sumLong(List<TelemetryRecord> records, Function<TelemetryRecord, Long> metric) {
        return records.stream().map(metric).filter(Objects::nonNull).mapToLong(Long::longValue).sum();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private record DeviceLocationKey(String deviceId, String deviceType, String location)
            implements Comparable<DeviceLocationKey> {
        @Override
        public int compareTo(DeviceLocationKey o) {
            return Comparator.comparing(DeviceLocationKey::deviceId)
                    .thenComparing(DeviceLocationKey::deviceType)
                    .thenComparing(DeviceLocationKey::location)
                    .compare(this, o);
        }
    }

    private record DeviceKey(String deviceId, String deviceType) implements Comparable<DeviceKey> {
        @Override
        public int compareTo(DeviceKey o) {
            return Comparator.comparing(DeviceKey::deviceId)
                    .thenComparing(DeviceKey::deviceType)
                    .compare(this, o);
        }
    }

    private record HourKey(int hour, String deviceType) implements Comparable<HourKey> {
        @Override
        public int compareTo(HourKey o) {
            return Comparator.comparingInt(HourKey::hour)
                    .thenComparing(HourKey::deviceType)
                    .compare(this, o);
        }
    }

    private record EventKey(String eventType, String deviceType) implements Comparable<EventKey> {
        @Override
        public int compareTo(EventKey o) {
            return Comparator.comparing(EventKey::eventType)
                    .thenComparing(EventKey::deviceType)
                    .compare(this, o);
        }
    }
}
