package opshealth.report;

import com.google.common.collect.EnumMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.TreeMultiset;
import opshealth.utils.Timestamps;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 窗口内告警统计，无时间戳的告警不参与统计
 */
public class AlertRollup {
    private final Multiset<AlertType> byType = EnumMultiset.create(AlertType.class);
    private final Multiset<LocalDate> byDay = TreeMultiset.create();
    private final Multiset<String> byPipeline = TreeMultiset.create();

    /**
     * @param since 窗口起点，为null时不限
     */
    public static AlertRollup of(Collection<ParsedAlert> alerts, Instant since) {
        AlertRollup rollup = new AlertRollup();
        for (ParsedAlert alert : alerts) {
            Instant timestamp = alert.getTimestamp();
            if (timestamp == null || (since != null && timestamp.isBefore(since))) {
                continue;
            }
            rollup.byType.add(alert.getAlertType());
            rollup.byDay.add(Timestamps.utcDate(timestamp));
            rollup.byPipeline.add(alert.getPipeline());
        }
        return rollup;
    }

    /**
     * 数量降序，数量相同按类型名升序
     */
    public List<AlertTypeCount> topTypes(int topN) {
        return byType.entrySet().stream()
                .sorted(Comparator.comparing((Multiset.Entry<AlertType> entry) -> -entry.getCount())
                        .thenComparing(entry -> entry.getElement().id()))
                .limit(Math.max(0, topN))
                .map(entry -> new AlertTypeCount(entry.getElement(), entry.getCount()))
                .collect(Collectors.toList());
    }

    public List<DailyAlertCount> perDay() {
        return byDay.entrySet().stream()
                .map(entry -> new DailyAlertCount(entry.getElement().toString(), entry.getCount()))
                .collect(Collectors.toList());
    }

    public Map<String, Integer> perPipeline() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Multiset.Entry<String> entry : byPipeline.entrySet()) {
            counts.put(entry.getElement(), entry.getCount());
        }
        return counts;
    }

    public int total() {
        return byType.size();
    }
}
