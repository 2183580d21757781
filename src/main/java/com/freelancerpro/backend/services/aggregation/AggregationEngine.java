package com.freelancerpro.backend.services.aggregation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

import com.freelancerpro.backend.dto.project.ProjectRefDTO;
import com.freelancerpro.backend.dto.stats.EntryStatsDTO;
import com.freelancerpro.backend.dto.stats.EntrySummaryDTO;
import com.freelancerpro.backend.dto.stats.MonthlyTrendPointDTO;
import com.freelancerpro.backend.dto.stats.ProjectBreakdownDTO;

/**
 * Rollups over an already scoped set of entries. Every method is pure: callers
 * load the records with the same query they use for listing and hand the facts in.
 */
public final class AggregationEngine {

    public static final String UNKNOWN_PROJECT = "Unknown Project";
    public static final String UNKNOWN_CLIENT = "Unknown Client";

    static final int MONEY_SCALE = 2;

    private AggregationEngine() {
    }

    public static EntrySummaryDTO summary(Collection<EntryFact> facts) {
        BigDecimal total = sum(facts);
        long count = facts.size();
        BigDecimal average = count == 0
                ? BigDecimal.ZERO.setScale(MONEY_SCALE)
                : total.divide(BigDecimal.valueOf(count), MONEY_SCALE, RoundingMode.HALF_UP);
        return EntrySummaryDTO.builder()
                .total(total)
                .count(count)
                .average(average)
                .build();
    }

    /**
     * Sum per category, in order of first appearance. Categories with no entries
     * are absent.
     */
    public static Map<String, BigDecimal> byCategory(Collection<EntryFact> facts) {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        for (EntryFact fact : facts) {
            totals.merge(fact.category(), fact.amount(), BigDecimal::add);
        }
        totals.replaceAll((category, amount) -> money(amount));
        return totals;
    }

    public static List<MonthlyTrendPointDTO> monthlyTrend(Collection<EntryFact> facts) {
        Map<YearMonth, BigDecimal> amounts = new TreeMap<>();
        Map<YearMonth, Long> counts = new TreeMap<>();
        for (EntryFact fact : facts) {
            YearMonth month = YearMonth.from(fact.date());
            amounts.merge(month, fact.amount(), BigDecimal::add);
            counts.merge(month, 1L, Long::sum);
        }

        List<MonthlyTrendPointDTO> trend = new ArrayList<>(amounts.size());
        amounts.forEach((month, amount) -> trend.add(MonthlyTrendPointDTO.builder()
                .month(month.toString())
                .amount(money(amount))
                .count(counts.get(month))
                .build()));
        return trend;
    }

    public static EntryStatsDTO stats(Collection<EntryFact> facts) {
        EntrySummaryDTO summary = summary(facts);
        return EntryStatsDTO.builder()
                .total(summary.getTotal())
                .count(summary.getCount())
                .average(summary.getAverage())
                .byCategory(byCategory(facts))
                .monthlyTrend(monthlyTrend(facts))
                .build();
    }

    /**
     * One row per project id present in {@code facts}, highest total first.
     *
     * @param projects name and client for the projects the caller still owns; ids
     *                 missing from the map are reported as unknown
     */
    public static List<ProjectBreakdownDTO> byProject(Collection<EntryFact> facts, Map<UUID, ProjectRefDTO> projects) {
        Map<UUID, BigDecimal> totals = new LinkedHashMap<>();
        Map<UUID, Long> counts = new LinkedHashMap<>();
        for (EntryFact fact : facts) {
            totals.merge(fact.projectId(), fact.amount(), BigDecimal::add);
            counts.merge(fact.projectId(), 1L, Long::sum);
        }

        List<ProjectBreakdownDTO> rows = new ArrayList<>(totals.size());
        totals.forEach((projectId, total) -> {
            ProjectRefDTO ref = projects.get(projectId);
            rows.add(ProjectBreakdownDTO.builder()
                    .projectId(projectId.toString())
                    .projectName(ref != null ? ref.getName() : UNKNOWN_PROJECT)
                    .clientName(ref != null ? ref.getClientName() : UNKNOWN_CLIENT)
                    .totalAmount(money(total))
                    .entryCount(counts.get(projectId))
                    .build());
        });
        rows.sort(Comparator.comparing(ProjectBreakdownDTO::getTotalAmount).reversed());
        return rows;
    }

    static BigDecimal sum(Collection<EntryFact> facts) {
        BigDecimal total = BigDecimal.ZERO;
        for (EntryFact fact : facts) {
            total = total.add(fact.amount());
        }
        return money(total);
    }

    static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
