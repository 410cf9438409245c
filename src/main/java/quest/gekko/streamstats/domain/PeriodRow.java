package quest.gekko.streamstats.domain;

public record PeriodRow(String periodLabel, Integer averageViewers, Integer streamDays) {

    public static PeriodRow of(HistoryRecord record) {
        return new PeriodRow(record.periodLabel(), record.averageViewers(), record.activeDays());
    }
}
