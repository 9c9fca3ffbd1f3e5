package com.gt.curator.analytics;

import com.gt.curator.analytics.model.WorkloadDay;
import com.gt.curator.model.Item;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;

@Component
public class WorkloadForecaster {

    private final ZoneId zoneId;

    @Autowired
    public WorkloadForecaster(ZoneId curatorZoneId) {
        this.zoneId = curatorZoneId;
    }

    public List<WorkloadDay> forecast(Collection<Item> allItems, int horizonDays, Instant now) {
        return forecast(allItems, horizonDays, now, false);
    }

    /**
     * Counts scheduled reviews per calendar day for today and the following {@code horizonDays - 1} days. Overdue
     * reviews are counted on today.
     *
     * @param includeEmptyDays whether days without reviews are reported with a count of zero
     */
    public List<WorkloadDay> forecast(Collection<Item> allItems, int horizonDays, Instant now, boolean includeEmptyDays) {
        if (horizonDays <= 0) {
            return List.of();
        }

        LocalDate today = LocalDate.ofInstant(now, zoneId);
        LocalDate horizonEnd = today.plusDays(horizonDays);

        Map<LocalDate, Integer> countsByDate = new TreeMap<>();
        if (includeEmptyDays) {
            for (LocalDate date = today; date.isBefore(horizonEnd); date = date.plusDays(1)) {
                countsByDate.put(date, 0);
            }
        }

        int total = 0;
        for (Item item : allItems) {
            if (item.nextReviewAt() == null) {
                continue;
            }

            LocalDate reviewDate = LocalDate.ofInstant(item.nextReviewAt(), zoneId);
            if (reviewDate.isBefore(today)) {
                reviewDate = today;
            }

            if (reviewDate.isBefore(horizonEnd)) {
                countsByDate.merge(reviewDate, 1, Integer::sum);
                total++;
            }
        }

        double averagePerDay = (double) total / horizonDays;

        List<WorkloadDay> workload = new ArrayList<>();
        int cumulative = 0;
        for (Map.Entry<LocalDate, Integer> dateCount : countsByDate.entrySet()) {
            cumulative += dateCount.getValue();
            workload.add(new WorkloadDay(dateCount.getKey(), dateCount.getValue(), cumulative, dateCount.getValue() > averagePerDay));
        }

        return workload;
    }
}
