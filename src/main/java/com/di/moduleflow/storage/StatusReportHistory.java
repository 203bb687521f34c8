package com.di.moduleflow.storage;

import com.di.moduleflow.model.PipelineTable;
import com.di.moduleflow.model.StatusReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads prior module runs back from the status log. Feeds {@code lastRunDetail}, which drives
 * incremental windows and the last-optimized lookup.
 */
@Slf4j
@RequiredArgsConstructor
public class StatusReportHistory {

    private final Database database;

    /**
     * Most recent non-failed report per module id for the organization, ordered by module id.
     * Failed runs are skipped so a failure never advances a module's window.
     */
    public List<StatusReport> lastRunDetail(String organizationId, PipelineTable statusTarget) {
        Map<Integer, StatusReport> latest = new LinkedHashMap<>();
        for (Map<String, Object> row : database.read(statusTarget).rows()) {
            StatusReport r = StatusReport.fromRow(row);
            if (!organizationId.equals(r.getOrganizationId()) || r.isFailed()) continue;
            latest.merge(r.getModuleId(), r,
                    (a, b) -> b.getPipelineSnapTs() >= a.getPipelineSnapTs() ? b : a);
        }
        List<StatusReport> out = new ArrayList<>(latest.values());
        out.sort(Comparator.comparingInt(StatusReport::getModuleId));
        log.info("[HISTORY] organizationId={} prior modules={}", organizationId, out.size());
        return out;
    }
}
