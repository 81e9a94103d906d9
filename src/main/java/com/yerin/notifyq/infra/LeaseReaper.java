package com.yerin.notifyq.infra;

import com.yerin.notifyq.application.JobDispatcher;
import com.yerin.notifyq.domain.DelayedJobQueue;
import com.yerin.notifyq.domain.ScheduledJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 워커가 죽어 lease 가 만료된 작업을 due 집합으로 되돌린다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LeaseReaper {

    private final DelayedJobQueue queue;
    private final JobDispatcher dispatcher;

    @Scheduled(fixedDelayString = "${notifyq.worker.reap-millis:5000}")
    public void reap() {
        if (!queue.isAvailable()) return;

        List<ScheduledJob> exhausted;
        try {
            exhausted = queue.requeueExpiredLeases();
        } catch (DataAccessException e) {
            log.warn("[LeaseReaper] broker error: {}", e.getMessage());
            return;
        }
        for (ScheduledJob j : exhausted) {
            dispatcher.onExhausted(j, null);
        }
        if (!exhausted.isEmpty()) {
            log.info("[LeaseReaper] exhausted={} (lease expired on last attempt)", exhausted.size());
        }
    }
}
