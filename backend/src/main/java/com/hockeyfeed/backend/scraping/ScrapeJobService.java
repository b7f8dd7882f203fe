package com.hockeyfeed.backend.scraping;

import com.hockeyfeed.backend.exception.ScrapeRunInProgressException;
import com.hockeyfeed.backend.model.dto.ScrapeRunSummary;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for scheduled and manual runs. At most one run executes at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScrapeJobService {

    private final ScrapeOrchestrator orchestrator;

    private final ReentrantLock runLock = new ReentrantLock();
    private final AtomicReference<ScrapeRunSummary> lastSummary = new AtomicReference<>();

    /**
     * Run the pipeline on the calling thread.
     *
     * @throws ScrapeRunInProgressException if another run has not finished yet
     */
    public ScrapeRunSummary runNow() {
        if (!runLock.tryLock()) {
            throw new ScrapeRunInProgressException();
        }
        try {
            ScrapeRunSummary summary = orchestrator.run();
            lastSummary.set(summary);
            return summary;
        } finally {
            runLock.unlock();
        }
    }

    public Optional<ScrapeRunSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary.get());
    }
}
