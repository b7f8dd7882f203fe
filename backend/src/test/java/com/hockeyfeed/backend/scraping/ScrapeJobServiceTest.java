package com.hockeyfeed.backend.scraping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.hockeyfeed.backend.exception.ScrapeRunInProgressException;
import com.hockeyfeed.backend.model.dto.ScrapeRunSummary;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScrapeJobServiceTest {

    @Mock
    private ScrapeOrchestrator orchestrator;

    @InjectMocks
    private ScrapeJobService scrapeJobService;

    @Test
    void remembersLastSummary() {
        ScrapeRunSummary summary = ScrapeRunSummary.builder().inserted(4).build();
        when(orchestrator.run()).thenReturn(summary);

        assertThat(scrapeJobService.getLastSummary()).isEmpty();
        assertThat(scrapeJobService.runNow()).isSameAs(summary);
        assertThat(scrapeJobService.getLastSummary()).containsSame(summary);
    }

    @Test
    void secondRunIsRejectedWhileFirstIsInProgress() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(orchestrator.run()).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new ScrapeRunSummary();
        });

        CompletableFuture<ScrapeRunSummary> first = CompletableFuture.supplyAsync(scrapeJobService::runNow);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> scrapeJobService.runNow()).isInstanceOf(ScrapeRunInProgressException.class);

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isNotNull();
        verify(orchestrator, times(1)).run();
    }

    @Test
    void lockIsReleasedWhenRunFails() {
        when(orchestrator.run()).thenThrow(new IllegalStateException("db down")).thenReturn(new ScrapeRunSummary());

        assertThatThrownBy(() -> scrapeJobService.runNow()).isInstanceOf(IllegalStateException.class);
        assertThat(scrapeJobService.runNow()).isNotNull();
    }
}
