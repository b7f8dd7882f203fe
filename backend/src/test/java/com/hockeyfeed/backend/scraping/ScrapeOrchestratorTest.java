package com.hockeyfeed.backend.scraping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.hockeyfeed.backend.article.ArticleService;
import com.hockeyfeed.backend.config.ScrapingConfig;
import com.hockeyfeed.backend.model.dto.ScrapeRunSummary;
import com.hockeyfeed.backend.model.entity.Article;
import com.hockeyfeed.backend.reconcile.ArticleField;
import com.hockeyfeed.backend.reconcile.ImageQualityClassifier;
import com.hockeyfeed.backend.reconcile.ReconciliationEngine;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessApiUsageException;

@ExtendWith(MockitoExtension.class)
class ScrapeOrchestratorTest {

    private static final String ALPHA = TestSite.article("12001-story-alpha");
    private static final String BRAVO = TestSite.article("12002-story-bravo");
    private static final String PRIVATE = TestSite.article("99999-private-story");
    private static final String BODY =
            "Hokejisti Popradu zvíťazili na ľade Nitry po výbornom výkone celého tímu, keď rozhodli "
            + "dvoma gólmi v tretej tretine a brankár pridal tridsať zákrokov.";

    @Mock
    private ArticleService articleService;

    private FakePageLoader loader;
    private ScrapeOrchestrator orchestrator;
    private final Map<String, Article> store = new HashMap<>();

    @BeforeEach
    void setUp() {
        ScrapingConfig config = new ScrapingConfig();
        config.setDelaySeconds(0);
        SiteConfigService site = TestSite.siteConfigService();
        FakeTime time = new FakeTime(Instant.parse("2025-02-12T18:00:00Z"));
        loader = new FakePageLoader();
        PoliteHttpClient client = new PoliteHttpClient(config, loader, time, time);

        orchestrator = new ScrapeOrchestrator(
                client,
                new RobotsGate(client, site, config),
                new ListingExtractor(site, config),
                new DetailExtractor(site, config),
                new ReconciliationEngine(config, new ImageQualityClassifier(config)),
                articleService,
                site,
                time);

        lenient().when(articleService.findByUrl(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(store.get(inv.<String>getArgument(0))));
        lenient().when(articleService.insert(any(Article.class))).thenAnswer(inv -> {
            Article article = inv.getArgument(0);
            article.setId((long) store.size() + 1);
            store.put(article.getOriginUrl(), article);
            return article;
        });
        lenient().when(articleService.update(any(Article.class), anyMap(), any(LocalDateTime.class))).thenAnswer(inv -> {
            Article article = inv.getArgument(0);
            Map<ArticleField, String> changes = inv.getArgument(1);
            changes.forEach((field, value) -> field.set(article, value));
            article.setScrapedAt(inv.getArgument(2));
            return article;
        });

        loader.ok(TestSite.ROBOTS, "User-agent: *\nDisallow: /sk/article/99999-\n");
    }

    @Test
    @DisplayName("A robots-disallowed detail page is neither fetched nor scanned")
    void disallowedDetailIsSkippedSilently() {
        loader.ok(TestSite.EXTRALIGA, listing(ALPHA, PRIVATE));
        loader.ok(TestSite.REPREZENTACIA, listing());
        loader.ok(ALPHA, detail("Alfa", BODY));

        ScrapeRunSummary summary = orchestrator.run();

        assertThat(loader.requestCount(PRIVATE)).isZero();
        assertThat(summary.getScanned()).isEqualTo(1);
        assertThat(summary.getInserted()).isEqualTo(1);
        assertThat(summary.getErrors()).isZero();
    }

    @Test
    void insertsNewArticlesWithCategory() {
        loader.ok(TestSite.EXTRALIGA, listing(ALPHA));
        loader.ok(TestSite.REPREZENTACIA, listing(BRAVO));
        loader.ok(ALPHA, detail("Alfa", BODY));
        loader.ok(BRAVO, detail("Bravo", BODY));

        ScrapeRunSummary summary = orchestrator.run();

        assertThat(summary.getInserted()).isEqualTo(2);
        assertThat(store.get(ALPHA).getCategory()).isEqualTo("extraliga");
        assertThat(store.get(BRAVO).getCategory()).isEqualTo("reprezentacia");
        assertThat(store.get(ALPHA).getScrapedAt()).isEqualTo(LocalDateTime.of(2025, 2, 12, 18, 0));
        assertThat(loader.requests()).containsSubsequence(TestSite.ROBOTS, TestSite.EXTRALIGA, ALPHA,
                TestSite.REPREZENTACIA, BRAVO);
    }

    @Test
    @DisplayName("A second run over unchanged pages only produces NoOps")
    void secondRunIsIdempotent() {
        loader.ok(TestSite.EXTRALIGA, listing(ALPHA, BRAVO));
        loader.ok(TestSite.REPREZENTACIA, listing());
        loader.ok(ALPHA, detail("Alfa", BODY));
        loader.ok(BRAVO, detail("Bravo", BODY));

        ScrapeRunSummary first = orchestrator.run();
        ScrapeRunSummary second = orchestrator.run();

        assertThat(first.getInserted()).isEqualTo(2);
        assertThat(second.getInserted()).isZero();
        assertThat(second.getUpdated()).isZero();
        assertThat(second.getUnchanged()).isEqualTo(2);
        assertThat(second.getScanned()).isEqualTo(2);
        verify(articleService, never()).update(any(Article.class), anyMap(), any(LocalDateTime.class));
    }

    @Test
    void longerBodyUpdatesStoredArticle() {
        loader.ok(TestSite.EXTRALIGA, listing(ALPHA));
        loader.ok(TestSite.REPREZENTACIA, listing());
        loader.ok(ALPHA, detail("Alfa", BODY)).ok(ALPHA, detail("Alfa", BODY + " " + BODY));

        orchestrator.run();
        ScrapeRunSummary second = orchestrator.run();

        assertThat(second.getUpdated()).isEqualTo(1);
        assertThat(store.get(ALPHA).getContentText()).isEqualTo(BODY + " " + BODY);
    }

    @Test
    @DisplayName("A unique-key conflict on insert counts as unchanged")
    void insertConflictIsUnchanged() {
        loader.ok(TestSite.EXTRALIGA, listing(ALPHA));
        loader.ok(TestSite.REPREZENTACIA, listing());
        loader.ok(ALPHA, detail("Alfa", BODY));
        doThrow(new DataIntegrityViolationException("uq_articles_origin_url"))
                .when(articleService).insert(any(Article.class));

        ScrapeRunSummary summary = orchestrator.run();

        assertThat(summary.getUnchanged()).isEqualTo(1);
        assertThat(summary.getInserted()).isZero();
        assertThat(summary.getErrors()).isZero();
    }

    @Test
    void otherPersistenceErrorsAreCountedAndRunContinues() {
        loader.ok(TestSite.EXTRALIGA, listing(ALPHA, BRAVO));
        loader.ok(TestSite.REPREZENTACIA, listing());
        loader.ok(ALPHA, detail("Alfa", BODY));
        loader.ok(BRAVO, detail("Bravo", BODY));
        doThrow(new InvalidDataAccessApiUsageException("boom")).when(articleService).findByUrl(eq(ALPHA));

        ScrapeRunSummary summary = orchestrator.run();

        assertThat(summary.getErrors()).isEqualTo(1);
        assertThat(summary.getInserted()).isEqualTo(1);
    }

    @Test
    @DisplayName("An unexpected failure on one article is counted and the run moves on")
    void unexpectedFailureOnOneArticleIsCounted() {
        loader.ok(TestSite.EXTRALIGA, listing(ALPHA, BRAVO));
        loader.ok(TestSite.REPREZENTACIA, listing());
        loader.ok(ALPHA, detail("Alfa", BODY));
        loader.ok(BRAVO, detail("Bravo", BODY));
        doThrow(new IllegalStateException("unexpected")).when(articleService).findByUrl(eq(ALPHA));

        ScrapeRunSummary summary = orchestrator.run();

        assertThat(summary.getErrors()).isEqualTo(1);
        assertThat(summary.getInserted()).isEqualTo(1);
        assertThat(store).containsOnlyKeys(BRAVO);
    }

    @Test
    void unreachableDatabaseAbortsTheRun() {
        loader.ok(TestSite.EXTRALIGA, listing(ALPHA));
        loader.ok(TestSite.REPREZENTACIA, listing());
        loader.ok(ALPHA, detail("Alfa", BODY));
        doThrow(new DataAccessResourceFailureException("down")).when(articleService).findByUrl(anyString());

        assertThatThrownBy(() -> orchestrator.run()).isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void failingListingSkipsOnlyThatCategory() {
        loader.status(TestSite.EXTRALIGA, 500);
        loader.ok(TestSite.REPREZENTACIA, listing(BRAVO));
        loader.ok(BRAVO, detail("Bravo", BODY));

        ScrapeRunSummary summary = orchestrator.run();

        assertThat(loader.requestCount(TestSite.EXTRALIGA)).isEqualTo(3);
        assertThat(summary.getErrors()).isEqualTo(1);
        assertThat(summary.getInserted()).isEqualTo(1);
    }

    @Test
    void disallowedListingIsAnError() {
        FakePageLoader pages = new FakePageLoader()
                .ok(TestSite.ROBOTS, "User-agent: *\nDisallow: /sk/articles/extraliga\n")
                .ok(TestSite.REPREZENTACIA, listing(BRAVO))
                .ok(BRAVO, detail("Bravo", BODY));

        ScrapeRunSummary summary = orchestratorWith(pages).run();

        assertThat(pages.requestCount(TestSite.EXTRALIGA)).isZero();
        assertThat(summary.getErrors()).isEqualTo(1);
        assertThat(summary.getInserted()).isEqualTo(1);
    }

    @Test
    void robotsFailureEndsRunEarly() {
        FakePageLoader failing = new FakePageLoader().status(TestSite.ROBOTS, 503);
        ScrapeOrchestrator withFailingRobots = orchestratorWith(failing);

        ScrapeRunSummary summary = withFailingRobots.run();

        assertThat(summary.getErrors()).isEqualTo(1);
        assertThat(summary.getScanned()).isZero();
        assertThat(failing.requests()).containsOnly(TestSite.ROBOTS);
    }

    @Test
    void missingRobotsAllowsEverything() {
        FakePageLoader noRobots = new FakePageLoader()
                .ok(TestSite.EXTRALIGA, listing(PRIVATE))
                .ok(TestSite.REPREZENTACIA, listing())
                .ok(PRIVATE, detail("Súkromné", BODY));

        ScrapeRunSummary summary = orchestratorWith(noRobots).run();

        assertThat(summary.getInserted()).isEqualTo(1);
    }

    @Test
    void shortPagesAreSkippedAndBrokenPagesAreErrors() {
        String gamma = TestSite.article("12003-story-gamma");
        String delta = TestSite.article("12004-story-delta");
        loader.ok(TestSite.EXTRALIGA, listing(ALPHA, BRAVO, gamma, delta));
        loader.ok(TestSite.REPREZENTACIA, listing());
        loader.ok(ALPHA, detail("Kontakt", "Volajte nám."));
        loader.ok(BRAVO, "<html><body><div class=\"col-content\"><p>" + BODY + "</p></div></body></html>");
        loader.status(gamma, 500);
        loader.ok(delta, detail("Delta", BODY));

        ScrapeRunSummary summary = orchestrator.run();

        assertThat(summary.getScanned()).isEqualTo(4);
        assertThat(summary.getSkipped()).isEqualTo(1);
        assertThat(summary.getErrors()).isEqualTo(2);
        assertThat(summary.getInserted()).isEqualTo(1);
    }

    @Test
    void listingThumbnailIsUsedWhenDetailHasNoImage() {
        loader.ok(TestSite.EXTRALIGA, "<html><body><div class=\"news-item\" style=\"background-image:url(/upload/t.jpg)\">"
                + "<a href=\"/sk/article/12001-story-alpha\">Alfa</a></div></body></html>");
        loader.ok(TestSite.REPREZENTACIA, listing());
        loader.ok(ALPHA, detail("Alfa", BODY));

        orchestrator.run();

        assertThat(store.get(ALPHA).getImageUrl()).isEqualTo(TestSite.BASE + "/upload/t.jpg");
    }

    private ScrapeOrchestrator orchestratorWith(FakePageLoader pageLoader) {
        ScrapingConfig config = new ScrapingConfig();
        config.setDelaySeconds(0);
        SiteConfigService site = TestSite.siteConfigService();
        FakeTime time = new FakeTime(Instant.parse("2025-02-12T18:00:00Z"));
        PoliteHttpClient client = new PoliteHttpClient(config, pageLoader, time, time);
        return new ScrapeOrchestrator(client, new RobotsGate(client, site, config), new ListingExtractor(site, config),
                new DetailExtractor(site, config), new ReconciliationEngine(config, new ImageQualityClassifier(config)),
                articleService, site, time);
    }

    private static String listing(String... urls) {
        StringBuilder html = new StringBuilder("<html><body><div class=\"articles\">");
        for (String url : urls) {
            html.append("<a href=\"").append(url.substring(TestSite.BASE.length())).append("\">clanok</a>");
        }
        return html.append("</div></body></html>").toString();
    }

    private static String detail(String title, String body) {
        return "<html><body><h1>" + title + "</h1>"
                + "<div class=\"article-meta clearfix\">12.02.2025</div>"
                + "<div class=\"col-md-8 col-lg-9 col-content\"><p>" + body + "</p></div>"
                + "</body></html>";
    }
}
