package net.shelfwatch.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import net.shelfwatch.domain.scan.CheckVerdict;
import net.shelfwatch.domain.scan.NetworkFailure;
import net.shelfwatch.domain.scan.PageAnalysisSummary;
import net.shelfwatch.domain.scan.RawFinding;
import net.shelfwatch.domain.scan.ScanDepth;
import net.shelfwatch.domain.scan.ScanEngineResult;
import net.shelfwatch.domain.scan.ScanRun;
import net.shelfwatch.domain.scan.ScanRunStatus;
import net.shelfwatch.domain.scan.ScanSignals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScanRunRepositoryTest extends PostgresRepositoryTestSupport {

    private static final Instant STARTED = Instant.parse("2026-03-04T10:00:00Z");

    private ScanRunRepository repository;
    private UUID pageId;

    @BeforeEach
    void setUp() {
        repository = new ScanRunRepository(jdbcTemplate, json);
        pageId = insertPage(insertTenant("demo-store.myshopify.com"), null, null);
    }

    @Test
    void should_PersistSignalsAndFindings_When_RunCompletes() {
        ScanRun run = repository.create(pageId, ScanDepth.DEEP);
        run = repository.save(run.running(STARTED));
        ScanSignals signals = new ScanSignals(6400, List.of("TypeError: cart is undefined"),
            List.of(new NetworkFailure("https://cdn.test/hero.jpg", "image", 404, null)),
            List.of("[warn] slow"), "<html>price</html>", "screens/run.png");
        RawFinding finding = new RawFinding("add_to_cart", CheckVerdict.FAIL, 0.92, "Button missing",
            Map.of("evidence", Map.of("selector", "form[action='/cart/add']")));
        repository.save(run.completed(ScanEngineResult.success(signals, List.of(finding)), STARTED.plusSeconds(7))
            .withAiSummary(new PageAnalysisSummary("Purchase button hidden", false, 1)));

        ScanRun stored = repository.findById(run.id()).orElseThrow();

        assertThat(stored.status()).isEqualTo(ScanRunStatus.COMPLETED);
        assertThat(stored.depth()).isEqualTo(ScanDepth.DEEP);
        assertThat(stored.durationMs()).isEqualTo(7000L);
        assertThat(stored.signals().loadTimeMs()).isEqualTo(6400);
        assertThat(stored.signals().networkErrors()).extracting(NetworkFailure::status).containsExactly(404);
        assertThat(stored.findings()).singleElement().satisfies(persisted -> {
            assertThat(persisted.verdict()).isEqualTo(CheckVerdict.FAIL);
            assertThat(persisted.confidence()).isEqualTo(0.92);
        });
        assertThat(stored.aiSummary().summary()).isEqualTo("Purchase button hidden");
    }

    @Test
    void should_CountRunsPerPage() {
        assertThat(repository.existsForPage(pageId)).isFalse();

        repository.create(pageId, ScanDepth.QUICK);
        repository.create(pageId, ScanDepth.QUICK);

        assertThat(repository.existsForPage(pageId)).isTrue();
        assertThat(repository.countForPage(pageId)).isEqualTo(2);
    }

    @Test
    void should_Fail_When_SavingUnknownRun() {
        ScanRun ghost = ScanRun.pending(UUID.randomUUID(), pageId, ScanDepth.QUICK);

        assertThatThrownBy(() -> repository.save(ghost)).isInstanceOf(IllegalStateException.class);
    }
}
