package com.example.mmlogic.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.mmlogic.model.Filter;
import com.example.mmlogic.model.FilterResult;
import com.example.mmlogic.model.IndexedValue;
import com.example.mmlogic.repository.PlayerIndexRepository;
import com.example.mmlogic.repository.StoreException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class RangeFilterApplierTest {

  private InMemoryPlayerIndexRepository index;
  private RecordingPoolQueryObserver observer;
  private PoolQueryContext context;

  @BeforeEach
  void setUp() {
    index =
        new InMemoryPlayerIndexRepository()
            .put("rating", "A", 1500)
            .put("rating", "B", 1800)
            .put("rating", "C", 1200)
            .put("rating", "D", 900);
    observer = new RecordingPoolQueryObserver();
    context = PoolQueryContext.withTimeout("pool-1", Duration.ofSeconds(10));
  }

  @Test
  void returnsPlayersInsideInclusiveRangeWithTheirValues() {
    final RangeFilterApplier applier = applier(TestProperties.defaults());
    final Filter filter = new Filter("f1", "rating", "rating", 1200, 1800L);

    final FilterResult result = applier.apply(filter, context);

    assertThat(result.playerIds()).containsExactly("C", "A", "B");
    assertThat(result.valueOf("B")).isEqualTo(1800L);
    assertThat(result.highCardinality()).isFalse();
    assertThat(filter.stats().count()).isEqualTo(3);
    assertThat(filter.stats().elapsedSeconds()).isGreaterThanOrEqualTo(0.0);
    assertThat(observer.events()).containsExactly(PoolQueryEvents.FILTER_PROCESSED);
  }

  @Test
  void zeroOrMissingMaxvMeansNoUpperBound() {
    final RangeFilterApplier applier = applier(TestProperties.defaults());

    final FilterResult zeroMax = applier.apply(new Filter("f1", null, "rating", 1000, 0L), context);
    final FilterResult nullMax =
        applier.apply(new Filter("f2", null, "rating", 1000, null), context);

    assertThat(zeroMax.playerIds()).containsExactlyInAnyOrder("A", "B", "C");
    assertThat(nullMax.playerIds()).containsExactlyInAnyOrder("A", "B", "C");
  }

  @Test
  void fetchesInChunksUntilShortPage() {
    final RangeFilterApplier applier = applier(TestProperties.defaults().fetchPageSize(2));

    final FilterResult result = applier.apply(new Filter("f1", null, "rating", 0, null), context);

    assertThat(result.size()).isEqualTo(4);
    // 2 + 2 件の後、offset 4 の空ページで終了する
    assertThat(index.rangeCalls("rating")).isEqualTo(3);
    assertThat(index.countCalls("rating")).isEqualTo(1);
  }

  @Test
  void duplicateAcrossChunksDoesNotSkipPlayers() {
    final PlayerIndexRepository repository = Mockito.mock(PlayerIndexRepository.class);
    when(repository.countInRange(eq("rating"), anyDouble(), anyDouble())).thenReturn(4L);
    when(repository.rangeWithValues(eq("rating"), anyDouble(), anyDouble(), eq(0L), eq(2L)))
        .thenReturn(List.of(new IndexedValue("A", 1), new IndexedValue("B", 2)));
    when(repository.rangeWithValues(eq("rating"), anyDouble(), anyDouble(), eq(2L), eq(2L)))
        .thenReturn(List.of(new IndexedValue("B", 3), new IndexedValue("C", 4)));
    when(repository.rangeWithValues(eq("rating"), anyDouble(), anyDouble(), eq(3L), eq(2L)))
        .thenReturn(List.of(new IndexedValue("C", 4), new IndexedValue("D", 5)));
    when(repository.rangeWithValues(eq("rating"), anyDouble(), anyDouble(), eq(4L), eq(2L)))
        .thenReturn(List.of());
    final RangeFilterApplier applier =
        new RangeFilterApplier(
            repository, TestProperties.defaults().fetchPageSize(2).build(), observer);

    final FilterResult result = applier.apply(new Filter("f1", null, "rating", 0, null), context);

    assertThat(result.playerIds()).containsExactly("A", "B", "C", "D");
    assertThat(result.valueOf("B")).isEqualTo(3L);
    verify(repository).rangeWithValues(eq("rating"), anyDouble(), anyDouble(), eq(3L), eq(2L));
  }

  @Test
  void fullChunkOfDuplicatesAdvancesByPageWidth() {
    final PlayerIndexRepository repository = Mockito.mock(PlayerIndexRepository.class);
    when(repository.countInRange(eq("rating"), anyDouble(), anyDouble())).thenReturn(3L);
    when(repository.rangeWithValues(eq("rating"), anyDouble(), anyDouble(), eq(0L), eq(2L)))
        .thenReturn(List.of(new IndexedValue("A", 1), new IndexedValue("B", 2)));
    when(repository.rangeWithValues(eq("rating"), anyDouble(), anyDouble(), eq(2L), eq(2L)))
        .thenReturn(List.of(new IndexedValue("A", 1), new IndexedValue("B", 2)));
    when(repository.rangeWithValues(eq("rating"), anyDouble(), anyDouble(), eq(4L), eq(2L)))
        .thenReturn(List.of(new IndexedValue("C", 3)));
    final RangeFilterApplier applier =
        new RangeFilterApplier(
            repository, TestProperties.defaults().fetchPageSize(2).build(), observer);

    final FilterResult result = applier.apply(new Filter("f1", null, "rating", 0, null), context);

    assertThat(result.playerIds()).containsExactly("A", "B", "C");
    verify(repository).rangeWithValues(eq("rating"), anyDouble(), anyDouble(), eq(4L), eq(2L));
  }

  @Test
  void playersInsertedAheadBetweenChunksDoNotHideRemainingPlayers() {
    final InMemoryPlayerIndexRepository churning = new InMemoryPlayerIndexRepository();
    for (int i = 1; i <= 5; i++) {
      churning.put("rating", "P" + i, i * 10L);
    }
    // 1 ページ目を返した直後に、既存より低い score の player が 1 ページ分入る
    churning.afterRangeCall(1, () -> churning.put("rating", "X1", 1).put("rating", "X2", 2));
    final RangeFilterApplier applier =
        new RangeFilterApplier(
            churning, TestProperties.defaults().fetchPageSize(2).build(), observer);

    final FilterResult result = applier.apply(new Filter("f1", null, "rating", 0, null), context);

    assertThat(result.playerIds()).contains("P1", "P2", "P3", "P4", "P5");
  }

  @Test
  void emptyProbeSignalsEmptyFilterWithoutFetching() {
    final RangeFilterApplier applier = applier(TestProperties.defaults());
    final Filter filter = new Filter("f-empty", null, "rating", 5000, 6000L);

    assertThatThrownBy(() -> applier.apply(filter, context))
        .isInstanceOf(FilterEmptyException.class)
        .hasMessageContaining("f-empty");

    assertThat(index.rangeCalls("rating")).isZero();
    assertThat(filter.stats().count()).isZero();
    assertThat(observer.events())
        .containsExactly(PoolQueryEvents.FILTER_EMPTY, PoolQueryEvents.FILTER_PROCESSED);
  }

  @Test
  void unknownFieldIsEmpty() {
    final RangeFilterApplier applier = applier(TestProperties.defaults());

    assertThatThrownBy(() -> applier.apply(new Filter("f1", null, "unknown", 0, null), context))
        .isInstanceOf(FilterEmptyException.class);
  }

  @Test
  void countAboveHardLimitAbortsWithoutFetching() {
    final RangeFilterApplier applier = applier(TestProperties.defaults().limits(2, 3));
    final Filter filter = new Filter("f-large", null, "rating", 0, null);

    assertThatThrownBy(() -> applier.apply(filter, context))
        .isInstanceOfSatisfying(
            FilterTooLargeException.class,
            ex -> {
              assertThat(ex.count()).isEqualTo(4);
              assertThat(ex.limit()).isEqualTo(3);
              assertThat(ex.filter()).isSameAs(filter);
            });

    assertThat(index.rangeCalls("rating")).isZero();
    assertThat(filter.stats().count()).isZero();
    assertThat(observer.events()).contains(PoolQueryEvents.FILTER_TOO_LARGE);
  }

  @Test
  void countAtSoftLimitIsReturnedAsHighCardinality() {
    final RangeFilterApplier applier = applier(TestProperties.defaults().limits(4, 5));

    final FilterResult result = applier.apply(new Filter("f1", null, "rating", 0, null), context);

    assertThat(result.size()).isEqualTo(4);
    assertThat(result.highCardinality()).isTrue();
    assertThat(observer.events()).contains(PoolQueryEvents.FILTER_HIGH_CARDINALITY);
  }

  @Test
  void countEqualToHardLimitIsAccepted() {
    final RangeFilterApplier applier = applier(TestProperties.defaults().limits(1, 4));

    assertThat(applier.apply(new Filter("f1", null, "rating", 0, null), context).size())
        .isEqualTo(4);
  }

  @Test
  void storeErrorPropagatesAndIsRecorded() {
    final PlayerIndexRepository repository = Mockito.mock(PlayerIndexRepository.class);
    when(repository.countInRange(anyString(), anyDouble(), anyDouble()))
        .thenThrow(new StoreException("ZCOUNT", "rating", new IllegalStateException("down")));
    final RangeFilterApplier applier =
        new RangeFilterApplier(repository, TestProperties.defaults().build(), observer);
    final Filter filter = new Filter("f1", null, "rating", 0, null);

    assertThatThrownBy(() -> applier.apply(filter, context))
        .isInstanceOfSatisfying(
            StoreException.class, ex -> assertThat(ex.query()).isEqualTo("ZCOUNT"));

    assertThat(observer.errors()).containsExactly(PoolQueryEvents.FILTER_STORE_ERROR);
    assertThat(filter.stats()).isNotNull();
    verify(repository, never())
        .rangeWithValues(anyString(), anyDouble(), anyDouble(), anyLong(), anyLong());
  }

  @Test
  void cancelledQueryDoesNotTouchStore() {
    final RangeFilterApplier applier = applier(TestProperties.defaults());
    context.cancel("client gone");

    assertThatThrownBy(() -> applier.apply(new Filter("f1", null, "rating", 0, null), context))
        .isInstanceOf(PoolQueryCancelledException.class)
        .hasMessageContaining("client gone");

    assertThat(index.totalCalls("rating")).isZero();
  }

  private RangeFilterApplier applier(TestProperties properties) {
    return new RangeFilterApplier(index, properties.build(), observer);
  }
}
