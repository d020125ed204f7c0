package com.example.mmlogic.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.mmlogic.model.IndexedValue;
import com.example.mmlogic.model.ProfileRecord;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.DefaultTypedTuple;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;

class RedisRepositoryTest {

  private StringRedisTemplate redisTemplate;
  private ZSetOperations<String, String> zSetOps;
  private HashOperations<String, Object, Object> hashOps;
  private ValueOperations<String, String> valueOps;
  private SetOperations<String, String> setOps;

  @SuppressWarnings("unchecked")
  @BeforeEach
  void setUp() {
    redisTemplate = Mockito.mock(StringRedisTemplate.class);
    zSetOps = Mockito.mock(ZSetOperations.class);
    hashOps = Mockito.mock(HashOperations.class);
    valueOps = Mockito.mock(ValueOperations.class);
    setOps = Mockito.mock(SetOperations.class);
    when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
    when(redisTemplate.opsForHash()).thenReturn(hashOps);
    when(redisTemplate.opsForValue()).thenReturn(valueOps);
    when(redisTemplate.opsForSet()).thenReturn(setOps);
  }

  @Test
  void countInRangeUsesZcountOnFieldKey() {
    when(zSetOps.count("mmr.rating", 1000.0, Double.POSITIVE_INFINITY)).thenReturn(42L);
    final RedisPlayerIndexRepository repository = new RedisPlayerIndexRepository(redisTemplate);

    assertThat(repository.countInRange("mmr.rating", 1000.0, Double.POSITIVE_INFINITY))
        .isEqualTo(42L);
  }

  @Test
  void countInRangeTreatsNullAsZero() {
    when(zSetOps.count(eq("mmr.rating"), anyDouble(), anyDouble())).thenReturn(null);
    final RedisPlayerIndexRepository repository = new RedisPlayerIndexRepository(redisTemplate);

    assertThat(repository.countInRange("mmr.rating", 0, 1)).isZero();
  }

  @Test
  void rangeWithValuesKeepsStoreOrderAndTruncatesScores() {
    final Set<ZSetOperations.TypedTuple<String>> tuples = new LinkedHashSet<>();
    tuples.add(new DefaultTypedTuple<>("C", 1200.0));
    tuples.add(new DefaultTypedTuple<>("A", 1500.0));
    when(zSetOps.rangeByScoreWithScores("mmr.rating", 1000.0, 2000.0, 10L, 2L)).thenReturn(tuples);
    final RedisPlayerIndexRepository repository = new RedisPlayerIndexRepository(redisTemplate);

    final List<IndexedValue> values = repository.rangeWithValues("mmr.rating", 1000, 2000, 10, 2);

    assertThat(values).containsExactly(new IndexedValue("C", 1200), new IndexedValue("A", 1500));
  }

  @Test
  void indexFailureBecomesStoreException() {
    when(zSetOps.count(anyString(), anyDouble(), anyDouble()))
        .thenThrow(new RedisConnectionFailureException("down"));
    final RedisPlayerIndexRepository repository = new RedisPlayerIndexRepository(redisTemplate);

    assertThatThrownBy(() -> repository.countInRange("mmr.rating", 0, 1))
        .isInstanceOfSatisfying(
            StoreException.class,
            ex -> {
              assertThat(ex.query()).isEqualTo("ZCOUNT");
              assertThat(ex.key()).isEqualTo("mmr.rating");
            });
  }

  @SuppressWarnings("unchecked")
  @Test
  void ignoreListAppendScoresByInsertionTime() {
    final RedisIgnoreListRepository repository = new RedisIgnoreListRepository(redisTemplate);
    final Instant addedAt = Instant.parse("2026-02-24T12:00:00Z");

    repository.append("proposed", List.of("A", "B"), addedAt);

    final ArgumentCaptor<Set<ZSetOperations.TypedTuple<String>>> captor =
        ArgumentCaptor.forClass(Set.class);
    verify(zSetOps).add(eq("proposed"), captor.capture());
    assertThat(captor.getValue())
        .extracting(ZSetOperations.TypedTuple::getValue)
        .containsExactly("A", "B");
    assertThat(captor.getValue())
        .allSatisfy(tuple -> assertThat(tuple.getScore()).isEqualTo(1_771_934_400.0));
  }

  @Test
  void ignoreListAppendSkipsEmptyInput() {
    final RedisIgnoreListRepository repository = new RedisIgnoreListRepository(redisTemplate);

    repository.append("proposed", List.of(), Instant.now());

    verify(redisTemplate, never()).opsForZSet();
  }

  @Test
  void ignoreListRetrieveReadsWindow() {
    final Instant from = Instant.parse("2026-02-24T11:55:00Z");
    final Instant until = Instant.parse("2026-02-24T12:00:00Z");
    // score は epoch 秒
    when(zSetOps.rangeByScore("proposed", 1_771_934_100.0, 1_771_934_400.0))
        .thenReturn(new LinkedHashSet<>(List.of("A", "B")));
    when(zSetOps.rangeByScore("proposed", Double.NEGATIVE_INFINITY, 1_771_934_400.0))
        .thenReturn(new LinkedHashSet<>(List.of("old", "A", "B")));
    final RedisIgnoreListRepository repository = new RedisIgnoreListRepository(redisTemplate);

    assertThat(repository.retrieve("proposed", from, until)).containsExactly("A", "B");
    assertThat(repository.retrieve("proposed", null, until)).containsExactly("old", "A", "B");
  }

  @Test
  void ignoreListFailureBecomesStoreException() {
    when(zSetOps.rangeByScore(anyString(), anyDouble(), anyDouble()))
        .thenThrow(new RedisConnectionFailureException("down"));
    final RedisIgnoreListRepository repository = new RedisIgnoreListRepository(redisTemplate);

    assertThatThrownBy(() -> repository.retrieve("proposed", null, Instant.now()))
        .isInstanceOfSatisfying(
            StoreException.class, ex -> assertThat(ex.query()).isEqualTo("ZRANGEBYSCORE"));
  }

  @Test
  void profileIsReadFromHash() {
    when(hashOps.entries("profile-1"))
        .thenReturn(
            Map.<Object, Object>of(
                "properties", "{\"a\":1}", "playerPools", "{\"playerPools\":[]}"));
    final RedisProfileRepository repository = new RedisProfileRepository(redisTemplate);

    final Optional<ProfileRecord> profile = repository.findById("profile-1");

    assertThat(profile)
        .contains(new ProfileRecord("profile-1", "{\"a\":1}", "{\"playerPools\":[]}"));
  }

  @Test
  void missingProfileHashIsEmpty() {
    when(hashOps.entries("missing")).thenReturn(Map.<Object, Object>of());
    final RedisProfileRepository repository = new RedisProfileRepository(redisTemplate);

    assertThat(repository.findById("missing")).isEmpty();
  }

  @Test
  void proposalIsSavedAndQueued() {
    final RedisProposalRepository repository = new RedisProposalRepository(redisTemplate);

    repository.saveProperties("proposal-1", "{\"x\":1}");
    repository.enqueue("proposalq", "proposal-1");

    verify(valueOps).set("proposal-1", "{\"x\":1}");
    verify(setOps).add("proposalq", "proposal-1");
  }

  @Test
  void proposalQueueFailureBecomesStoreException() {
    when(setOps.add(anyString(), anyString()))
        .thenThrow(new RedisConnectionFailureException("down"));
    final RedisProposalRepository repository = new RedisProposalRepository(redisTemplate);

    assertThatThrownBy(() -> repository.enqueue("proposalq", "proposal-1"))
        .isInstanceOfSatisfying(
            StoreException.class, ex -> assertThat(ex.key()).isEqualTo("proposalq"));
  }
}
