package com.example.mmlogic.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.DefaultTypedTuple;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Repository;

/** ignore list は追加時刻 (epoch 秒) を score とする sorted set。 */
@Repository
public class RedisIgnoreListRepository implements IgnoreListRepository {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisIgnoreListRepository(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public void append(String listKey, Collection<String> playerIds, Instant addedAt) {
    if (playerIds == null || playerIds.isEmpty()) {
      return;
    }
    final double score = addedAt.getEpochSecond();
    final Set<ZSetOperations.TypedTuple<String>> tuples = new LinkedHashSet<>();
    for (String playerId : playerIds) {
      tuples.add(new DefaultTypedTuple<>(playerId, score));
    }
    try {
      redisTemplate.opsForZSet().add(listKey, tuples);
    } catch (DataAccessException ex) {
      throw new StoreException("ZADD", listKey, ex);
    }
  }

  @Override
  public List<String> retrieve(String listKey, Instant from, Instant until) {
    final double min = from == null ? Double.NEGATIVE_INFINITY : from.getEpochSecond();
    final Set<String> members;
    try {
      members = redisTemplate.opsForZSet().rangeByScore(listKey, min, until.getEpochSecond());
    } catch (DataAccessException ex) {
      throw new StoreException("ZRANGEBYSCORE", listKey, ex);
    }
    return members == null ? List.of() : List.copyOf(members);
  }
}
