package com.example.mmlogic.repository;

import com.example.mmlogic.model.IndexedValue;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Repository;

@Repository
public class RedisPlayerIndexRepository implements PlayerIndexRepository {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisPlayerIndexRepository(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public long countInRange(String field, double min, double max) {
    try {
      final Long count = redisTemplate.opsForZSet().count(field, min, max);
      return count == null ? 0 : count;
    } catch (DataAccessException ex) {
      throw new StoreException("ZCOUNT", field, ex);
    }
  }

  @Override
  public List<IndexedValue> rangeWithValues(
      String field, double min, double max, long offset, long count) {
    final Set<ZSetOperations.TypedTuple<String>> tuples;
    try {
      tuples = redisTemplate.opsForZSet().rangeByScoreWithScores(field, min, max, offset, count);
    } catch (DataAccessException ex) {
      throw new StoreException("ZRANGEBYSCORE", field, ex);
    }
    if (tuples == null || tuples.isEmpty()) {
      return List.of();
    }
    final List<IndexedValue> values = new ArrayList<>(tuples.size());
    for (ZSetOperations.TypedTuple<String> tuple : tuples) {
      if (tuple.getValue() == null || tuple.getScore() == null) {
        continue;
      }
      values.add(new IndexedValue(tuple.getValue(), tuple.getScore().longValue()));
    }
    return values;
  }
}
