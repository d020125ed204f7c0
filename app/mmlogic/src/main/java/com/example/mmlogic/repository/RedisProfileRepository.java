package com.example.mmlogic.repository;

import com.example.mmlogic.model.ProfileRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisProfileRepository implements ProfileRepository {

  private static final String FIELD_PROPERTIES = "properties";
  private static final String FIELD_PLAYER_POOLS = "playerPools";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisProfileRepository(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public Optional<ProfileRecord> findById(String profileId) {
    final Map<Object, Object> raw;
    try {
      raw = redisTemplate.opsForHash().entries(profileId);
    } catch (DataAccessException ex) {
      throw new StoreException("HGETALL", profileId, ex);
    }
    if (raw == null || raw.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        new ProfileRecord(
            profileId,
            stringValue(raw.get(FIELD_PROPERTIES)),
            stringValue(raw.get(FIELD_PLAYER_POOLS))));
  }

  private String stringValue(Object value) {
    return value == null ? null : String.valueOf(value);
  }
}
