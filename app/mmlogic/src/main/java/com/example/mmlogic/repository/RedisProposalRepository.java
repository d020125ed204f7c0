package com.example.mmlogic.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisProposalRepository implements ProposalRepository {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisProposalRepository(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public void saveProperties(String proposalId, String properties) {
    try {
      redisTemplate.opsForValue().set(proposalId, properties == null ? "" : properties);
    } catch (DataAccessException ex) {
      throw new StoreException("SET", proposalId, ex);
    }
  }

  @Override
  public void enqueue(String queueKey, String proposalId) {
    try {
      redisTemplate.opsForSet().add(queueKey, proposalId);
    } catch (DataAccessException ex) {
      throw new StoreException("SADD", queueKey, ex);
    }
  }
}
