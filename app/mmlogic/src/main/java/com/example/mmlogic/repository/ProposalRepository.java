package com.example.mmlogic.repository;

public interface ProposalRepository {

  /** 役割: proposal id をキーに properties を保存する (SET)。 */
  void saveProperties(String proposalId, String properties);

  /** 役割: proposal id を proposal queue へ追加する (SADD)。 */
  void enqueue(String queueKey, String proposalId);
}
