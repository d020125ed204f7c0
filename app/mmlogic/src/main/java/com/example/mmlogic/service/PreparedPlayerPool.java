package com.example.mmlogic.service;

import com.example.mmlogic.model.PoolCandidates;

/** 評価済みで送信待ちの player pool。context は送信完了まで有効。 */
public record PreparedPlayerPool(PoolCandidates candidates, PoolQueryContext context) {}
