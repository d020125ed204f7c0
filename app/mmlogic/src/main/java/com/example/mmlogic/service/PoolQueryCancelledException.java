package com.example.mmlogic.service;

public class PoolQueryCancelledException extends RuntimeException {

  public PoolQueryCancelledException(String poolId, String reason) {
    super("player pool query cancelled: pool=" + poolId + " reason=" + reason);
  }
}
