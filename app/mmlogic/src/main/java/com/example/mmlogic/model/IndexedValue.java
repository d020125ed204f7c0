package com.example.mmlogic.model;

/** sorted set の 1 エントリ (member と score) に対応する。 */
public record IndexedValue(String playerId, long value) {}
