package com.example.mmlogic.model;

/** profile hash の生フィールド。playerPoolsJson は未解析のまま保持する。 */
public record ProfileRecord(String id, String properties, String playerPoolsJson) {}
