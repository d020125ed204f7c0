/*
 * どこで: Mmlogic ドメインモデル
 * 何を: filter / pool 評価の件数と所要時間を表現する
 * なぜ: 呼び出し側がクエリのコストを観測できるようにするため
 */
package com.example.mmlogic.model;

public record Stats(long count, double elapsedSeconds) {}
