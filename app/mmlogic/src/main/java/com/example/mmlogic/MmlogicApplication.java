/*
 * どこで: Mmlogic アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: player pool 照会 API と Redis 接続設定を単一アプリとして起動するため
 */
package com.example.mmlogic;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class MmlogicApplication {

  public static void main(String[] args) {
    SpringApplication.run(MmlogicApplication.class, args);
  }
}
