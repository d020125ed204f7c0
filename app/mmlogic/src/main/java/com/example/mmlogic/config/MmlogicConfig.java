/*
 * どこで: Mmlogic インフラ設定
 * 何を: Redis テンプレートと filter 評価戦略/実行スレッドを提供する
 * なぜ: Repository とエンジンが共有する基盤を 1 か所で組み立てるため
 */
package com.example.mmlogic.config;

import com.example.mmlogic.service.ConcurrentFilterEvaluation;
import com.example.mmlogic.service.FilterEvaluationStrategy;
import com.example.mmlogic.service.RangeFilterApplier;
import com.example.mmlogic.service.SequentialFilterEvaluation;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class MmlogicConfig {

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }

  @Bean
  ThreadPoolTaskExecutor filterEvaluationExecutor(MmlogicProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("mmlogic-filter-");
    executor.setCorePoolSize(properties.filter().concurrency());
    executor.setMaxPoolSize(properties.filter().concurrency());
    executor.setDaemon(true);
    executor.setTaskDecorator(WebMvcConfig.mdcTaskDecorator());
    return executor;
  }

  @Bean
  FilterEvaluationStrategy filterEvaluationStrategy(
      MmlogicProperties properties,
      RangeFilterApplier rangeFilterApplier,
      @Qualifier("filterEvaluationExecutor") AsyncTaskExecutor filterEvaluationExecutor) {
    return switch (properties.filter().evaluation()) {
      case SEQUENTIAL -> new SequentialFilterEvaluation(rangeFilterApplier);
      case CONCURRENT -> new ConcurrentFilterEvaluation(rangeFilterApplier, filterEvaluationExecutor);
    };
  }
}
