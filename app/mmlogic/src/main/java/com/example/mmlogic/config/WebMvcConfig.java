/*
 * どこで: Mmlogic Web 設定
 * 何を: MDC interceptor の適用と、roster stream を書き出す非同期 executor の設定を行う
 * なぜ: stream 応答のログにもリクエスト単位の運用キーを残すため
 */
package com.example.mmlogic.config;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor);
  }

  @Override
  public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
    configurer.setTaskExecutor(rosterStreamTaskExecutor());
  }

  @Bean
  public ThreadPoolTaskExecutor rosterStreamTaskExecutor() {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("mmlogic-stream-");
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(32);
    executor.setQueueCapacity(256);
    executor.setTaskDecorator(mdcTaskDecorator());
    return executor;
  }

  /** 投入元スレッドの MDC を実行スレッドへ引き継ぎ、終了時に元へ戻す。 */
  static TaskDecorator mdcTaskDecorator() {
    return runnable -> {
      final Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        final Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(context);
        }
        try {
          runnable.run();
        } finally {
          if (previous == null) {
            MDC.clear();
          } else {
            MDC.setContextMap(previous);
          }
        }
      };
    };
  }
}
