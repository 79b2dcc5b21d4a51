package com.hrintake.telegram.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BotConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
