/*
 * どこで: Pairing エンジン設定
 * 何を: 乱数源を DI 可能にする
 * なぜ: 本番はシードなし、テストは固定シードで差し替えるため
 */
package com.debateleague.pairing.config;

import java.util.Random;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

  @Bean
  public Random pairingRandom() {
    return new Random();
  }
}
