/*
 * どこで: Pairing エンジン
 * 何を: 実行全体を中断するエンジン例外の基底を定義する
 * なぜ: 部分結果を出さずに 1 つのエラーで失敗させるため
 */
package com.debateleague.pairing.engine;

public abstract class PairingEngineException extends RuntimeException {
  protected PairingEngineException(String message) {
    super(message);
  }
}
