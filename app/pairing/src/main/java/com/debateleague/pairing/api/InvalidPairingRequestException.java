/*
 * どこで: Pairing API
 * 何を: リクエスト妥当性エラーを表現する
 * なぜ: バリデーション失敗を 400 へ正規化するため
 */
package com.debateleague.pairing.api;

public class InvalidPairingRequestException extends RuntimeException {
  public InvalidPairingRequestException(String message) {
    super(message);
  }
}
