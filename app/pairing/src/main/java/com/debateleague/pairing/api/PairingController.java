/*
 * どこで: Pairing API
 * 何を: 組み合わせの生成/参照エンドポイントを公開する
 * なぜ: 運営側から 1 大会分の生成を起動する入口を提供するため
 */
package com.debateleague.pairing.api;

import com.debateleague.pairing.api.request.GeneratePairingsRequest;
import com.debateleague.pairing.api.response.PairingListResponse;
import com.debateleague.pairing.api.response.PairingRunResponse;
import com.debateleague.pairing.service.PairingService;
import jakarta.validation.Valid;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/pairing")
@RequiredArgsConstructor
public class PairingController {

  private final PairingService pairingService;

  @PostMapping("/events/{format}/pairings")
  public ResponseEntity<PairingRunResponse> generate(
      @PathVariable("format") String format,
      @Valid @RequestBody GeneratePairingsRequest request) {
    return ResponseEntity.ok(pairingService.generate(format, request.eventDate()));
  }

  @GetMapping("/events/{format}/pairings")
  public ResponseEntity<PairingListResponse> list(
      @PathVariable("format") String format,
      @RequestParam("event_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate eventDate) {
    return ResponseEntity.ok(pairingService.list(format, eventDate));
  }
}
