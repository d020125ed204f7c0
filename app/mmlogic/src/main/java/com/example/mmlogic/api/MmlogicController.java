/*
 * どこで: Mmlogic API
 * 何を: player pool stream / profile / proposal / ignore list エンドポイントを公開する
 * なぜ: matchmaking function からの照会要求を受け付ける入口を提供するため
 */
package com.example.mmlogic.api;

import com.example.mmlogic.api.request.CreateProposalRequest;
import com.example.mmlogic.api.request.PlayerPoolRequest;
import com.example.mmlogic.api.response.ProfileResponse;
import com.example.mmlogic.api.response.ProposalResultResponse;
import com.example.mmlogic.api.response.RosterResponse;
import com.example.mmlogic.service.MmlogicService;
import com.example.mmlogic.service.PlayerPoolService;
import com.example.mmlogic.service.PreparedPlayerPool;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

@RestController
@RequestMapping("/v1/mmlogic")
public class MmlogicController {

  private final PlayerPoolService playerPoolService;
  private final MmlogicService mmlogicService;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public MmlogicController(
      PlayerPoolService playerPoolService, MmlogicService mmlogicService, ObjectMapper objectMapper) {
    this.playerPoolService = playerPoolService;
    this.mmlogicService = mmlogicService;
    this.objectMapper = objectMapper;
  }

  /**
   * 役割: player pool を評価し、roster ページを NDJSON で返す。
   * 動作: filter 評価と ignore list 除外は応答開始前に終えるため、その段階の失敗は通常のエラー応答になる。
   */
  @PostMapping("/player-pools")
  public ResponseEntity<StreamingResponseBody> getPlayerPool(
      @Valid @RequestBody PlayerPoolRequest request) {
    final PreparedPlayerPool prepared = playerPoolService.prepare(request.toPlayerPool());
    final StreamingResponseBody body =
        outputStream ->
            playerPoolService.stream(
                prepared, new NdjsonRosterPageSink(objectMapper, outputStream));
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_NDJSON).body(body);
  }

  @GetMapping("/profiles/{profileId}")
  public ResponseEntity<ProfileResponse> getProfile(@PathVariable("profileId") String profileId) {
    return ResponseEntity.ok(mmlogicService.getProfile(profileId));
  }

  @PostMapping("/proposals")
  public ResponseEntity<ProposalResultResponse> createProposal(
      @Valid @RequestBody CreateProposalRequest request) {
    return ResponseEntity.ok(mmlogicService.createProposal(request.toMatchObject()));
  }

  @GetMapping("/ignore-lists/proposed")
  public ResponseEntity<RosterResponse> listIgnoredPlayers(
      @RequestParam(name = "older_than", required = false) Long olderThan) {
    return ResponseEntity.ok(mmlogicService.listIgnoredPlayers(olderThan));
  }

  @GetMapping("/ignore-lists")
  public ResponseEntity<RosterResponse> getAllIgnoredPlayers() {
    return ResponseEntity.ok(mmlogicService.getAllIgnoredPlayers());
  }
}
