package com.example.mmlogic.service;

import com.example.mmlogic.api.InvalidMmlogicRequestException;
import com.example.mmlogic.api.InvalidProfileException;
import com.example.mmlogic.api.ProfileNotFoundException;
import com.example.mmlogic.api.request.PlayerPoolRequest;
import com.example.mmlogic.api.response.ProfileResponse;
import com.example.mmlogic.api.response.ProposalResultResponse;
import com.example.mmlogic.api.response.RosterResponse;
import com.example.mmlogic.config.MmlogicProperties;
import com.example.mmlogic.model.MatchObject;
import com.example.mmlogic.model.ProfileRecord;
import com.example.mmlogic.repository.ProfileRepository;
import com.example.mmlogic.repository.ProposalRepository;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** player pool 以外の単発 API (profile 参照・proposal 登録・ignore list 参照)。 */
@Service
public class MmlogicService {

  static final String GET_PROFILE = "GetProfile";
  static final String CREATE_PROPOSAL = "CreateProposal";
  static final String LIST_IGNORED_PLAYERS = "ListIgnoredPlayers";
  static final String GET_ALL_IGNORED_PLAYERS = "GetAllIgnoredPlayers";

  private static final Logger logger = LoggerFactory.getLogger(MmlogicService.class);

  private final ProfileRepository profileRepository;
  private final ProposalRepository proposalRepository;
  private final IgnoreListAggregator ignoreListAggregator;
  private final MmlogicProperties properties;
  private final MmlogicMetrics metrics;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public MmlogicService(
      ProfileRepository profileRepository,
      ProposalRepository proposalRepository,
      IgnoreListAggregator ignoreListAggregator,
      MmlogicProperties properties,
      MmlogicMetrics metrics,
      Clock clock,
      ObjectMapper objectMapper) {
    this.profileRepository = profileRepository;
    this.proposalRepository = proposalRepository;
    this.ignoreListAggregator = ignoreListAggregator;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.objectMapper = objectMapper;
  }

  /**
   * 役割: profile とその player pool 定義を返す。
   * 動作: pool 定義 JSON が壊れている場合は一部だけ返さず InvalidProfileException にする。
   */
  public ProfileResponse getProfile(String profileId) {
    return call(
        GET_PROFILE,
        () -> {
          requireText(profileId, "profile id is required");
          logger.info("attempting retrieval of profile profileId={}", profileId);
          final ProfileRecord profile =
              profileRepository
                  .findById(profileId)
                  .orElseThrow(() -> new ProfileNotFoundException(profileId));
          return new ProfileResponse(
              profile.id(), profile.properties(), parsePlayerPools(profile));
        });
  }

  /**
   * 役割: proposal を登録する。
   * 動作: roster 内の player を proposal 用 ignore list へ載せてから properties 保存と queue 追加を行う。
   */
  public ProposalResultResponse createProposal(MatchObject proposal) {
    return call(
        CREATE_PROPOSAL,
        () -> {
          if (proposal == null) {
            throw new InvalidMmlogicRequestException("proposal is required");
          }
          requireText(proposal.id(), "proposal id is required");
          logger.info("attempting to create proposal proposalId={}", proposal.id());
          final List<String> playerIds = proposal.playerIds();
          if (!playerIds.isEmpty()) {
            ignoreListAggregator.append(properties.proposal().ignoreList(), playerIds, clock.instant());
          }
          proposalRepository.saveProperties(
              proposal.id(), proposal.properties() == null ? "" : proposal.properties());
          proposalRepository.enqueue(properties.proposal().queue(), proposal.id());
          logger.info(
              "proposal created proposalId={} players={}", proposal.id(), playerIds.size());
          return new ProposalResultResponse(true, "");
        });
  }

  /** 役割: proposal 用 ignore list のうち olderThan 以前に載った player を返す。 */
  public RosterResponse listIgnoredPlayers(Long olderThanEpochSeconds) {
    return call(
        LIST_IGNORED_PLAYERS,
        () -> {
          final Instant cutoff =
              olderThanEpochSeconds == null ? clock.instant() : cutoffOf(olderThanEpochSeconds);
          return RosterResponse.ofPlayerIds(
              ignoreListAggregator.retrieve(properties.proposal().ignoreList(), cutoff));
        });
  }

  /** older_than は horizon を引いても Instant の範囲に収まる値だけを受け付ける。 */
  private Instant cutoffOf(long epochSeconds) {
    final Duration horizon =
        properties.ignoreLists().get(properties.proposal().ignoreList()).horizon();
    try {
      final Instant cutoff = Instant.ofEpochSecond(epochSeconds);
      if (horizon != null && cutoff.isBefore(Instant.MIN.plus(horizon))) {
        throw new DateTimeException("window start precedes Instant.MIN");
      }
      return cutoff;
    } catch (DateTimeException | ArithmeticException ex) {
      throw new InvalidMmlogicRequestException("older_than is out of range: " + epochSeconds);
    }
  }

  /** 役割: 設定済みの全 ignore list の和集合を返す。 */
  public RosterResponse getAllIgnoredPlayers() {
    return call(
        GET_ALL_IGNORED_PLAYERS,
        () -> RosterResponse.ofPlayerIds(ignoreListAggregator.aggregate(clock.instant())));
  }

  private <T> T call(String method, Supplier<T> body) {
    metrics.recordApiRequest(method);
    try {
      return body.get();
    } catch (RuntimeException ex) {
      metrics.recordApiError(method);
      throw ex;
    }
  }

  private List<PlayerPoolRequest> parsePlayerPools(ProfileRecord profile) {
    final String json = profile.playerPoolsJson();
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      final StoredPlayerPools stored = objectMapper.readValue(json, StoredPlayerPools.class);
      return stored == null || stored.playerPools() == null ? List.of() : stored.playerPools();
    } catch (JsonProcessingException ex) {
      throw new InvalidProfileException(profile.id(), ex);
    }
  }

  private void requireText(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new InvalidMmlogicRequestException(message);
    }
  }

  /** profile hash の playerPools フィールドに格納される JSON の外枠。 */
  record StoredPlayerPools(@JsonProperty("playerPools") List<PlayerPoolRequest> playerPools) {}
}
