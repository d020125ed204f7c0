package com.example.mmlogic.service;

import com.example.mmlogic.config.MmlogicProperties;
import com.example.mmlogic.repository.IgnoreListRepository;
import com.example.mmlogic.repository.StoreException;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 設定された ignore list を読み、除外する player id の和集合を返す。
 *
 * <p>各 list は自身の horizon で [asOf - horizon, asOf] の範囲を読む。1 つでも読み取りに失敗した場合は
 * 和集合全体を失敗 (StoreException) とし、読めなかった list を黙って無視することはしない。
 */
@Component
public class IgnoreListAggregator {

  private static final Logger logger = LoggerFactory.getLogger(IgnoreListAggregator.class);

  private final IgnoreListRepository ignoreListRepository;
  private final Map<String, MmlogicProperties.IgnoreListProperties> lists;
  private final PoolQueryObserver observer;

  public IgnoreListAggregator(
      IgnoreListRepository ignoreListRepository,
      MmlogicProperties properties,
      PoolQueryObserver observer) {
    this.ignoreListRepository = ignoreListRepository;
    this.lists = new TreeMap<>(properties.ignoreLists());
    this.observer = observer;
  }

  public Set<String> configuredLists() {
    return lists.keySet();
  }

  /** 役割: 設定済みの全 list を asOf 時点で読み、和集合を返す。 */
  public Set<String> aggregate(Instant asOf) {
    return aggregate(lists.keySet(), asOf);
  }

  /**
   * 役割: 指定 list を asOf 時点で読み、和集合を返す。
   * 動作: 返す集合は list 名順・各 list の格納順で重複を除いたもの。
   */
  public Set<String> aggregate(Collection<String> listNames, Instant asOf) {
    logger.info("attempting to get and combine ignorelists count={}", listNames.size());
    final Set<String> ignored = new LinkedHashSet<>();
    for (String listName : listNames) {
      ignored.addAll(retrieve(listName, asOf));
      logger.debug("combined ignorelist list={} total={}", listName, ignored.size());
    }
    return ignored;
  }

  /** 役割: 指定 list へ player を addedAt 時刻で載せる。既に載っている player は時刻が更新される。 */
  public void append(String listName, Collection<String> playerIds, Instant addedAt) {
    final MmlogicProperties.IgnoreListProperties list = requireList(listName);
    ignoreListRepository.append(list.key(), playerIds, addedAt);
    logger.debug("appended to ignorelist list={} count={}", listName, playerIds.size());
  }

  /**
   * 役割: 1 つの list を読む。
   * 動作: 未設定の list 名は IllegalArgumentException。store 障害は StoreException として送出する。
   */
  public List<String> retrieve(String listName, Instant asOf) {
    final MmlogicProperties.IgnoreListProperties list = requireList(listName);
    final Instant from = list.horizon() == null ? null : asOf.minus(list.horizon());
    try {
      final List<String> playerIds = ignoreListRepository.retrieve(list.key(), from, asOf);
      observer.recordEvent(
          PoolQueryEvents.IGNORE_LIST_RETRIEVED,
          Map.of("ignorelist", listName, "count", playerIds.size()));
      return playerIds;
    } catch (StoreException ex) {
      observer.recordError(
          PoolQueryEvents.IGNORE_LIST_STORE_ERROR,
          ex,
          Map.of("ignorelist", listName, "key", list.key(), "query", ex.query()));
      throw ex;
    }
  }

  private MmlogicProperties.IgnoreListProperties requireList(String listName) {
    final MmlogicProperties.IgnoreListProperties list = lists.get(listName);
    if (list == null) {
      throw new IllegalArgumentException("unknown ignore list: " + listName);
    }
    return list;
  }
}
