package com.example.mmlogic.service;

import com.example.mmlogic.config.MmlogicProperties;
import com.example.mmlogic.model.FilterResult;
import com.example.mmlogic.model.Player;
import com.example.mmlogic.model.PlayerPool;
import com.example.mmlogic.model.PlayerProperty;
import com.example.mmlogic.model.PoolCandidates;
import com.example.mmlogic.model.Roster;
import com.example.mmlogic.model.RosterPage;
import com.example.mmlogic.model.Stats;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 候補 id を player へ組み立て、page-size 件ずつの roster ページとして順に送る。
 *
 * <p>保持するのは送信前の 1 ページ分だけ。候補が 0 件でも空ページを 1 回送る。送信失敗時は残りの
 * ページを送らずに StreamSendException を送出し、送信済みページの再送や取り消しは行わない。
 */
@Component
public class ResultPaginator {

  private static final Logger logger = LoggerFactory.getLogger(ResultPaginator.class);

  private final int pageSize;
  private final PoolQueryObserver observer;

  public ResultPaginator(MmlogicProperties properties, PoolQueryObserver observer) {
    this.pageSize = properties.results().pageSize();
    this.observer = observer;
  }

  /**
   * 役割: candidates を roster ページへ分割して sink へ送る。
   * 動作: ページ番号は 1 始まりで昇順に送る。送ったページ数を返す。
   * 前提: pool には PoolIntersector が Stats を付与済みであること。
   */
  public int stream(PoolCandidates candidates, RosterPageSink sink, PoolQueryContext context) {
    final PlayerPool pool = candidates.pool();
    final int total = candidates.size();
    final int pageCount = Math.max(1, (total + pageSize - 1) / pageSize);
    final Stats stats = pool.stats();
    if (stats == null) {
      throw new IllegalStateException("pool stats are not attached pool=" + pool.id());
    }
    final Map<String, FilterResult> resultsByField = resultsByField(candidates.filterResults());

    int pageIndex = 0;
    List<Player> batch = new ArrayList<>(Math.min(pageSize, Math.max(total, 1)));
    for (String playerId : candidates.playerIds()) {
      batch.add(toPlayer(playerId, resultsByField));
      if (batch.size() == pageSize) {
        send(sink, page(pool, stats, ++pageIndex, pageCount, batch), context);
        batch = new ArrayList<>(Math.min(pageSize, total - pageIndex * pageSize));
      }
    }
    if (!batch.isEmpty() || pageIndex == 0) {
      send(sink, page(pool, stats, ++pageIndex, pageCount, batch), context);
    }
    logger.debug(
        "player pool streaming complete pool={} count={} pages={}", pool.id(), total, pageIndex);
    return pageIndex;
  }

  private Map<String, FilterResult> resultsByField(List<FilterResult> results) {
    final Map<String, FilterResult> byField = new LinkedHashMap<>();
    for (FilterResult result : results) {
      byField.putIfAbsent(result.field(), result);
    }
    return byField;
  }

  private Player toPlayer(String playerId, Map<String, FilterResult> resultsByField) {
    final List<PlayerProperty> properties = new ArrayList<>(resultsByField.size());
    for (Map.Entry<String, FilterResult> entry : resultsByField.entrySet()) {
      final Long value = entry.getValue().valueOf(playerId);
      if (value != null) {
        properties.add(new PlayerProperty(entry.getKey(), value));
      }
    }
    return new Player(playerId, properties);
  }

  private RosterPage page(
      PlayerPool pool, Stats stats, int pageIndex, int pageCount, List<Player> players) {
    return new RosterPage(
        RosterPage.pageId(pool.id(), pageIndex, pageCount),
        pageIndex,
        pageCount,
        pool.filters(),
        stats,
        new Roster(RosterPage.rosterId(pool.id()), players));
  }

  private void send(RosterPageSink sink, RosterPage page, PoolQueryContext context) {
    context.checkActive();
    try {
      sink.send(page);
    } catch (StreamSendException ex) {
      recordSendFailure(page, ex);
      throw ex;
    } catch (RuntimeException ex) {
      recordSendFailure(page, ex);
      throw new StreamSendException(page.id(), ex);
    }
    observer.recordEvent(
        PoolQueryEvents.PAGE_SENT,
        Map.of("page", page.id(), "players", page.roster().players().size()));
  }

  private void recordSendFailure(RosterPage page, RuntimeException ex) {
    observer.recordError(
        PoolQueryEvents.PAGE_SEND_FAILED,
        ex,
        Map.of("page", page.id(), "page_index", page.pageIndex(), "page_count", page.pageCount()));
  }
}
