package com.stock.monitor.backend.watchlist;

import java.util.List;

public interface WatchlistProvider {

    /**
     * 지정한 상태의 종목만, 원본 순서대로.
     */
    List<WatchlistEntry> listWatchlist(List<String> statuses);

    String name();
}
