package com.propertyintel.listings.recrawl;

import com.propertyintel.listings.store.StoreErrorTranslator;
import com.propertyintel.listings.store.TableSet;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, bounded view over the due part of the recrawl queue.
 *
 * Pages are fetched with a keyset on (next_update_ts, listing_id), so entries
 * rescheduled while a caller iterates are never returned twice.
 */
public class DueListings implements Iterable<Long> {

    private final NamedParameterJdbcTemplate jdbc;
    private final TableSet tables;
    private final Instant asOf;
    private final int limit;
    private final int pageSize;

    DueListings(NamedParameterJdbcTemplate jdbc, TableSet tables, Instant asOf, int limit, int pageSize) {
        this.jdbc = jdbc;
        this.tables = tables;
        this.asOf = asOf;
        this.limit = limit;
        this.pageSize = pageSize;
    }

    @Override
    public Iterator<Long> iterator() {
        return new PageIterator();
    }

    public Stream<Long> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<Long> toList() {
        return stream().toList();
    }

    private record Row(long listingId, Timestamp nextUpdateTs) {}

    private class PageIterator implements Iterator<Long> {

        private List<Row> page = List.of();
        private int position;
        private int returned;
        private Row last;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (returned >= limit) {
                return false;
            }
            if (position < page.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            fetchNextPage();
            return position < page.size();
        }

        @Override
        public Long next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Row row = page.get(position++);
            last = row;
            returned++;
            return row.listingId();
        }

        private void fetchNextPage() {
            int size = Math.min(pageSize, limit - returned);
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("asOf", Timestamp.from(asOf))
                    .addValue("pageSize", size);

            String keyset = "";
            if (last != null) {
                keyset = """
                        AND (next_update_ts > :afterTs
                             OR (next_update_ts = :afterTs AND listing_id > :afterId))
                        """;
                params.addValue("afterTs", last.nextUpdateTs())
                        .addValue("afterId", last.listingId());
            }

            String sql = """
                    SELECT listing_id, next_update_ts
                    FROM %s
                    WHERE next_update_ts <= :asOf
                    %s
                    ORDER BY next_update_ts ASC, listing_id ASC
                    LIMIT :pageSize
                    """.formatted(tables.active(), keyset);

            page = StoreErrorTranslator.execute("dueForRecrawl " + tables.active(), () -> jdbc.query(sql, params,
                    (rs, rowNum) -> new Row(rs.getLong("listing_id"), rs.getTimestamp("next_update_ts"))));
            position = 0;
            if (page.size() < size) {
                exhausted = true;
            }
        }
    }
}
