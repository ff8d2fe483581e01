package io.github.devsha256.odataclient.query;

import io.github.devsha256.odataclient.model.Entity;
import io.github.devsha256.odataclient.service.EntitySet;
import io.github.devsha256.odataclient.service.RawResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Entities returned by executing a {@link Query}, following continuation links lazily.
 * <p>
 * Every call to {@link #iterator()} starts over from the first page, which was loaded
 * by {@link Query#execute()}; continuation pages are fetched again for each iteration.
 * Entities come out in the order the server sent them. An iteration fails with
 * {@link PaginationLimitExceededException} when it would need more than
 * {@link EntitySet#maxPageFetches()} continuation requests.
 * <p>
 * Not thread-safe; each iterator must be driven by a single caller.
 */
public class Result implements Iterable<Entity> {

    public static final int DEFAULT_MAX_PAGE_FETCHES = 100;

    private static final Logger log = LoggerFactory.getLogger(Result.class);

    private final EntitySet entitySet;
    private final CompiledQuery query;
    private final RawResponse firstPage;

    public Result(EntitySet entitySet, CompiledQuery query, RawResponse firstPage) {
        this.entitySet = entitySet;
        this.query = query;
        this.firstPage = firstPage;
    }

    public CompiledQuery getQuery() {
        return query;
    }

    @Override
    public Iterator<Entity> iterator() {
        return new PageIterator();
    }

    public Stream<Entity> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<Entity> toList() {
        return stream().toList();
    }

    private class PageIterator implements Iterator<Entity> {

        private Iterator<Entity> entities = Collections.emptyIterator();
        private String nextLink;
        private int fetches;

        PageIterator() {
            load(firstPage);
        }

        @Override
        public boolean hasNext() {
            while (!entities.hasNext()) {
                if (nextLink == null) {
                    return false;
                }
                fetchNextPage();
            }
            return true;
        }

        @Override
        public Entity next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return entities.next();
        }

        private void fetchNextPage() {
            int limit = entitySet.maxPageFetches();
            if (fetches >= limit) {
                throw new PaginationLimitExceededException(fetches, nextLink);
            }
            String link = nextLink;
            log.debug("Fetching page {} of {}: {}", fetches + 2, query, link);
            RawResponse page = entitySet.service().execute(link, Map.of(), true);
            fetches++;
            load(page);
        }

        // The link is read before any entity of the page is handed out.
        private void load(RawResponse page) {
            String body = page.body();
            nextLink = ContinuationLink.of(body, entitySet.service().serviceUrl()).orElse(null);
            if (body == null || body.isBlank()) {
                entities = Collections.emptyIterator();
            } else {
                entities = entitySet.parser().parse(body, entitySet.entityType()).iterator();
            }
        }
    }
}
