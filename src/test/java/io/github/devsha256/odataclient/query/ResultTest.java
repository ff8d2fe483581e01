package io.github.devsha256.odataclient.query;

import io.github.devsha256.odataclient.exception.ODataRequestException;
import io.github.devsha256.odataclient.model.Entity;
import io.github.devsha256.odataclient.model.EntityType;
import io.github.devsha256.odataclient.service.AtomEntityParser;
import io.github.devsha256.odataclient.service.EntitySet;
import io.github.devsha256.odataclient.service.ODataService;
import io.github.devsha256.odataclient.service.RawResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResultTest {

    private static final String SERVICE_URL = "http://example.com/svc";

    private ODataService service;

    @BeforeEach
    void setUp() {
        service = mock(ODataService.class);
        when(service.serviceUrl()).thenReturn(SERVICE_URL);
    }

    private Result result(String firstPage, int maxPageFetches) {
        EntitySet products = new EntitySet("Products", service, EntityType.untyped("Product"),
                new AtomEntityParser(), maxPageFetches);
        return new Result(products, products.query().compile(), new RawResponse(200, firstPage));
    }

    private static List<Object> names(Iterable<Entity> entities) {
        List<Object> names = new ArrayList<>();
        entities.forEach(entity -> names.add(entity.get("Name")));
        return names;
    }

    @Test
    void singlePageIsYieldedOnceWithoutFetching() {
        Result result = result(Feeds.page(null, "Bread", "Milk"), 100);

        assertThat(names(result)).containsExactly("Bread", "Milk");
        verify(service, never()).execute(anyString(), anyMap(), anyBoolean());
    }

    @Test
    void followsContinuationLinksInOrder() {
        when(service.execute("/Products?$skiptoken=2", Map.of(), true))
                .thenReturn(new RawResponse(200, Feeds.page(SERVICE_URL + "/Products?$skiptoken=3", "Juice")));
        when(service.execute("/Products?$skiptoken=3", Map.of(), true))
                .thenReturn(new RawResponse(200, Feeds.page(null, "Water", "Tea")));

        Result result = result(Feeds.page(SERVICE_URL + "/Products?$skiptoken=2", "Bread", "Milk"), 100);

        assertThat(names(result)).containsExactly("Bread", "Milk", "Juice", "Water", "Tea");
        verify(service, times(2)).execute(anyString(), anyMap(), eq(true));
    }

    @Test
    void continuationOnOtherSchemeIsNormalized() {
        when(service.execute("/Products?$skiptoken=2", Map.of(), true))
                .thenReturn(new RawResponse(200, Feeds.page(null, "Juice")));

        Result result = result(Feeds.page("https://example.com/svc/Products?$skiptoken=2", "Bread"), 100);

        assertThat(names(result)).containsExactly("Bread", "Juice");
    }

    @Test
    void eachIterationStartsFromTheFirstPage() {
        when(service.execute("/Products?page=2", Map.of(), true))
                .thenReturn(new RawResponse(200, Feeds.page(null, "Juice")));

        Result result = result(Feeds.page(SERVICE_URL + "/Products?page=2", "Bread"), 100);

        assertThat(names(result)).containsExactly("Bread", "Juice");
        assertThat(result.toList()).hasSize(2);
        verify(service, times(2)).execute("/Products?page=2", Map.of(), true);
    }

    @Test
    void pagesAreFetchedLazily() {
        when(service.execute("/Products?page=2", Map.of(), true))
                .thenReturn(new RawResponse(200, Feeds.page(null, "Juice")));

        Iterator<Entity> iterator = result(Feeds.page(SERVICE_URL + "/Products?page=2", "Bread", "Milk"), 100).iterator();
        iterator.next();
        iterator.next();

        verify(service, never()).execute(anyString(), anyMap(), anyBoolean());
        assertThat(iterator.next().get("Name")).isEqualTo("Juice");
        assertThat(iterator.hasNext()).isFalse();
    }

    @Test
    void emptyPageWithLinkKeepsGoing() {
        when(service.execute("/Products?page=2", Map.of(), true))
                .thenReturn(new RawResponse(200, Feeds.page(null, "Juice")));

        Result result = result(Feeds.page(SERVICE_URL + "/Products?page=2"), 100);

        assertThat(names(result)).containsExactly("Juice");
    }

    @Test
    void neverConvergingServerAbortsAfterExactlyTheLimit() {
        String loop = Feeds.page(SERVICE_URL + "/Products?$skiptoken=1", "Again");
        when(service.execute(anyString(), anyMap(), anyBoolean())).thenReturn(new RawResponse(200, loop));

        List<Object> seen = new ArrayList<>();
        Result result = result(loop, Result.DEFAULT_MAX_PAGE_FETCHES);

        assertThatThrownBy(() -> result.forEach(entity -> seen.add(entity.get("Name"))))
                .isInstanceOf(PaginationLimitExceededException.class)
                .hasMessageContaining("Possible infinite loop detected");
        verify(service, times(100)).execute("/Products?$skiptoken=1", Map.of(), true);
        assertThat(seen).hasSize(101);
    }

    @Test
    void pageFetchLimitIsConfigurable() {
        String loop = Feeds.page(SERVICE_URL + "/Products?$skiptoken=1", "Again");
        when(service.execute(anyString(), anyMap(), anyBoolean())).thenReturn(new RawResponse(200, loop));

        Result result = result(loop, 3);

        assertThatThrownBy(result::toList)
                .isInstanceOfSatisfying(PaginationLimitExceededException.class,
                        e -> assertThat(e.getFetches()).isEqualTo(3));
        verify(service, times(3)).execute(anyString(), anyMap(), anyBoolean());
    }

    @Test
    void transportFailureAbortsIteration() {
        when(service.execute(anyString(), anyMap(), anyBoolean()))
                .thenThrow(new ODataRequestException("Request failed with HTTP 503", 503));

        Iterator<Entity> iterator = result(Feeds.page(SERVICE_URL + "/Products?page=2", "Bread"), 100).iterator();

        assertThat(iterator.next().get("Name")).isEqualTo("Bread");
        assertThatThrownBy(iterator::hasNext)
                .isInstanceOf(ODataRequestException.class)
                .hasMessageContaining("503");
    }
}
