package io.github.devsha256.odataclient.query;

import io.github.devsha256.odataclient.exception.ODataClientException;
import io.github.devsha256.odataclient.model.EntityType;
import io.github.devsha256.odataclient.model.PropertyInfo;
import io.github.devsha256.odataclient.service.AtomEntityParser;
import io.github.devsha256.odataclient.service.EntitySet;
import io.github.devsha256.odataclient.service.ODataService;
import io.github.devsha256.odataclient.service.RawResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

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
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryTest {

    private static final EntityType PRODUCT = new EntityType("ODataDemo", "Product", List.of(
            new PropertyInfo("ID", "Edm.Int32", false, null),
            new PropertyInfo("Name", "Edm.String", true, 40),
            new PropertyInfo("Price", "Edm.Decimal", false, null)));

    private ODataService service;
    private Query query;

    @BeforeEach
    void setUp() {
        service = mock(ODataService.class);
        when(service.serviceUrl()).thenReturn("http://example.com/svc");
        query = new EntitySet("Products", service, PRODUCT, new AtomEntityParser(), 100).query();
    }

    @Test
    void emptyQueryIsTheEntitySetName() {
        assertThat(query.toString()).isEqualTo("Products");
        assertThat(query.compile().criteria()).isEmpty();
    }

    @Test
    void whereConjunctsWithAnd() {
        query.where(query.property("Name").eq("A"))
                .where(query.property("Price").gt(10));

        assertThat(query.toString()).isEqualTo("Products?$filter=Name eq 'A' and Price gt 10");
    }

    @Test
    void indexerResolvesKnownProperties() {
        Criteria criteria = query.property("Name");

        assertThat(criteria.getOperand()).isInstanceOf(FilterOperand.Resolved.class);
        assertThat(((FilterOperand.Resolved) criteria.getOperand()).property().type()).isEqualTo("Edm.String");
    }

    @Test
    void indexerKeepsUnknownPropertiesRaw() {
        Criteria criteria = query.property("Colour");

        assertThat(criteria.getOperand()).isEqualTo(new FilterOperand.Raw("Colour"));
        assertThat(query.where(criteria.eq("red")).toString()).isEqualTo("Products?$filter=Colour eq 'red'");
    }

    @Test
    void indexerDoesNotChangeTheQuery() {
        query.property("Name").eq("A");

        assertThat(query.toString()).isEqualTo("Products");
    }

    @Test
    void whereRejectsCriteriaWithoutComparison() {
        assertThatThrownBy(() -> query.where(query.property("Name")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fragmentsFollowFixedOrder() {
        query.limit(5)
                .skip(10)
                .includeCount()
                .select("Name", "Price")
                .expand("Category")
                .orderBy("Name desc")
                .searchTerm("bread")
                .where(query.property("Price").lt(3));

        assertThat(query.toString()).isEqualTo("Products?$filter=Price lt 3"
                + "&searchTerm='bread'&includePrerelease=false"
                + "&$orderby=Name desc"
                + "&$expand=Category"
                + "&$select=Name,Price"
                + "&$inlinecount=allpages"
                + "&$skip=10"
                + "&$top=5");
    }

    @Test
    void listsKeepInsertionOrderAcrossCalls() {
        query.orderBy("Name").orderBy("Price desc", "ID")
                .select("ID").select("Name");

        assertThat(query.toString()).isEqualTo("Products?$orderby=Name,Price desc,ID&$select=ID,Name");
    }

    @Test
    void pagingOverwritesInsteadOfAccumulating() {
        query.limit(5).limit(10).skip(3).skip("7");

        assertThat(query.toString()).isEqualTo("Products?$skip=7&$top=10");
    }

    @Test
    void zeroPagingIsOmitted() {
        query.limit(10).limit(0).skip(0);

        assertThat(query.toString()).isEqualTo("Products");
    }

    @Test
    void pagingRejectsBadValues() {
        assertThatThrownBy(() -> query.skip(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> query.limit("ten")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blankSearchTermIsOmitted() {
        query.searchTerm("   ").select("Name");

        assertThat(query.toString()).isEqualTo("Products?$select=Name");
    }

    @Test
    void searchTermLastCallWins() {
        query.searchTerm("milk").searchTerm("bread");

        assertThat(query.toString()).isEqualTo("Products?searchTerm='bread'&includePrerelease=false");
    }

    @Test
    void compiledQueryIsNotAffectedByLaterChanges() {
        query.limit(5);
        CompiledQuery compiled = query.compile();

        query.limit(20).where(query.property("Name").eq("A"));

        assertThat(compiled.toString()).isEqualTo("Products?$top=5");
        assertThat(compiled.filters()).isEmpty();
    }

    @Test
    void executeRunsTheRenderedQuery() {
        when(service.execute(anyString(), anyMap(), anyBoolean()))
                .thenReturn(new RawResponse(200, Feeds.page(null, "Bread")));

        Result result = query.limit(1).execute();

        verify(service).execute("Products?$top=1", Map.of(), false);
        assertThat(result.getQuery().toString()).isEqualTo("Products?$top=1");
        assertThat(result.toList()).extracting(e -> e.get("Name")).containsExactly("Bread");
    }

    @Test
    void countUsesCountPathWithCriteria() {
        when(service.execute(eq("Products/$count?$filter=Price gt 2"), anyMap(), eq(false)))
                .thenReturn(new RawResponse(200, "42\n"));

        long count = query.where(query.property("Price").gt(2)).count();

        assertThat(count).isEqualTo(42);
    }

    @Test
    void countWithoutCriteriaHasNoTrailingQuestionMark() {
        when(service.execute(eq("Products/$count"), anyMap(), eq(false)))
                .thenReturn(new RawResponse(200, "0"));

        assertThat(query.isEmpty()).isTrue();
    }

    @Test
    void countRejectsNonNumericBody() {
        when(service.execute(anyString(), anyMap(), anyBoolean()))
                .thenReturn(new RawResponse(200, "<error/>"));

        assertThatThrownBy(query::count)
                .isInstanceOf(ODataClientException.class)
                .hasMessageContaining("$count");
    }

    @Test
    void renderingDoesNotCallTheService() {
        query.where(query.property("Name").eq("A")).toString();

        verify(service, never()).execute(anyString(), anyMap(), anyBoolean());
    }
}
