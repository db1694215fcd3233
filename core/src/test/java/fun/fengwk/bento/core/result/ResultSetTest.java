package fun.fengwk.bento.core.result;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
class ResultSetTest {

    @Test
    void shouldBeFailedExactlyWhenErrorPresent() {
        ResultSet ok = new ResultSet(List.of(Item.builder().title("a").build()), 1);
        ResultSet failed = ResultSet.failed(SearchError.of(ErrorKind.UPSTREAM_FAILURE, "timeout"));

        assertThat(ok.failed()).isFalse();
        assertThat(failed.failed()).isTrue();
        assertThat(failed.isEmpty()).isTrue();
        assertThat(failed.getError().getDescription()).isEqualTo("UPSTREAM_FAILURE: timeout");
    }

    @Test
    void shouldPreserveItemOrder() {
        ResultSet results = new ResultSet(List.of(
            Item.builder().title("b").build(),
            Item.builder().title("a").build(),
            Item.builder().title("c").build()
        ), 3);

        assertThat(results).extracting(Item::getTitle).containsExactly("b", "a", "c");
    }

    @Test
    void shouldExposePaginationOnceSizeIsKnown() {
        ResultSet results = new ResultSet(List.of(), 30);
        assertThat(results.getPagination()).isNull();

        results.setStart(10);
        results.setPerPage(10);
        assertThat(results.getPagination().getCurrentPage()).isEqualTo(2);
        assertThat(results.getPagination().getTotalPages()).isEqualTo(3);
    }

    @Test
    void shouldJoinTitleAndSubtitle() {
        Item item = Item.builder().title("My Title").subtitle("A Nice One").format(ItemFormat.ARTICLE).build();

        assertThat(item.getCompleteTitle()).isEqualTo("My Title: A Nice One");
        assertThat(item.getDisplayFormat()).isEqualTo("Article");

        item.setFormatStr("Peer reviewed article");
        assertThat(item.getDisplayFormat()).isEqualTo("Peer reviewed article");
    }

    @Test
    void shouldDescribeErrorFromCause() {
        SearchError error = SearchError.of(ErrorKind.UPSTREAM_FAILURE, new IllegalStateException());

        assertThat(error.getInfo()).isEqualTo("IllegalStateException");
        assertThat(error.getCause()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldMapFormatNames() {
        assertThat(ItemFormat.fromValue("book")).isEqualTo(ItemFormat.BOOK);
        assertThat(ItemFormat.fromValue("Conference Paper")).isEqualTo(ItemFormat.CONFERENCE_PAPER);
        assertThat(ItemFormat.fromValue("Microfilm")).isEqualTo(ItemFormat.OTHER);
        assertThat(ItemFormat.fromValue(" ")).isNull();
    }

}
