package com.ryuqq.taskbridge.application.dispatcher;

import com.ryuqq.taskbridge.core.error.ErrorKind;
import com.ryuqq.taskbridge.core.outcome.Fail;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BulkSummary / ItemOutcome 테스트.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
class BulkSummaryTest {

    @Test
    void 성공과_실패_개수를_집계() {
        // given
        Instant now = Instant.now();
        List<ItemOutcome<Void>> items = new ArrayList<>();
        items.add(ItemOutcome.succeeded("a", null, now));
        items.add(ItemOutcome.failed("b", Fail.of(ErrorKind.FATAL_PROTOCOL, "privacy restricted"), now));
        items.add(ItemOutcome.succeeded("c", null, now));

        // when
        BulkSummary<Void> summary = new BulkSummary<>(items);

        // then
        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.isAllSucceeded()).isFalse();
        assertThat(summary.failures()).extracting(ItemOutcome::item).containsExactly("b");
    }

    @Test
    void 입력_목록이_바뀌어도_요약은_불변() {
        // given
        List<ItemOutcome<Boolean>> items = new ArrayList<>();
        items.add(ItemOutcome.succeeded("+1", true, Instant.now()));
        BulkSummary<Boolean> summary = new BulkSummary<>(items);

        // when
        items.clear();

        // then
        assertThat(summary.total()).isEqualTo(1);
        assertThatThrownBy(() -> summary.items().add(ItemOutcome.succeeded("+2", false, Instant.now())))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void 실패_항목에_오류가_없으면_거부() {
        assertThatThrownBy(() -> new ItemOutcome<Void>("a", ItemStatus.FAILED, null, null, Instant.now()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
