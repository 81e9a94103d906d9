package com.yerin.notifyq.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("엔티티 계열/상태 파싱 테스트")
public class EntityFamilyTest {

    @Test
    @DisplayName("wire 값과 enum 이름 둘 다 받는다")
    void from_accepts_value_and_name() {
        assertThat(EntityFamily.from("capital_call")).isEqualTo(EntityFamily.CAPITAL_CALL);
        assertThat(EntityFamily.from("TEAM_INVITE")).isEqualTo(EntityFamily.TEAM_INVITE);
        assertThatThrownBy(() -> EntityFamily.from("deal")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("모르는 상태는 empty")
    void unknown_state_is_empty() {
        assertThat(EntityFamily.CAPITAL_CALL.parseState("paid")).isEqualTo(Optional.of(CapitalCallItemStatus.PAID));
        assertThat(EntityFamily.CAPITAL_CALL.parseState("new")).isEmpty();
        assertThat(EntityFamily.PROSPECT.parseState(null)).isEmpty();
    }

    @Test
    @DisplayName("카테고리 wire 이름 역조회")
    void category_from_wire_name() {
        assertThat(JobCategory.fromWireName("capital_call_past_due_7")).contains(JobCategory.CAPITAL_CALL_PAST_DUE_7);
        assertThat(JobCategory.fromWireName("email_welcome")).isEmpty();
        assertThat(JobCategory.fromWireName(null)).isEmpty();
    }
}
