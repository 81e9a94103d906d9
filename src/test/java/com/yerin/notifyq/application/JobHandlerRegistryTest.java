package com.yerin.notifyq.application;

import com.yerin.notifyq.domain.EntityStateLookup;
import com.yerin.notifyq.domain.JobCategory;
import com.yerin.notifyq.domain.NotificationSender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("핸들러 레지스트리 테스트")
public class JobHandlerRegistryTest {

    EntityStateLookup lookup = mock(EntityStateLookup.class);
    NotificationSender sender = mock(NotificationSender.class);

    private List<JobHandler> allHandlers() {
        return List.of(
                new ProspectNotificationHandler(lookup, sender, ""),
                new InvestorNotificationHandler(lookup, sender, ""),
                new CapitalCallNotificationHandler(lookup, sender, ""),
                new TeamInviteNotificationHandler(lookup, sender, ""));
    }

    @Test
    @DisplayName("네 핸들러가 모든 카테고리를 빠짐없이 덮는다")
    void every_category_has_a_handler() {
        JobHandlerRegistry registry = new JobHandlerRegistry(allHandlers());

        assertThat(registry.categories()).containsExactlyInAnyOrder(JobCategory.values());
        assertThat(registry.find("capital_call_past_due_7")).get().isInstanceOf(CapitalCallNotificationHandler.class);
        assertThat(registry.find("team_invite_reminder_3d")).get().isInstanceOf(TeamInviteNotificationHandler.class);
    }

    @Test
    @DisplayName("모르는 category 는 빈 값")
    void unknown_category() {
        JobHandlerRegistry registry = new JobHandlerRegistry(allHandlers());

        assertThat(registry.find("nope")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    @DisplayName("같은 category 를 두 핸들러가 가지면 생성 시 실패")
    void duplicate_category_rejected() {
        List<JobHandler> handlers = List.of(
                new TeamInviteNotificationHandler(lookup, sender, ""),
                new TeamInviteNotificationHandler(lookup, sender, ""));

        assertThatThrownBy(() -> new JobHandlerRegistry(handlers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("team_invite_reminder");
    }
}
