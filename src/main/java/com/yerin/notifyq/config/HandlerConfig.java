package com.yerin.notifyq.config;

import com.yerin.notifyq.application.*;
import com.yerin.notifyq.domain.EntityStateLookup;
import com.yerin.notifyq.domain.NotificationSender;
import com.yerin.notifyq.infra.JdbcEntityStateLookup;
import com.yerin.notifyq.infra.LoggingNotificationSender;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;

/**
 * 계열별 조회기와 핸들러를 명시적으로 묶어 디스패치 테이블을 만든다.
 */
@Configuration
public class HandlerConfig {

    @Bean
    @ConditionalOnMissingBean
    public NotificationSender notificationSender(@Value("${notifyq.sender.fail-always:false}") boolean failAlways) {
        return new LoggingNotificationSender(failAlways);
    }

    @Bean
    public EntityStateLookup prospectStateLookup(NamedParameterJdbcTemplate jdbc) {
        return JdbcEntityStateLookup.prospects(jdbc);
    }

    @Bean
    public EntityStateLookup investorStateLookup(NamedParameterJdbcTemplate jdbc) {
        return JdbcEntityStateLookup.investors(jdbc);
    }

    @Bean
    public EntityStateLookup capitalCallStateLookup(NamedParameterJdbcTemplate jdbc) {
        return JdbcEntityStateLookup.capitalCallItems(jdbc);
    }

    @Bean
    public EntityStateLookup teamInviteStateLookup(NamedParameterJdbcTemplate jdbc) {
        return JdbcEntityStateLookup.teamInvites(jdbc);
    }

    @Bean
    public ProspectNotificationHandler prospectNotificationHandler(@Qualifier("prospectStateLookup") EntityStateLookup lookup,
                                                                   NotificationSender sender,
                                                                   @Value("${notifyq.sender.portal-base-url:http://localhost:5173}") String portalBaseUrl) {
        return new ProspectNotificationHandler(lookup, sender, portalBaseUrl);
    }

    @Bean
    public InvestorNotificationHandler investorNotificationHandler(@Qualifier("investorStateLookup") EntityStateLookup lookup,
                                                                   NotificationSender sender,
                                                                   @Value("${notifyq.sender.portal-base-url:http://localhost:5173}") String portalBaseUrl) {
        return new InvestorNotificationHandler(lookup, sender, portalBaseUrl);
    }

    @Bean
    public CapitalCallNotificationHandler capitalCallNotificationHandler(@Qualifier("capitalCallStateLookup") EntityStateLookup lookup,
                                                                         NotificationSender sender,
                                                                         @Value("${notifyq.sender.portal-base-url:http://localhost:5173}") String portalBaseUrl) {
        return new CapitalCallNotificationHandler(lookup, sender, portalBaseUrl);
    }

    @Bean
    public TeamInviteNotificationHandler teamInviteNotificationHandler(@Qualifier("teamInviteStateLookup") EntityStateLookup lookup,
                                                                       NotificationSender sender,
                                                                       @Value("${notifyq.sender.portal-base-url:http://localhost:5173}") String portalBaseUrl) {
        return new TeamInviteNotificationHandler(lookup, sender, portalBaseUrl);
    }

    @Bean
    public JobHandlerRegistry jobHandlerRegistry(List<JobHandler> handlers) {
        return new JobHandlerRegistry(handlers);
    }
}
