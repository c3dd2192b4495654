package com.example.sfera.proactive;

import com.example.sfera.config.SferaProactiveProperties;
import com.example.sfera.memory.UserPlanState;
import com.example.sfera.memory.UserStateStore;
import com.example.sfera.session.SessionHandle;
import com.example.sfera.session.SessionRegistry;
import com.example.sfera.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProactiveFollowUpJobTest {

    private MutableClock clock;
    private UserStateStore userStateStore;
    private SessionRegistry registry;
    private ProactiveMessageSender sender;
    private ProactiveFollowUpJob job;
    private Instant now;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        now = clock.instant();
        userStateStore = mock(UserStateStore.class);
        registry = new SessionRegistry();
        sender = mock(ProactiveMessageSender.class);
        job = new ProactiveFollowUpJob(userStateStore, registry, sender, new SferaProactiveProperties(), clock);
    }

    private UserPlanState plan(String userId, Duration sinceUpdate, Duration sinceProactive) {
        return new UserPlanState(
                userId,
                "3-Day-Recovery",
                Optional.ofNullable(sinceUpdate).map(now::minus),
                Optional.ofNullable(sinceProactive).map(now::minus));
    }

    @Test
    void noActivePlansContactsNobody() {
        when(userStateStore.findUsersWithActivePlan()).thenReturn(List.of());

        assertThat(job.sweep()).isZero();
    }

    @Test
    void onlineUserIsReachedThroughLiveSession() {
        SessionHandle handle = new SessionHandle("u1", "ctx", "agent");
        registry.register("u1", handle);
        when(userStateStore.findUsersWithActivePlan()).thenReturn(List.of(plan("u1", Duration.ofDays(2), null)));

        assertThat(job.sweep()).isEqualTo(1);

        verify(sender).deliverLive(eq(handle), contains("3-Day-Recovery"));
        verify(sender, never()).notifyOffline(anyString(), anyString());
        verify(userStateStore).markProactiveMessageSent("u1", now);
    }

    @Test
    void offlineUserGetsNotification() {
        when(userStateStore.findUsersWithActivePlan()).thenReturn(List.of(plan("u2", null, null)));

        assertThat(job.sweep()).isEqualTo(1);

        verify(sender).notifyOffline(eq("u2"), contains("3-Day-Recovery"));
        verify(userStateStore).markProactiveMessageSent("u2", now);
    }

    @Test
    void recentProgressOrRecentFollowUpSuppressesMessage() {
        assertThat(job.needsFollowUp(plan("u", Duration.ofHours(3), null), now)).isFalse();
        assertThat(job.needsFollowUp(plan("u", Duration.ofDays(2), Duration.ofHours(5)), now)).isFalse();
        assertThat(job.needsFollowUp(plan("u", Duration.ofDays(2), Duration.ofDays(1)), now)).isTrue();
        assertThat(job.needsFollowUp(plan("u", null, null), now)).isTrue();
    }

    @Test
    void failureForOneUserDoesNotStopTheSweep() {
        when(userStateStore.findUsersWithActivePlan()).thenReturn(List.of(
                plan("bad", null, null),
                plan("good", null, null)));
        doThrow(new IllegalStateException("push gateway down")).when(sender).notifyOffline(eq("bad"), anyString());

        assertThat(job.sweep()).isEqualTo(1);

        verify(userStateStore).markProactiveMessageSent("good", now);
        verify(userStateStore, never()).markProactiveMessageSent(eq("bad"), any());
    }

    @Test
    void scheduledSweepLogsInsteadOfThrowing() {
        when(userStateStore.findUsersWithActivePlan()).thenThrow(new IllegalStateException("db down"));

        job.scheduledSweep();

        verify(sender, never()).notifyOffline(anyString(), anyString());
    }
}
