package com.example.sfera.proactive;

import com.example.sfera.config.SferaProactiveProperties;
import com.example.sfera.memory.UserPlanState;
import com.example.sfera.memory.UserStateStore;
import com.example.sfera.session.SessionHandle;
import com.example.sfera.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Periodic sweep over users with an active plan that reaches out to the ones who have
 * gone quiet: through the live session when the registry has one, out of band otherwise.
 */
@Slf4j
public class ProactiveFollowUpJob {

    private final UserStateStore userStateStore;
    private final SessionRegistry registry;
    private final ProactiveMessageSender sender;
    private final SferaProactiveProperties props;
    private final Clock clock;

    public ProactiveFollowUpJob(
            UserStateStore userStateStore,
            SessionRegistry registry,
            ProactiveMessageSender sender,
            SferaProactiveProperties props,
            Clock clock) {
        this.userStateStore = userStateStore;
        this.registry = registry;
        this.sender = sender;
        this.props = props;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${sfera.proactive.check-interval-ms:300000}",
            initialDelayString = "${sfera.proactive.check-interval-ms:300000}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("[proactive] sweep failed", e);
        }
    }

    /**
     * @return number of users contacted
     */
    public int sweep() {
        List<UserPlanState> users = userStateStore.findUsersWithActivePlan();
        if (users.isEmpty()) {
            log.info("[proactive] no active plans");
            return 0;
        }
        log.info("[proactive] {} users with active plans", users.size());

        Instant now = clock.instant();
        int contacted = 0;
        for (UserPlanState user : users) {
            if (!needsFollowUp(user, now)) {
                continue;
            }
            try {
                followUp(user, now);
                contacted++;
            } catch (RuntimeException e) {
                log.error("[proactive] follow-up failed for user {}", user.userId(), e);
            }
        }
        return contacted;
    }

    boolean needsFollowUp(UserPlanState user, Instant now) {
        boolean stale = user.lastUpdate()
                .map(at -> Duration.between(at, now).compareTo(props.getFollowUpAfter()) > 0)
                .orElse(true);
        if (!stale) {
            return false;
        }
        return user.lastProactiveMessage()
                .map(at -> Duration.between(at, now).compareTo(props.getMinGap()) >= 0)
                .orElse(true);
    }

    private void followUp(UserPlanState user, Instant now) {
        String text = String.format(props.getMessageTemplate(), user.plan());
        Optional<SessionHandle> live = registry.get(user.userId());
        if (live.isPresent()) {
            log.info("[proactive] user {} is online, delivering follow-up for plan '{}'", user.userId(), user.plan());
            sender.deliverLive(live.get(), text);
        } else {
            log.info("[proactive] user {} is offline, queueing notification for plan '{}'", user.userId(), user.plan());
            sender.notifyOffline(user.userId(), text);
        }
        userStateStore.markProactiveMessageSent(user.userId(), now);
    }
}
