package com.example.sfera.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "sfera.proactive")
public class SferaProactiveProperties {

    /** Master toggle for the follow-up job bean. */
    private boolean enabled = true;

    /** A plan without progress for this long gets a follow-up. */
    @NotNull
    private Duration followUpAfter = Duration.ofDays(1);

    /** Never reach out to the same user more often than this. */
    @NotNull
    private Duration minGap = Duration.ofDays(1);

    /** Follow-up text; {@code %s} is replaced with the plan name. */
    @NotBlank
    private String messageTemplate = "Hi! This is Sfera AI. I noticed you have an active plan '%s' "
            + "and it has been a while since your last update. Whenever you are ready, let's continue!";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getFollowUpAfter() {
        return followUpAfter;
    }

    public void setFollowUpAfter(Duration followUpAfter) {
        this.followUpAfter = followUpAfter;
    }

    public Duration getMinGap() {
        return minGap;
    }

    public void setMinGap(Duration minGap) {
        this.minGap = minGap;
    }

    public String getMessageTemplate() {
        return messageTemplate;
    }

    public void setMessageTemplate(String messageTemplate) {
        this.messageTemplate = messageTemplate;
    }
}
