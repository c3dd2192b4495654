package com.example.sfera.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "sfera.memory")
public class SferaMemoryProperties {

    public enum OnFailure {
        /** Start the session with the greeting turn only. */
        EMPTY_CONTEXT,
        /** Propagate the failure to the session runtime. */
        ABORT
    }

    /** History records fetched from the vector store per session start. */
    @Min(1)
    private int historyFetchLimit = 30;

    /** Most recent records replayed into the initial context. */
    @Min(0)
    private int replayLimit = 10;

    /** System turn appended after the replayed history. */
    @NotBlank
    private String greetingInstruction = "User connected. You MUST say exactly: "
            + "'Привет. Я Sfera AI. Твоя цифровая напарница в трейдинге. Чем сегодня займемся?' "
            + "Address the user as 'ты' (informal) at all times.";

    /** Threads for the parallel memory fetches. */
    @Min(3)
    private int loaderThreads = 6;

    /** Loader queue bound; further submissions are rejected. */
    @Min(1)
    private int loaderQueueCapacity = 64;

    @NotNull
    private OnFailure onFailure = OnFailure.EMPTY_CONTEXT;

    public int getHistoryFetchLimit() {
        return historyFetchLimit;
    }

    public void setHistoryFetchLimit(int historyFetchLimit) {
        this.historyFetchLimit = historyFetchLimit;
    }

    public int getReplayLimit() {
        return replayLimit;
    }

    public void setReplayLimit(int replayLimit) {
        this.replayLimit = replayLimit;
    }

    public String getGreetingInstruction() {
        return greetingInstruction;
    }

    public void setGreetingInstruction(String greetingInstruction) {
        this.greetingInstruction = greetingInstruction;
    }

    public int getLoaderThreads() {
        return loaderThreads;
    }

    public void setLoaderThreads(int loaderThreads) {
        this.loaderThreads = loaderThreads;
    }

    public int getLoaderQueueCapacity() {
        return loaderQueueCapacity;
    }

    public void setLoaderQueueCapacity(int loaderQueueCapacity) {
        this.loaderQueueCapacity = loaderQueueCapacity;
    }

    public OnFailure getOnFailure() {
        return onFailure;
    }

    public void setOnFailure(OnFailure onFailure) {
        this.onFailure = onFailure;
    }
}
