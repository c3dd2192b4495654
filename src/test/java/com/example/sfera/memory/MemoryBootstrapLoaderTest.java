package com.example.sfera.memory;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ChatMessageType;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryBootstrapLoaderTest {

    private static final String GREETING = "Greet the user.";

    private UserStateStore userStateStore;
    private SummaryStore summaryStore;
    private VectorMemoryStore vectorMemoryStore;
    private ExecutorService executor;
    private MemoryBootstrapLoader loader;

    @BeforeEach
    void setUp() {
        userStateStore = mock(UserStateStore.class);
        summaryStore = mock(SummaryStore.class);
        vectorMemoryStore = mock(VectorMemoryStore.class);
        executor = Executors.newFixedThreadPool(3);
        loader = new MemoryBootstrapLoader(userStateStore, summaryStore, vectorMemoryStore, executor, 30, 10, GREETING);

        when(userStateStore.formatForPrompt("u1")).thenReturn("P");
        when(summaryStore.getLastSummary("u1")).thenReturn(Optional.empty());
        when(vectorMemoryStore.queryAll(anyMap(), anyInt())).thenReturn(List.of());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void userWithoutHistoryGetsGreetingOnly() {
        BootstrapContext ctx = loader.load("u1");

        assertThat(ctx.initialMessages()).hasSize(1);
        assertThat(ctx.initialMessages().get(0)).isInstanceOf(SystemMessage.class);
        assertThat(((SystemMessage) ctx.initialMessages().get(0)).text()).isEqualTo(GREETING);
        assertThat(ctx.coreMemory()).isEqualTo("P");
        assertThat(ctx.episodicMemory()).isEmpty();
        assertThat(ctx.hasEpisodicMemory()).isFalse();
        assertThat(ctx.recentRecords()).isEmpty();
    }

    @Test
    void queriesHistoryByUserWithFetchLimit() {
        loader.load("u1");

        verify(vectorMemoryStore).queryAll(eq(Map.of("user_id", "u1")), eq(30));
    }

    @Test
    void replaysLastTenOfTwelveTurnsInOrderThenGreeting() {
        List<Map<String, Object>> history = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            history.add(turn(i % 2 == 1 ? "user" : "assistant", "turn " + i));
        }
        when(vectorMemoryStore.queryAll(anyMap(), anyInt())).thenReturn(history);

        BootstrapContext ctx = loader.load("u1");

        List<ChatMessage> messages = ctx.initialMessages();
        assertThat(messages).hasSize(11);
        for (int i = 0; i < 10; i++) {
            assertThat(textOf(messages.get(i))).isEqualTo("turn " + (i + 3));
        }
        assertThat(messages.get(0)).isInstanceOf(UserMessage.class);
        assertThat(messages.get(1)).isInstanceOf(AiMessage.class);
        assertThat(messages.get(10).type()).isEqualTo(ChatMessageType.SYSTEM);
        assertThat(ctx.recentRecords()).hasSize(12);
    }

    @Test
    void systemRoleAndEmptyContentAreSkippedWithoutAbortingTheRest() {
        when(vectorMemoryStore.queryAll(anyMap(), anyInt())).thenReturn(List.of(
                turn("user", "hello"),
                turn("system", "internal note"),
                turn("assistant", ""),
                turn("assistant", "hi there")));

        BootstrapContext ctx = loader.load("u1");

        assertThat(ctx.initialMessages()).extracting(MemoryBootstrapLoaderTest::textOf)
                .containsExactly("hello", "hi there", GREETING);
    }

    @Test
    void malformedRecordsAreSkipped() {
        Map<String, Object> listContent = new HashMap<>();
        listContent.put("role", "user");
        listContent.put("content", List.of("not", "text"));
        Map<String, Object> nullRole = new HashMap<>();
        nullRole.put("role", null);
        nullRole.put("content", "x");
        List<Map<String, Object>> history = new ArrayList<>();
        history.add(turn("user", "first"));
        history.add(null);
        history.add(listContent);
        history.add(nullRole);
        history.add(turn("assistant", "last"));
        when(vectorMemoryStore.queryAll(anyMap(), anyInt())).thenReturn(history);

        BootstrapContext ctx = loader.load("u1");

        assertThat(ctx.initialMessages()).extracting(MemoryBootstrapLoaderTest::textOf)
                .containsExactly("first", "last", GREETING);
        assertThat(ctx.recentRecords()).hasSize(5);
    }

    @Test
    void missingRoleDefaultsToUser() {
        when(vectorMemoryStore.queryAll(anyMap(), anyInt())).thenReturn(List.of(Map.of("content", "no role")));

        BootstrapContext ctx = loader.load("u1");

        assertThat(ctx.initialMessages().get(0)).isInstanceOf(UserMessage.class);
    }

    @Test
    void summaryIsFramedAsEpisodicMemory() {
        when(summaryStore.getLastSummary("u1")).thenReturn(Optional.of("We talked about BTC."));

        BootstrapContext ctx = loader.load("u1");

        assertThat(ctx.episodicMemory())
                .startsWith("# EPISODIC MEMORY (LAST SESSION SUMMARY)\n")
                .contains("[SYSTEM NOTE: Use this to continue the conversation naturally.]")
                .endsWith("\nWe talked about BTC.");
        assertThat(ctx.hasEpisodicMemory()).isTrue();
    }

    @Test
    void blankSummaryIsTreatedAsAbsent() {
        when(summaryStore.getLastSummary("u1")).thenReturn(Optional.of("   "));

        assertThat(loader.load("u1").episodicMemory()).isEmpty();
    }

    @Test
    void nullProfileBecomesEmptyString() {
        when(userStateStore.formatForPrompt("u1")).thenReturn(null);

        assertThat(loader.load("u1").coreMemory()).isEmpty();
    }

    @Test
    void failingSourceFailsTheWholeLoadButOthersStillRun() {
        when(vectorMemoryStore.queryAll(anyMap(), anyInt())).thenThrow(new IllegalStateException("qdrant down"));

        assertThatThrownBy(() -> loader.load("u1"))
                .isInstanceOf(MemoryLoadException.class)
                .hasMessageContaining("u1")
                .hasRootCauseInstanceOf(IllegalStateException.class)
                .satisfies(e -> assertThat(((MemoryLoadException) e).getUserId()).isEqualTo("u1"));

        verify(userStateStore).formatForPrompt("u1");
        verify(summaryStore).getLastSummary("u1");
    }

    @Test
    void sourcesAreFetchedConcurrently() {
        CountDownLatch allStarted = new CountDownLatch(3);
        when(userStateStore.formatForPrompt("u1")).thenAnswer(inv -> awaitOthers(allStarted) ? "P" : "timeout");
        when(summaryStore.getLastSummary("u1")).thenAnswer(inv -> awaitOthers(allStarted)
                ? Optional.of("S") : Optional.empty());
        when(vectorMemoryStore.queryAll(anyMap(), anyInt())).thenAnswer(inv -> awaitOthers(allStarted)
                ? List.of(turn("user", "hi")) : List.of());

        BootstrapContext ctx = loader.load("u1");

        assertThat(ctx.coreMemory()).isEqualTo("P");
        assertThat(ctx.episodicMemory()).endsWith("S");
        assertThat(ctx.recentRecords()).hasSize(1);
    }

    @Test
    void emptyContextHoldsGreetingOnly() {
        BootstrapContext ctx = loader.emptyContext();

        assertThat(ctx.initialMessages()).extracting(MemoryBootstrapLoaderTest::textOf).containsExactly(GREETING);
        assertThat(ctx.coreMemory()).isEmpty();
        assertThat(ctx.episodicMemory()).isEmpty();
    }

    private static boolean awaitOthers(CountDownLatch latch) throws InterruptedException {
        latch.countDown();
        return latch.await(5, TimeUnit.SECONDS);
    }

    private static Map<String, Object> turn(String role, String content) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", role);
        m.put("content", content);
        m.put("user_id", "u1");
        return m;
    }

    private static String textOf(ChatMessage m) {
        if (m instanceof UserMessage um) return um.singleText();
        if (m instanceof AiMessage am) return am.text();
        if (m instanceof SystemMessage sm) return sm.text();
        return String.valueOf(m);
    }
}
