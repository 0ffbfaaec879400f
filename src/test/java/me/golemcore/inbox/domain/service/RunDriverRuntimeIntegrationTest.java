package me.golemcore.inbox.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.inbox.adapter.outbound.llm.LlmAgentRuntimeAdapter;
import me.golemcore.inbox.adapter.outbound.queue.InMemoryStatusQueueAdapter;
import me.golemcore.inbox.domain.model.ConversationThread;
import me.golemcore.inbox.domain.model.LongRunningProcess;
import me.golemcore.inbox.domain.model.ProcessStatus;
import me.golemcore.inbox.domain.model.ProcessStatusEvent;
import me.golemcore.inbox.infrastructure.config.InboxProperties;
import me.golemcore.inbox.tools.CheckProcessInboxTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Chat turns driven against the in-memory agent runtime, with real tool
 * dispatch and, where needed, a running status reconciler.
 */
class RunDriverRuntimeIntegrationTest {

    private static final String FINAL_ANSWER = "Nothing new in the inbox yet.";

    private ObjectMapper objectMapper;
    private InboxProperties properties;
    private ProcessRegistry registry;
    private ChatModel chatModel;
    private ExecutorService runtimeExecutor;
    private LlmAgentRuntimeAdapter runtime;
    private RunDriver runDriver;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        properties = new InboxProperties();
        properties.getRun().setInitialPollInterval(Duration.ofMillis(1));
        properties.getRun().setMaxPollInterval(Duration.ofMillis(5));
        properties.getRun().setTimeout(Duration.ofSeconds(5));
        properties.getReconciler().setMaxWait(Duration.ofMillis(50));
        registry = new ProcessRegistry(Clock.systemUTC());
        chatModel = mock(ChatModel.class);
        runtimeExecutor = Executors.newFixedThreadPool(4);
        runtime = new LlmAgentRuntimeAdapter(chatModel, objectMapper, runtimeExecutor, properties,
                new DefaultResourceLoader(), Clock.systemUTC());
        ToolDispatcher dispatcher = new ToolDispatcher(
                List.of(new CheckProcessInboxTool(registry, objectMapper, properties)),
                mock(LongRunningProcessLauncher.class), properties);
        runDriver = new RunDriver(runtime, dispatcher, properties, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        runtimeExecutor.shutdownNow();
    }

    private void answerWithToolCallsThenText(ToolExecutionRequest... requests) {
        when(chatModel.chat(any(ChatRequest.class))).thenAnswer(invocation -> {
            ChatRequest request = invocation.getArgument(0);
            ChatMessage last = request.messages().get(request.messages().size() - 1);
            if (last instanceof ToolExecutionResultMessage) {
                return ChatResponse.builder().aiMessage(AiMessage.from(FINAL_ANSWER)).build();
            }
            return ChatResponse.builder().aiMessage(AiMessage.from(requests)).build();
        });
    }

    private static ToolExecutionRequest toolRequest(String id, String name) {
        return ToolExecutionRequest.builder().id(id).name(name).arguments("{}").build();
    }

    // ==================== tool failures ====================

    @Test
    void shouldFinishTurnWhenOneOfSeveralToolCallsFails() {
        answerWithToolCallsThenText(
                toolRequest("call-1", CheckProcessInboxTool.TOOL_NAME),
                toolRequest("call-2", "hallucinated_tool"));
        ConversationThread thread = runtime.createThread();

        String answer = runDriver.runTurn(thread.id(), "Any news on my approvals?");

        assertEquals(FINAL_ANSWER, answer);
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel, atLeast(2)).chat(captor.capture());
        List<ChatMessage> followUp = captor.getValue().messages();
        List<ToolExecutionResultMessage> results = followUp.stream()
                .filter(ToolExecutionResultMessage.class::isInstance)
                .map(ToolExecutionResultMessage.class::cast)
                .toList();
        assertEquals(2, results.size());
        assertEquals("[]", results.get(0).text());
        assertTrue(results.get(1).text().startsWith("Error: UNKNOWN_TOOL"));
    }

    // ==================== concurrency ====================

    @Test
    void shouldKeepRegistryConsistentWhileTurnsAndEventsInterleave() throws Exception {
        answerWithToolCallsThenText(toolRequest("call-1", CheckProcessInboxTool.TOOL_NAME));
        StatusEventCodec codec = new StatusEventCodec(objectMapper);
        InMemoryStatusQueueAdapter queue = new InMemoryStatusQueueAdapter(properties, Clock.systemUTC());
        StatusReconciler reconciler = new StatusReconciler(queue, codec, registry, properties);

        int turns = 6;
        int processes = 4;
        for (int i = 0; i < processes; i += 2) {
            registry.create("p-" + i);
        }
        ExecutorService workers = Executors.newFixedThreadPool(turns + processes);
        CountDownLatch startGate = new CountDownLatch(1);
        try {
            reconciler.start();
            List<Future<String>> answers = new ArrayList<>();
            for (int i = 0; i < turns; i++) {
                String threadId = runtime.createThread().id();
                answers.add(workers.submit(() -> {
                    startGate.await();
                    return runDriver.runTurn(threadId, "Check my inbox");
                }));
            }
            List<Future<?>> publishers = new ArrayList<>();
            for (int i = 0; i < processes; i++) {
                String processId = "p-" + i;
                String decision = "Approve-" + i;
                publishers.add(workers.submit(() -> {
                    startGate.await();
                    queue.send(codec.encode(new ProcessStatusEvent(processId, ProcessStatus.RUNNING, Map.of())));
                    queue.send(codec.encode(new ProcessStatusEvent(processId, ProcessStatus.REQUIRES_ACTION,
                            Map.of("action", "USA or UK?"))));
                    queue.send(codec.encode(new ProcessStatusEvent(processId, ProcessStatus.COMPLETED,
                            Map.of("decision", decision))));
                    queue.send(codec.encode(new ProcessStatusEvent(processId, ProcessStatus.RUNNING, Map.of())));
                    return null;
                }));
            }

            startGate.countDown();
            for (Future<String> answer : answers) {
                assertEquals(FINAL_ANSWER, answer.get(10, TimeUnit.SECONDS));
            }
            for (Future<?> publisher : publishers) {
                publisher.get(10, TimeUnit.SECONDS);
            }

            assertTrue(waitFor(() -> registry.listAll().stream()
                    .filter(process -> process.getStatus() == ProcessStatus.COMPLETED)
                    .count() == processes));
            // the trailing running event of each process must have been applied and ignored
            Thread.sleep(200);
            assertEquals(processes, registry.size());
            for (int i = 0; i < processes; i++) {
                LongRunningProcess process = registry.get("p-" + i).orElseThrow();
                assertEquals(ProcessStatus.COMPLETED, process.getStatus());
                assertEquals(Map.of("decision", "Approve-" + i), process.getMessage());
            }
        } finally {
            reconciler.shutdown();
            workers.shutdownNow();
        }
    }

    private static boolean waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }
}
