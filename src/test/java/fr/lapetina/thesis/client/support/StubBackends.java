package fr.lapetina.thesis.client.support;

import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.domain.model.BackendReply;
import fr.lapetina.thesis.client.domain.model.ChatMessage;
import fr.lapetina.thesis.client.domain.model.GenerationOptions;
import fr.lapetina.thesis.client.infrastructure.http.BackendFactory;
import fr.lapetina.thesis.client.infrastructure.http.BackendHandle;
import fr.lapetina.thesis.client.infrastructure.http.ChatBackend;
import fr.lapetina.thesis.client.infrastructure.http.GenerateBackend;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hand-written backend stubs. Replies are scripted per call; once the script runs out
 * the default reply is returned.
 */
public final class StubBackends {

    private StubBackends() {
    }

    /**
     * One scripted step: either a reply or an exception to throw.
     */
    public interface Step {
        BackendReply run() throws IOException, InterruptedException;
    }

    public static Step reply(String content) {
        return () -> BackendReply.of(content);
    }

    public static Step fail(IOException error) {
        return () -> {
            throw error;
        };
    }

    /**
     * Waits, then runs the given step.
     */
    public static Step slow(Duration delay, Step then) {
        return () -> {
            Thread.sleep(delay.toMillis());
            return then.run();
        };
    }

    public static Step empty() {
        return () -> BackendReply.of("   ");
    }

    public abstract static class ScriptedHandle implements BackendHandle {
        private final String id;
        private final List<Step> script = new CopyOnWriteArrayList<>();
        private final AtomicInteger calls = new AtomicInteger();
        private volatile Step defaultStep = reply("Default test response");
        private volatile boolean closed;

        ScriptedHandle(String id) {
            this.id = id;
        }

        public void script(Step... steps) {
            script.addAll(List.of(steps));
        }

        public void setDefault(Step step) {
            this.defaultStep = step;
        }

        BackendReply next() throws IOException, InterruptedException {
            int index = calls.getAndIncrement();
            Step step = index < script.size() ? script.get(index) : defaultStep;
            return step.run();
        }

        public int getCalls() {
            return calls.get();
        }

        public boolean isClosed() {
            return closed;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    public static final class StubChatBackend extends ScriptedHandle implements ChatBackend {
        private final List<List<ChatMessage>> requests = new CopyOnWriteArrayList<>();

        public StubChatBackend(String id) {
            super(id);
        }

        @Override
        public BackendReply chat(List<ChatMessage> messages, GenerationOptions options)
                throws IOException, InterruptedException {
            requests.add(List.copyOf(messages));
            return next();
        }

        public List<List<ChatMessage>> getRequests() {
            return requests;
        }

        public List<ChatMessage> lastRequest() {
            return requests.get(requests.size() - 1);
        }
    }

    public static final class StubGenerateBackend extends ScriptedHandle implements GenerateBackend {
        private final List<String> prompts = new CopyOnWriteArrayList<>();

        public StubGenerateBackend(String id) {
            super(id);
        }

        @Override
        public BackendReply generate(String prompt, GenerationOptions options)
                throws IOException, InterruptedException {
            prompts.add(prompt);
            return next();
        }

        public List<String> getPrompts() {
            return prompts;
        }
    }

    /**
     * Factory recording every handle it creates. Can be told to fail after a number of creations.
     */
    public static final class StubBackendFactory implements BackendFactory {
        private final List<ScriptedHandle> created = new CopyOnWriteArrayList<>();
        private final AtomicInteger sequence = new AtomicInteger();
        private volatile int failAfter = Integer.MAX_VALUE;
        private volatile Step defaultStep = reply("Default test response");

        @Override
        public BackendHandle create(BackendKind kind) {
            int n = sequence.incrementAndGet();
            if (n > failAfter) {
                throw new IllegalStateException("Backend unavailable");
            }
            ScriptedHandle handle = kind == BackendKind.OPENAI
                    ? new StubChatBackend("openai-" + n)
                    : new StubGenerateBackend("gemini-" + n);
            handle.setDefault(defaultStep);
            created.add(handle);
            return handle;
        }

        public void failAfter(int creations) {
            this.failAfter = creations;
        }

        public void setDefault(Step step) {
            this.defaultStep = step;
            created.forEach(h -> h.setDefault(step));
        }

        public List<ScriptedHandle> getCreated() {
            return new ArrayList<>(created);
        }

        public int getCreatedCount() {
            return created.size();
        }
    }
}
