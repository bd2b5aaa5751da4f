package in.warmguard.support;

import in.warmguard.application.port.output.AutomationContext;
import in.warmguard.application.port.output.AutomationEngine;
import in.warmguard.domain.session.ContextOptions;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Engine double recording every context it opens.
 */
public final class FakeAutomationEngine implements AutomationEngine {

    public final List<FakeContext> opened = new CopyOnWriteArrayList<>();
    public final AtomicInteger starts = new AtomicInteger();
    public final AtomicInteger shutdowns = new AtomicInteger();
    private volatile boolean running;
    private volatile RuntimeException failNextContext;
    private volatile boolean loggedIn = true;

    @Override
    public void start() {
        starts.incrementAndGet();
        running = true;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public AutomationContext newContext(ContextOptions options) {
        RuntimeException failure = failNextContext;
        if (failure != null) {
            failNextContext = null;
            throw failure;
        }
        FakeContext context = new FakeContext(options);
        context.setLoggedIn(loggedIn);
        opened.add(context);
        return context;
    }

    @Override
    public void shutdown() {
        shutdowns.incrementAndGet();
        running = false;
    }

    public void failNextContext(RuntimeException failure) {
        this.failNextContext = failure;
    }

    /**
     * Login state of contexts opened from now on.
     */
    public void setLoggedIn(boolean loggedIn) {
        this.loggedIn = loggedIn;
    }

    public static final class FakeContext implements AutomationContext {
        private final ContextOptions options;
        private volatile boolean closed;
        private volatile String state;
        private volatile RuntimeException closeFailure;
        private volatile boolean loggedIn = true;
        private volatile RuntimeException loginCheckFailure;

        FakeContext(ContextOptions options) {
            this.options = options;
            this.state = options.storageState() != null
                ? options.storageState()
                : "{\"cookies\":[{\"name\":\"sid\",\"value\":\"" + options.accountId() + "\"}]}";
        }

        public ContextOptions options() {
            return options;
        }

        public boolean isClosed() {
            return closed;
        }

        public void setState(String state) {
            this.state = state;
        }

        public void failOnClose(RuntimeException failure) {
            this.closeFailure = failure;
        }

        public void setLoggedIn(boolean loggedIn) {
            this.loggedIn = loggedIn;
        }

        public void failLoginCheck(RuntimeException failure) {
            this.loginCheckFailure = failure;
        }

        @Override
        public boolean isLoggedIn() {
            if (loginCheckFailure != null) {
                throw loginCheckFailure;
            }
            return loggedIn;
        }

        @Override
        public String storageState() {
            return state;
        }

        @Override
        public void close() {
            closed = true;
            if (closeFailure != null) {
                throw closeFailure;
            }
        }
    }
}
