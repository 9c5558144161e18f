package com.bringabrain.link.ble.runtime;

import com.bringabrain.link.api.TransportListener;
import com.bringabrain.link.ble.config.TransportConfig;
import com.bringabrain.link.ble.joiner.JoinerConnectionManager;
import com.bringabrain.link.ble.internal.exec.NettySerialContext;
import com.bringabrain.link.ble.internal.time.SystemWallClock;
import com.bringabrain.link.ble.internal.time.WallClock;
import com.bringabrain.link.ble.observability.NullObservabilitySink;
import com.bringabrain.link.ble.observability.TransportErrorEvent;
import com.bringabrain.link.ble.observability.TransportObservabilitySink;
import com.bringabrain.link.ble.platform.CentralPort;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * JoinerSessionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one joined session.
 *
 * <p>Owns the serialized execution context the {@link JoinerConnectionManager}
 * runs on. The platform binding supplies the {@link CentralPort}.</p>
 */
public final class JoinerSessionRuntime implements AutoCloseable {
    private final JoinerConnectionManager manager;
    private final NettySerialContext context;
    private final TransportObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private JoinerSessionRuntime(JoinerConnectionManager manager,
                                 NettySerialContext context,
                                 TransportObservabilitySink observabilitySink,
                                 WallClock wallClock) {
        this.manager = manager;
        this.context = context;
        this.observabilitySink = observabilitySink;
        this.wallClock = wallClock;
    }

    public JoinerConnectionManager manager() {
        return manager;
    }

    /**
     * Stop scanning, release the host connection, and stop the execution context.
     */
    @Override
    public void close() {
        manager.close();
        context.shutdown();
        try {
            if (!context.awaitTermination(5, TimeUnit.SECONDS)) {
                observabilitySink.onError(new TransportErrorEvent(wallClock.now(), "Joiner context did not terminate", null));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TransportConfig config = TransportConfig.defaults();
        private CentralPort port;
        private TransportListener listener;
        private TransportObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private String threadName = "bab-joiner";

        public Builder withConfig(TransportConfig config) {
            this.config = config;
            return this;
        }

        public Builder withPort(CentralPort port) {
            this.port = port;
            return this;
        }

        public Builder withListener(TransportListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder withObservabilitySink(TransportObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withThreadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        public JoinerSessionRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(port, "port");
            Objects.requireNonNull(listener, "listener");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(wallClock, "wallClock");

            NettySerialContext context = new NettySerialContext(threadName, observabilitySink, wallClock);
            JoinerConnectionManager manager = new JoinerConnectionManager(
                config, port, listener, context, observabilitySink, wallClock);

            return new JoinerSessionRuntime(manager, context, observabilitySink, wallClock);
        }
    }
}
