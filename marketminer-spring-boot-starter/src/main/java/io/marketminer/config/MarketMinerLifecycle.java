package io.marketminer.config;

import io.marketminer.internal.QueuedJobReconciler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges reconciler start/stop with the Spring container lifecycle.
 */
public class MarketMinerLifecycle implements SmartLifecycle {
    private final QueuedJobReconciler reconciler;

    public MarketMinerLifecycle(QueuedJobReconciler reconciler) {
        this.reconciler = reconciler;
    }

    @Override
    public void start() {
        reconciler.start();
    }

    @Override
    public void stop() {
        reconciler.stop();
    }

    @Override
    public boolean isRunning() {
        return reconciler.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
