package io.trading.optionchain.core;

/**
 * Notified after every sampling cycle.
 */
public interface CycleObserver {

    CycleObserver NONE = new CycleObserver() {
        @Override
        public void onCycle(int rows, long durationMicros) {
        }

        @Override
        public void onCycleFailed() {
        }
    };

    void onCycle(int rows, long durationMicros);

    void onCycleFailed();
}
