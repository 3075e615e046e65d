package io.walletmanager.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/** Admin RPC request timings, sharing the manager's registry so one scrape covers both. */
public final class HttpMetrics {
    private static final MeterRegistry REGISTRY = ManagerMetrics.registry();

    private HttpMetrics() {}

    public static Timer.Sample start() {
        return Timer.start(REGISTRY);
    }

    public static void stop(Timer.Sample sample, String method, String endpoint, int status) {
        Timer timer = Timer
                .builder("manager.rpc.requests")
                .description("Admin RPC request duration")
                .tag("method", method)
                .tag("endpoint", endpoint)
                .tag("outcome", outcome(status))
                .tag("status", Integer.toString(status))
                .register(REGISTRY);
        sample.stop(timer);
    }

    static String outcome(int status) {
        if (status >= 500) return "server_error";
        if (status == 401 || status == 403) return "denied";
        if (status >= 400) return "client_error";
        return "success";
    }
}
