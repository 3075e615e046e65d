package io.walletmanager.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.walletmanager.core.protocol.RejectionReason;

import java.util.Locale;
import java.util.function.Supplier;

public final class ManagerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter upgrades = registry.counter("manager.upgrades");
    private static final Counter moduleInits = registry.counter("manager.module.inits");
    private static final Counter featureSetsAdded = registry.counter("manager.featuresets.added");
    private static final Counter storageInvocations = registry.counter("manager.storage.invocations");
    private static final Counter accountInvocations = registry.counter("manager.account.invocations");
    private static final Counter staticCalls = registry.counter("manager.static.calls");
    private static final Timer upgradeTime = registry.timer("manager.upgrade.time");

    private ManagerMetrics() {}

    public static <T> T recordUpgrade(Supplier<T> upgradeLogic) {
        return upgradeTime.record(upgradeLogic);
    }

    public static void incrementUpgrades() { upgrades.increment(); }
    public static void incrementModuleInits(int count) { moduleInits.increment(count); }
    public static void incrementFeatureSets() { featureSetsAdded.increment(); }
    public static void incrementStorageInvocations() { storageInvocations.increment(); }
    public static void incrementAccountInvocations() { accountInvocations.increment(); }
    public static void incrementStaticCalls() { staticCalls.increment(); }

    public static void recordRejection(RejectionReason reason) {
        Counter.builder("manager.rejections")
                .description("Privileged calls refused by the version manager")
                .tag("reason", reason.code())
                .tag("kind", reason.kind().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public static double rejections(RejectionReason reason) {
        Counter c = registry.find("manager.rejections").tag("reason", reason.code()).counter();
        return c == null ? 0.0 : c.count();
    }

    public static double upgradeCount() {
        return upgrades.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                for (Tag tag : m.getId().getTags()) {
                    sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
                }
                sb.append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
