package io.ledgersim.core.metrics;

import io.ledgersim.core.validation.ProtocolError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;

public class EmulatorMetrics {
    private final MeterRegistry registry;
    private final Counter submitted;
    private final Counter applied;
    private final Counter dropped;
    private final Counter blocksProduced;
    private final Timer productionTime;

    public EmulatorMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.submitted = Counter.builder("emulator.tx.submitted")
                .description("Transactions offered to the mempool")
                .register(registry);
        this.applied = Counter.builder("emulator.tx.applied")
                .description("Transactions applied to the ledger")
                .register(registry);
        this.dropped = Counter.builder("emulator.tx.dropped")
                .description("Queued transactions that failed re-validation while draining")
                .register(registry);
        this.blocksProduced = registry.counter("emulator.blocks.produced");
        this.productionTime = registry.timer("emulator.block.production.time");
    }

    public EmulatorMetrics() {
        this(new SimpleMeterRegistry());
    }

    public void recordSubmitted() {
        submitted.increment();
    }

    public void recordRejected(ProtocolError code) {
        registry.counter("emulator.tx.rejected", "code", code.name()).increment();
    }

    public void recordApplied(int count) {
        applied.increment(count);
    }

    public void recordDropped(int count) {
        dropped.increment(count);
    }

    public <T> T recordProduction(Supplier<T> blockProductionLogic) {
        T result = productionTime.record(blockProductionLogic);
        blocksProduced.increment();
        return result;
    }

    public <T> void gaugeMempool(T mempool, ToDoubleFunction<T> size) {
        Gauge.builder("emulator.mempool.size", mempool, size)
                .description("Transactions waiting for a block")
                .register(registry);
    }

    public String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
