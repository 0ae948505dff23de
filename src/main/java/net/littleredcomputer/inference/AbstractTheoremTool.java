package net.littleredcomputer.inference;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Step counting and periodic progress logging shared by the provers and model builders.
 */
public abstract class AbstractTheoremTool {
    private static final Logger log = LogManager.getFormatterLogger(AbstractTheoremTool.class);
    protected static final int logCheckSteps = 1000;
    protected long stepCount;
    private long lastStepCount;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    protected AbstractTheoremTool(String name) {
        this.name = name;
    }

    public String name() { return name; }

    public void setLogInterval(Duration interval) { logInterval = interval; }

    protected void start() {
        stopwatch.reset().start();
        stepCount = 0;
        lastStepCount = 0;
        lastLogTime = Instant.now();
    }

    protected void stop() {
        if (stopwatch.isRunning()) stopwatch.stop();
    }

    /**
     * @return the number of steps taken by the most recent run
     */
    public long steps() { return stepCount; }

    protected Stopwatch stopwatch() { return stopwatch; }

    protected void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }
}
