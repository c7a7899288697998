package club.ppmc.remote.service;

import java.time.Duration;
import java.util.function.BooleanSupplier;

public final class Waits {

    private Waits() {}

    public static boolean waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}
