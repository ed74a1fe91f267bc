package fr.imt.pbdeployer.business.model;

import java.util.concurrent.atomic.AtomicReference;

public class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();

    public boolean cancel(String why) {
        return reason.compareAndSet(null, why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }
}
