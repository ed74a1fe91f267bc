package fr.imt.pbdeployer.business.model;

import lombok.Getter;

import java.util.concurrent.CompletableFuture;

/**
 * Reference to a background operation. The completion future always completes,
 * normally or exceptionally, once the operation reached its terminal state.
 */
@Getter
public class OperationHandle {

    private final String id;
    private final OperationKind kind;
    private final String targetId;
    private final OperationContext context;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    public OperationHandle(String id, OperationKind kind, String targetId, OperationContext context) {
        this.id = id;
        this.kind = kind;
        this.targetId = targetId;
        this.context = context;
    }

    public String getSubscription() {
        return kind.subscription(targetId);
    }

    public boolean cancel(String reason) {
        return context.getToken().cancel(reason);
    }

    public boolean isDone() {
        return completion.isDone();
    }
}
