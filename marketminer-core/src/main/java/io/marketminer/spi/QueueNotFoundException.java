package io.marketminer.spi;

public class QueueNotFoundException extends RuntimeException {

    private final String queueName;

    public QueueNotFoundException(String queueName) {
        super("Dispatch queue does not exist: " + queueName);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
