package io.marketminer.spi;

public class QueueAlreadyExistsException extends RuntimeException {

    private final String queueName;

    public QueueAlreadyExistsException(String queueName, Throwable cause) {
        super("Dispatch queue already exists: " + queueName, cause);
        this.queueName = queueName;
    }

    public QueueAlreadyExistsException(String queueName) {
        this(queueName, null);
    }

    public String getQueueName() {
        return queueName;
    }
}
