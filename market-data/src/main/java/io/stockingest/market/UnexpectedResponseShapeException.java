package io.stockingest.market;

public class UnexpectedResponseShapeException extends IngestException {
    public UnexpectedResponseShapeException(String message) {
        super(message);
    }
}
